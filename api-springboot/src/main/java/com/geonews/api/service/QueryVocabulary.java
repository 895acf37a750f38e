package com.geonews.api.service;

import com.geonews.api.config.GeoNewsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Known category, source and place names, matched against query text token by token.
 */
@Component
public class QueryVocabulary {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’][\\p{L}]+)?");

    private final List<String> categories;
    private final List<String> sources;
    private final List<String> locations;
    private final Map<String, String> sourceAliases;

    @Autowired
    public QueryVocabulary(GeoNewsProperties properties) {
        this(properties.getIntent().getCategories(),
                properties.getIntent().getSources(),
                properties.getIntent().getLocations(),
                properties.getIntent().getSourceAliases());
    }

    public QueryVocabulary(Collection<String> categories, Collection<String> sources, Collection<String> locations) {
        this(categories, sources, locations, Map.of());
    }

    public QueryVocabulary(Collection<String> categories, Collection<String> sources, Collection<String> locations,
                           Map<String, String> sourceAliases) {
        this.categories = List.copyOf(categories);
        this.sources = List.copyOf(sources);
        this.locations = List.copyOf(locations);
        this.sourceAliases = new LinkedHashMap<>();
        sourceAliases.forEach((alias, source) -> this.sourceAliases.put(alias.toLowerCase(Locale.ROOT), source));
    }

    public List<String> getCategories() {
        return categories;
    }

    public List<String> getSources() {
        return sources;
    }

    /**
     * Word tokens of the text, keeping their original spelling and offsets
     */
    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), matcher.start()));
        }
        return tokens;
    }

    public Optional<Match> findCategory(List<Token> tokens) {
        return firstMatch(tokens, categories);
    }

    /**
     * First source named in the text, by full name or alias. The match carries the full name.
     */
    public Optional<Match> findSource(List<Token> tokens) {
        List<String> names = new ArrayList<>(sources);
        names.addAll(sourceAliases.keySet());
        return firstMatch(tokens, names)
                .map(m -> new Match(canonicalSource(m.canonical()), m.text(), m.offset()));
    }

    public List<Match> findLocations(List<Token> tokens) {
        return allMatches(tokens, locations);
    }

    public boolean isCategory(String text) {
        return categories.stream().anyMatch(c -> c.equalsIgnoreCase(text));
    }

    public boolean isSource(String text) {
        return text != null && (sources.stream().anyMatch(s -> s.equalsIgnoreCase(text))
                || sourceAliases.containsKey(text.toLowerCase(Locale.ROOT)));
    }

    private String canonicalSource(String name) {
        return sourceAliases.getOrDefault(name.toLowerCase(Locale.ROOT), name);
    }

    /**
     * True when any of the phrases occurs in the token stream
     */
    public static boolean containsAny(List<Token> tokens, Collection<String> phrases) {
        return phrases.stream().anyMatch(phrase -> indexOf(tokens, phrase, 0) >= 0);
    }

    /**
     * Index of the first token where the phrase starts at or after {@code from}, or -1
     */
    static int indexOf(List<Token> tokens, String phrase, int from) {
        String[] words = phrase.toLowerCase(Locale.ROOT).trim().split("\\s+");
        outer:
        for (int i = from; i + words.length <= tokens.size(); i++) {
            for (int j = 0; j < words.length; j++) {
                if (!tokens.get(i + j).lower().equals(words[j])) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private Optional<Match> firstMatch(List<Token> tokens, List<String> phrases) {
        return allMatches(tokens, phrases).stream().findFirst();
    }

    private List<Match> allMatches(List<Token> tokens, List<String> phrases) {
        List<Match> matches = new ArrayList<>();
        for (String phrase : phrases) {
            int length = phrase.trim().split("\\s+").length;
            int at = indexOf(tokens, phrase, 0);
            while (at >= 0) {
                matches.add(new Match(phrase, span(tokens, at, length), tokens.get(at).offset()));
                at = indexOf(tokens, phrase, at + length);
            }
        }
        // longest phrase wins when two matches start at the same token ("New Delhi" over "Delhi")
        matches.sort((a, b) -> a.offset() != b.offset()
                ? Integer.compare(a.offset(), b.offset())
                : Integer.compare(b.text().length(), a.text().length()));
        List<Match> distinct = new ArrayList<>();
        int coveredUntil = -1;
        for (Match match : matches) {
            if (match.offset() >= coveredUntil) {
                distinct.add(match);
                coveredUntil = match.offset() + match.text().length();
            }
        }
        return distinct;
    }

    private static String span(List<Token> tokens, int start, int length) {
        return tokens.subList(start, start + length).stream()
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }

    public record Token(String text, int offset) {

        public String lower() {
            return text.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * A vocabulary entry found in the text: canonical form, text as written, character offset
     */
    public record Match(String canonical, String text, int offset) {
    }
}
