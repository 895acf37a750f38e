package com.geonews.indexer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonews.indexer.model.ArticleDocument;
import com.geonews.indexer.model.NewsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON array of news records into indexable documents
 */
public class SeedFileReader {

    private static final Logger logger = LoggerFactory.getLogger(SeedFileReader.class);

    private final ObjectMapper objectMapper;

    public SeedFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ArticleDocument> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    /**
     * Records without an id or title, or with an unreadable publication date, are skipped with a warning
     */
    public List<ArticleDocument> read(InputStream in) throws IOException {
        List<NewsRecord> records = objectMapper.readValue(in, new TypeReference<List<NewsRecord>>() {
        });

        List<ArticleDocument> documents = new ArrayList<>();
        for (NewsRecord record : records) {
            if (!record.isIndexable()) {
                logger.warn("Skipping record without id or title: {}", record.getUrl());
                continue;
            }
            try {
                documents.add(record.toDocument());
            } catch (DateTimeParseException e) {
                logger.warn("Skipping record {} with unreadable publication date '{}'",
                        record.getId(), record.getPublicationDate());
            }
        }

        logger.info("Read {} of {} records", documents.size(), records.size());
        return documents;
    }
}
