package com.geonews.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {"geonews.nlp.api-key=", "geonews.simulator.seed=7", "geonews.kafka.enabled=false"})
class GeoNewsApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void query_resolvesWithKeywordFallbackAgainstSeedData() throws Exception {
        mvc.perform(post("/api/v1/news/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"Show me technology news from Mumbai\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("category"))
                .andExpect(jsonPath("$.confidence").value(0.5))
                .andExpect(jsonPath("$.resolution").value("fallback"))
                .andExpect(jsonPath("$.strategy").value("category"))
                .andExpect(jsonPath("$.entities[0]").value("technology"))
                .andExpect(jsonPath("$.entities[1]").value("Mumbai"))
                .andExpect(jsonPath("$.articles[0].categories").isArray());
    }

    @Test
    void nearby_findsSeededArticlesAroundMumbai() throws Exception {
        mvc.perform(get("/api/v1/news/nearby").param("lat", "19.076").param("lon", "72.877").param("radius", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(greaterThan(0)));
    }

    @Test
    void trending_scoresSimulatedInteractions() throws Exception {
        mvc.perform(get("/api/v1/news/trending").param("lat", "19.076").param("lon", "72.877"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locationCluster").value("21_81"))
                .andExpect(jsonPath("$.totalResults").value(5));
    }

    @Test
    void health_isUp() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }
}
