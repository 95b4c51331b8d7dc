package com.event.seating.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("SeatingController Tests")
class SeatingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("POST returns the optimized plan")
    void testOptimize() throws Exception {
        String body = """
                {
                  "guests": [
                    {"id": "b1", "name": "Ana", "company": "Alpha", "guestType": "BUYER"},
                    {"id": "s1", "name": "Ben", "company": "Beta", "guestType": "SELLER"},
                    {"id": "b2", "name": "Cy", "company": "Gamma", "guestType": "BUYER"},
                    {"id": "s2", "name": "Di", "company": "Delta", "guestType": "SELLER"}
                  ],
                  "constraints": [
                    {"id": "c1", "type": "MUST_NOT_SIT_TOGETHER", "guestIds": ["b1", "b2"]}
                  ],
                  "config": {"tableCount": 2, "seatsPerTable": 2}
                }
                """;

        mockMvc.perform(post("/api/v1/seating/optimize").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feasible").value(true))
                .andExpect(jsonPath("$.status").value("CONVERGED"))
                .andExpect(jsonPath("$.seed").value(42))
                .andExpect(jsonPath("$.plan.tables.length()").value(2));
    }

    @Test
    @DisplayName("Empty guest list is a bad request")
    void testEmptyGuests() throws Exception {
        String body = """
                {"guests": [], "config": {"tableCount": 1, "seatsPerTable": 4}}
                """;

        mockMvc.perform(post("/api/v1/seating/optimize").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Guest list cannot be empty"));
    }
}
