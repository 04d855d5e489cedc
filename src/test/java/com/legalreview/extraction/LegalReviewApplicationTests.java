package com.legalreview.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the bundled template over a generated contract and reviews one of its cells
 * through the HTTP API, against the JPA store on an in-memory database.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:legal_review_it;DB_CLOSE_DELAY=-1",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@AutoConfigureMockMvc
class LegalReviewApplicationTests {

    @TempDir
    static Path documents;

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeAll
    static void writeContract() throws IOException {
        Files.write(documents.resolve("services_agreement.pdf"), TestFixtures.pdfBytes(
                "MASTER SERVICES AGREEMENT\nThis Agreement is effective as of January 1, 2023.",
                "The total contract price of USD $1,250,000.00 is payable in installments.",
                "This Agreement is governed by the laws of the State of Delaware."));
    }

    @DynamicPropertySource
    static void documentDirectory(DynamicPropertyRegistry registry) {
        registry.add("review.document-dirs", () -> documents.toString());
    }

    private JsonNode read(String content) throws IOException {
        return objectMapper.readTree(content);
    }

    @Test
    void shouldExtractAndReviewThroughApi() throws Exception {
        // GIVEN a finished full run
        String jobJson = mvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\": \"full\", \"wait\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.template_id").value("legal_review_v1"))
                .andReturn().getResponse().getContentAsString();
        String jobId = read(jobJson).get("id").asText();

        JsonNode results = read(mvc.perform(get("/api/results").param("job_id", jobId))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
        assertThat(results.get("rows")).hasSize(9);

        JsonNode law = null;
        JsonNode value = null;
        for (JsonNode row : results.get("rows")) {
            if (row.get("field_key").asText().equals("governing_law")) law = row.get("cells").get(0);
            if (row.get("field_key").asText().equals("contract_value")) value = row.get("cells").get(0);
        }
        assertThat(law).isNotNull();
        assertThat(law.get("review_state").asText()).isEqualTo("EXTRACTED");
        assertThat(law.get("value").asText()).isEqualTo("Delaware");
        assertThat(law.get("citation").get("location").asInt()).isEqualTo(3);
        assertThat(value).isNotNull();
        assertThat(value.get("value").asText()).isEqualTo("$1250000.00");
        String cellId = law.get("cell_id").asText();

        // WHEN a reviewer corrects it
        mvc.perform(patch("/api/cells/" + cellId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"manual_value\": \"State of Delaware\", \"actor\": \"alice\", \"expected_version\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.review_state").value("MANUAL_UPDATED"))
                .andExpect(jsonPath("$.value").value("State of Delaware"))
                .andExpect(jsonPath("$.value_raw").value("Delaware"))
                .andExpect(jsonPath("$.version").value(1));

        // THEN a second edit based on the old version is refused and the audit log holds one entry
        mvc.perform(patch("/api/cells/" + cellId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"review_state\": \"CONFIRMED\", \"actor\": \"bob\", \"expected_version\": 0}"))
                .andExpect(status().isConflict());

        mvc.perform(get("/api/cells/" + cellId + "/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sequence").value(1))
                .andExpect(jsonPath("$[0].actor").value("alice"))
                .andExpect(jsonPath("$[0].before.value").value("Delaware"))
                .andExpect(jsonPath("$[0].after.value").value("State of Delaware"))
                .andExpect(jsonPath("$[1]").doesNotExist());

        mvc.perform(get("/api/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.id").value(jobId));
    }

    @Test
    void unknownCellShouldBeNotFound() throws Exception {
        mvc.perform(get("/api/cells/does-not-exist/audit"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Cell not found: does-not-exist"));
    }
}
