package com.legalreview.extraction.controller;

import com.legalreview.extraction.exception.DocumentUploadException;
import com.legalreview.extraction.exception.ResourceNotFoundException;
import com.legalreview.extraction.exception.ReviewValidationException;
import com.legalreview.extraction.exception.StaleCellException;
import com.legalreview.extraction.model.AuditAction;
import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.CellSnapshot;
import com.legalreview.extraction.model.Citation;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.DocumentSummary;
import com.legalreview.extraction.model.FieldSummary;
import com.legalreview.extraction.model.FieldType;
import com.legalreview.extraction.model.Job;
import com.legalreview.extraction.model.JobHandle;
import com.legalreview.extraction.model.JobMode;
import com.legalreview.extraction.model.JobResult;
import com.legalreview.extraction.model.JobStatus;
import com.legalreview.extraction.model.LocationType;
import com.legalreview.extraction.model.ReasonCode;
import com.legalreview.extraction.model.ResultRow;
import com.legalreview.extraction.model.ReviewAction;
import com.legalreview.extraction.model.ReviewState;
import com.legalreview.extraction.model.SourceDocument;
import com.legalreview.extraction.service.DocumentSource;
import com.legalreview.extraction.service.DocumentUploadService;
import com.legalreview.extraction.service.ExtractionJobService;
import com.legalreview.extraction.service.ReviewService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
class ReviewControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ExtractionJobService jobService;

    @MockBean
    private ReviewService reviewService;

    @MockBean
    private DocumentSource documentSource;

    @MockBean
    private DocumentUploadService uploadService;

    private static Job job(String id, JobStatus status) {
        return Job.builder().id(id).mode(JobMode.FULL).status(status).templateId("legal_review_v1").createdAt(NOW).build();
    }

    private static Cell cell() {
        return Cell.builder()
                .cellId("cell-1")
                .jobId("job-1")
                .documentId("d1")
                .documentIdentifier("msa.pdf")
                .fieldKey("governing_law")
                .fieldLabel("Governing Law")
                .fieldType(FieldType.TEXT)
                .value("Delaware")
                .valueRaw("Delaware")
                .valueNormalized("Delaware")
                .confidence(0.95)
                .confidenceReasons(new ArrayList<>(List.of(ReasonCode.SINGLE_MATCH)))
                .reviewState(ReviewState.EXTRACTED)
                .citation(Citation.builder()
                        .documentId("d1")
                        .documentIdentifier("msa.pdf")
                        .locationType(LocationType.PAGE)
                        .location(4)
                        .snippet("...governed by the laws of Delaware...")
                        .charStart(310)
                        .charEnd(318)
                        .build())
                .version(0L)
                .build();
    }

    @Nested
    @DisplayName("runs and results")
    class Runs {

        @Test
        void runWithoutWaitShouldReturnAcceptedPendingJob() throws Exception {
            // GIVEN
            when(jobService.submit(JobMode.QUICK, null))
                    .thenReturn(new JobHandle("job-1", new CompletableFuture<>()));
            when(jobService.job("job-1")).thenReturn(job("job-1", JobStatus.PENDING));

            // WHEN / THEN
            mvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content("{\"mode\": \"quick\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.id").value("job-1"))
                    .andExpect(jsonPath("$.status").value("PENDING"));
        }

        @Test
        void runWithWaitShouldReturnTerminalJob() throws Exception {
            Job done = job("job-2", JobStatus.SUCCEEDED);
            when(jobService.runAndWait(JobMode.FULL, null)).thenReturn(JobResult.empty(done));

            mvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"mode\": \"FULL\", \"wait\": true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                    .andExpect(jsonPath("$.template_id").value("legal_review_v1"));
        }

        @Test
        void runShouldPassRequestedTemplateThrough() throws Exception {
            Job done = job("job-3", JobStatus.SUCCEEDED);
            when(jobService.runAndWait(JobMode.FULL, "file:/srv/templates/nda.json")).thenReturn(JobResult.empty(done));

            mvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"mode\": \"full\", \"wait\": true, \"template_path\": \"file:/srv/templates/nda.json\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value("job-3"));

            verify(jobService).runAndWait(JobMode.FULL, "file:/srv/templates/nda.json");
        }

        @Test
        void jobStatusShouldBeReadable() throws Exception {
            when(jobService.job("job-1")).thenReturn(job("job-1", JobStatus.RUNNING));

            mvc.perform(get("/api/jobs/job-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("RUNNING"));
        }

        @Test
        void unknownJobShouldBeNotFound() throws Exception {
            when(jobService.job("nope")).thenThrow(new ResourceNotFoundException("Job", "nope"));

            mvc.perform(get("/api/jobs/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.status").value("ERROR"))
                    .andExpect(jsonPath("$.message").value("Job not found: nope"));
        }

        @Test
        void resultsShouldDefaultToLatestSucceededJob() throws Exception {
            // GIVEN
            Job done = job("job-1", JobStatus.SUCCEEDED);
            FieldSummary law = FieldSummary.builder().key("governing_law").label("Governing Law").type(FieldType.TEXT).build();
            JobResult result = JobResult.builder()
                    .job(done)
                    .documents(List.of())
                    .fields(List.of(law))
                    .rows(List.of(ResultRow.builder()
                            .fieldKey("governing_law")
                            .fieldLabel("Governing Law")
                            .fieldType(FieldType.TEXT)
                            .cells(List.of(cell()))
                            .build()))
                    .build();
            when(jobService.latestSucceededJob()).thenReturn(Optional.of(done));
            when(jobService.result("job-1")).thenReturn(result);

            // WHEN / THEN
            mvc.perform(get("/api/results"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rows", hasSize(1)))
                    .andExpect(jsonPath("$.rows[0].field_type").value("text"))
                    .andExpect(jsonPath("$.rows[0].cells[0].review_state").value("EXTRACTED"))
                    .andExpect(jsonPath("$.rows[0].cells[0].confidence_reasons[0]").value("SINGLE_MATCH"))
                    .andExpect(jsonPath("$.rows[0].cells[0].citation.location_type").value("page"))
                    .andExpect(jsonPath("$.rows[0].cells[0].citation.location").value(4))
                    .andExpect(jsonPath("$.rows[0].cells[0].citation.coordinates").value(nullValue()));
        }

        @Test
        void resultsWithoutAnyJobShouldBeEmpty() throws Exception {
            when(jobService.latestSucceededJob()).thenReturn(Optional.empty());

            mvc.perform(get("/api/results"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rows", hasSize(0)));
        }

        @Test
        void documentsShouldBeListed() throws Exception {
            when(documentSource.listDocuments()).thenReturn(List.of(SourceDocument.builder()
                    .id("d1").identifier("msa.pdf").format(DocumentFormat.PDF).rawBytes(new byte[0]).build()));

            mvc.perform(get("/api/documents"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].identifier").value("msa.pdf"))
                    .andExpect(jsonPath("$[0].format").value("PDF"));
        }
    }

    @Nested
    @DisplayName("uploads")
    class Uploads {

        @Test
        void uploadShouldReturnStoredDocument() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "lease.html", "text/html", "<p>Lease</p>".getBytes());
            when(uploadService.store(any())).thenReturn(DocumentSummary.builder()
                    .id("0123456789abcdef").identifier("lease.html").format(DocumentFormat.HTML).build());

            mvc.perform(multipart("/api/documents/upload").file(file))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value("0123456789abcdef"))
                    .andExpect(jsonPath("$.format").value("HTML"));
        }

        @Test
        void unsupportedUploadShouldBeBadRequest() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());
            when(uploadService.store(any())).thenThrow(new DocumentUploadException("unsupported file type: notes.txt"));

            mvc.perform(multipart("/api/documents/upload").file(file))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("unsupported file type: notes.txt"));
        }
    }

    @Nested
    @DisplayName("review")
    class Review {

        @Test
        void patchShouldPassSnakeCaseActionToService() throws Exception {
            // GIVEN
            Cell updated = cell().toBuilder()
                    .value("Jan 1 2023")
                    .reviewState(ReviewState.MANUAL_UPDATED)
                    .version(1L)
                    .build();
            when(reviewService.review(eq("cell-1"), any(ReviewAction.class))).thenReturn(updated);

            // WHEN
            mvc.perform(patch("/api/cells/cell-1").contentType(MediaType.APPLICATION_JSON).content("""
                            {"manual_value": "Jan 1 2023", "actor": "alice", "reason": "style", "expected_version": 0}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.review_state").value("MANUAL_UPDATED"))
                    .andExpect(jsonPath("$.value").value("Jan 1 2023"))
                    .andExpect(jsonPath("$.value_raw").value("Delaware"))
                    .andExpect(jsonPath("$.version").value(1));

            // THEN
            ArgumentCaptor<ReviewAction> action = ArgumentCaptor.forClass(ReviewAction.class);
            verify(reviewService).review(eq("cell-1"), action.capture());
            assertThat(action.getValue().getManualValue()).isEqualTo("Jan 1 2023");
            assertThat(action.getValue().getActor()).isEqualTo("alice");
            assertThat(action.getValue().getExpectedVersion()).isZero();
            assertThat(action.getValue().getReviewState()).isNull();
        }

        @Test
        void invalidActionShouldBeBadRequest() throws Exception {
            when(reviewService.review(eq("cell-1"), any(ReviewAction.class)))
                    .thenThrow(new ReviewValidationException("actor is required"));

            mvc.perform(patch("/api/cells/cell-1").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"review_state\": \"confirmed\", \"expected_version\": 0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("actor is required"));
        }

        @Test
        void staleVersionShouldConflict() throws Exception {
            when(reviewService.review(eq("cell-1"), any(ReviewAction.class)))
                    .thenThrow(new StaleCellException("cell-1", 0, 2));

            mvc.perform(patch("/api/cells/cell-1").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"review_state\": \"REJECTED\", \"actor\": \"bob\", \"expected_version\": 0}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.status").value("ERROR"));
        }

        @Test
        void auditShouldListEntriesInOrder() throws Exception {
            AuditEntry entry = AuditEntry.builder()
                    .cellId("cell-1")
                    .sequence(1)
                    .actor("alice")
                    .timestamp(NOW)
                    .action(AuditAction.CONFIRM)
                    .before(CellSnapshot.builder().value("Delaware").valueRaw("Delaware")
                            .reviewState(ReviewState.EXTRACTED).build())
                    .after(CellSnapshot.builder().value("Delaware").valueRaw("Delaware")
                            .reviewState(ReviewState.CONFIRMED).build())
                    .build();
            when(reviewService.history("cell-1")).thenReturn(List.of(entry));

            mvc.perform(get("/api/cells/cell-1/audit"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(1)))
                    .andExpect(jsonPath("$[0].sequence").value(1))
                    .andExpect(jsonPath("$[0].action").value("CONFIRM"))
                    .andExpect(jsonPath("$[0].before.review_state").value("EXTRACTED"))
                    .andExpect(jsonPath("$[0].after.review_state").value("CONFIRMED"))
                    .andExpect(jsonPath("$[0].timestamp").value("2025-03-01T10:15:30Z"));
        }
    }
}
