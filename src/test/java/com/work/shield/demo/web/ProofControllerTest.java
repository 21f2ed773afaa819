package com.work.shield.demo.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.shield.core.ProofService;
import com.work.shield.core.exception.QueueLookupException;
import com.work.shield.core.exception.SecurityViolationException;
import com.work.shield.core.merkle.IncrementalMerkleTree;
import com.work.shield.core.model.Note;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.model.PublicOutputs;
import com.work.shield.core.prover.wire.ProverWire;
import com.work.shield.core.queue.JobStage;
import com.work.shield.core.queue.ProofJobView;
import com.work.shield.core.queue.QueueStatus;
import com.work.shield.core.queue.SubmitReceipt;
import com.work.shield.demo.web.dto.ProofStatusResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ProofControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProofService proofService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        proofService = mock(ProofService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ProofController(proofService)).build();
    }

    private String validBody() throws Exception {
        byte[] leaf = new byte[32];
        leaf[0] = 1;
        Note note = new Note(10L, new byte[32], new byte[32]);
        ProofRequest request = new ProofRequest(Collections.singletonList(note), Collections.singletonList(note),
                Collections.singletonList(new byte[65]), Collections.singletonList(new byte[65]),
                Collections.singletonList(0L),
                Collections.singletonList(IncrementalMerkleTree.of(Collections.singletonList(leaf)).generateProof(0)),
                new byte[32]);
        return objectMapper.writeValueAsString(ProverWire.toPayload(request));
    }

    @Test
    public void accepted_submission_returns_receipt() throws Exception {
        when(proofService.submit(any(ProofRequest.class))).thenReturn(new SubmitReceipt("job-1", 2, 1, 2));

        mockMvc.perform(post("/api/generate-proof").contentType(MediaType.APPLICATION_JSON).content(validBody()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.queuePosition").value(2));
    }

    @Test
    public void malformed_request_is_bad_request() throws Exception {
        mockMvc.perform(post("/api/generate-proof").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
        verify(proofService, never()).submit(any(ProofRequest.class));
    }

    @Test
    public void forged_input_is_forbidden() throws Exception {
        when(proofService.submit(any(ProofRequest.class)))
                .thenThrow(new SecurityViolationException(0, "0xabc", 0L, null));

        mockMvc.perform(post("/api/generate-proof").contentType(MediaType.APPLICATION_JSON).content(validBody()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("security_violation"));
    }

    @Test
    public void unknown_job_is_not_found() throws Exception {
        when(proofService.status("nope")).thenThrow(new QueueLookupException("nope"));

        mockMvc.perform(get("/api/proof-status/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: nope"));
    }

    @Test
    public void queued_job_status_omits_result_and_error() throws Exception {
        when(proofService.status("job-2")).thenReturn(new ProofJobView("job-2", JobStage.QUEUED,
                "Queued (position 1 of 1)", 0, 1, null, null, null, null, null, null));

        mockMvc.perform(get("/api/proof-status/job-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("queued"))
                .andExpect(jsonPath("$.queuePosition").value(1))
                .andExpect(jsonPath("$.result").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    public void health_reports_queue_counts() throws Exception {
        when(proofService.queueStatus()).thenReturn(new QueueStatus(1, 3, 1, 4,
                Collections.<String>emptyList(), Collections.<String>emptyList()));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.queuedJobs").value(3));
    }

    @Test
    public void success_view_carries_result_with_duration() {
        Instant started = Instant.parse("2026-01-01T00:00:00Z");
        PublicOutputs outputs = new PublicOutputs(new byte[32], new byte[32],
                Collections.singletonList(new byte[32]), Collections.singletonList(new byte[32]));
        ProofJobView view = new ProofJobView("job-3", JobStage.SUCCESS, "Proof generated successfully", 100, 0,
                started, started, started.plusMillis(1500), new ProofResult(new byte[]{1}, new byte[]{2}, outputs, null),
                null, "ignored");

        ProofStatusResponse response = ProofController.toResponse(view);

        assertEquals("success", response.getStage());
        assertEquals(Long.valueOf(1500L), response.getDurationMillis());
        assertEquals("0x01", response.getResult().getProof());
        assertNull(response.getDiagnosticTail());
    }

    @Test
    public void error_view_carries_diagnostics() {
        ProofJobView view = new ProofJobView("job-4", JobStage.ERROR, "Proof generation failed", 0, 0,
                null, null, null, null, "nonzero-exit:1", "panicked: value not conserved");

        ProofStatusResponse response = ProofController.toResponse(view);

        assertEquals("error", response.getStage());
        assertEquals("nonzero-exit:1", response.getError());
        assertEquals("panicked: value not conserved", response.getDiagnosticTail());
        assertNull(response.getResult());
    }
}
