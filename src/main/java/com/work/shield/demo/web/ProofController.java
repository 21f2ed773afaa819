package com.work.shield.demo.web;

import com.work.shield.core.ProofService;
import com.work.shield.core.exception.QueueLookupException;
import com.work.shield.core.exception.SecurityViolationException;
import com.work.shield.core.exception.ValidationException;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.prover.wire.ProofRequestPayload;
import com.work.shield.core.prover.wire.ProverWire;
import com.work.shield.core.queue.JobStage;
import com.work.shield.core.queue.ProofJobView;
import com.work.shield.core.queue.QueueStatus;
import com.work.shield.demo.web.dto.ErrorResponse;
import com.work.shield.demo.web.dto.ProofStatusResponse;
import com.work.shield.demo.web.dto.SubmitProofResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 证明任务接口：提交、按 jobId 轮询、查看队列。只提供 poll 契约，不做推送。
 */
@RestController
@RequestMapping("/api")
public class ProofController {

    private static final Logger log = LoggerFactory.getLogger(ProofController.class);

    private final ProofService proofService;

    public ProofController(ProofService proofService) {
        this.proofService = proofService;
    }

    @PostMapping("/generate-proof")
    public ResponseEntity<SubmitProofResponse> generateProof(@RequestBody ProofRequestPayload payload) {
        ProofRequest request = ProverWire.fromPayload(payload);
        SubmitProofResponse response = SubmitProofResponse.of(proofService.submit(request));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/proof-status/{jobId}")
    public ResponseEntity<ProofStatusResponse> proofStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(toResponse(proofService.status(jobId)));
    }

    @GetMapping("/queue-status")
    public ResponseEntity<QueueStatus> queueStatus() {
        return ResponseEntity.ok(proofService.queueStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        QueueStatus status = proofService.queueStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("activeJobs", status.getActiveJobs());
        body.put("queuedJobs", status.getQueuedJobs());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(SecurityViolationException.class)
    public ResponseEntity<ErrorResponse> handleSecurity(SecurityViolationException e) {
        log.warn("proof request rejected input={} commitment={} claimedIndex={} actualIndex={}",
                e.getInputPosition(), e.getCommitment(), e.getClaimedIndex(), e.getActualIndex());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(QueueLookupException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(QueueLookupException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    static ProofStatusResponse toResponse(ProofJobView view) {
        ProofStatusResponse v = new ProofStatusResponse();
        v.setJobId(view.getJobId());
        v.setStage(view.getStage().wireName());
        v.setStageDescription(view.getStageDescription());
        v.setProgress(view.getProgress());
        v.setQueuePosition(view.getQueuePosition());
        v.setCreatedAt(view.getCreatedAt());
        v.setStartedAt(view.getStartedAt());
        v.setCompletedAt(view.getCompletedAt());
        if (view.getDuration() != null) {
            v.setDurationMillis(view.getDuration().toMillis());
        }
        if (view.getStage() == JobStage.SUCCESS && view.getResult() != null) {
            v.setResult(ProverWire.toPayload(view.getResult()));
        }
        if (view.getStage() == JobStage.ERROR) {
            v.setError(view.getError());
            v.setDiagnosticTail(view.getDiagnosticTail());
        }
        return v;
    }
}
