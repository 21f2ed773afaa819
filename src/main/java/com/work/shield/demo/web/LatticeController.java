package com.work.shield.demo.web;

import com.work.shield.core.exception.ValidationException;
import com.work.shield.demo.service.LatticeDemoService;
import com.work.shield.demo.web.dto.EdgeView;
import com.work.shield.demo.web.dto.ErrorResponse;
import com.work.shield.demo.web.dto.LatticeRunRequest;
import com.work.shield.demo.web.dto.LatticeRunResponse;
import com.work.shield.lattice.domain.EdgeSnapshot;
import com.work.shield.lattice.domain.EdgeState;
import com.work.shield.lattice.scheduler.SchedulerReport;
import com.work.shield.lattice.support.metrics.MetricsSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 同步运行一个拓扑并返回报告，耗时取决于证明器速度。
 */
@RestController
@RequestMapping("/api/lattice")
public class LatticeController {

    private final LatticeDemoService latticeDemoService;

    public LatticeController(LatticeDemoService latticeDemoService) {
        this.latticeDemoService = latticeDemoService;
    }

    @PostMapping("/run")
    public ResponseEntity<LatticeRunResponse> run(@Validated @RequestBody LatticeRunRequest request) {
        SchedulerReport report = latticeDemoService.run(request.getTopology(), request.getWalletCount(),
                request.getAmount());
        return ResponseEntity.ok(toResponse(report));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    private static LatticeRunResponse toResponse(SchedulerReport report) {
        LatticeRunResponse r = new LatticeRunResponse();
        r.setTopology(report.getTopology().getName());
        r.setDurationMillis(report.getDuration().toMillis());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<EdgeState, Integer> entry : report.getTopology().getCountsByState().entrySet()) {
            counts.put(entry.getKey().name(), entry.getValue());
        }
        r.setCountsByState(counts);
        List<EdgeView> edges = new ArrayList<>();
        for (EdgeSnapshot snapshot : report.getEdges()) {
            edges.add(EdgeView.of(snapshot));
        }
        r.setEdges(edges);
        r.setRootMismatches(report.getRootMismatches());
        r.setBalancesValid(report.getBalanceSummary().isAllValid()
                && (report.getFinalBalances() == null || report.getFinalBalances().isAllMatch()));
        MetricsSummary metrics = report.getMetrics();
        if (metrics != null) {
            r.setErrorsByType(metrics.getErrorsByType());
            r.setProofP50Millis(metrics.getProofTime().getP50());
            r.setProofP95Millis(metrics.getProofTime().getP95());
            r.setMaxQueueDepth(metrics.getMaxQueueDepth());
        }
        return r;
    }
}
