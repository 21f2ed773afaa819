package com.work.shield.lattice.scheduler;

import com.work.shield.lattice.balance.BalanceSummary;
import com.work.shield.lattice.balance.EdgeBalanceVerification;
import com.work.shield.lattice.balance.FinalBalanceReport;
import com.work.shield.lattice.domain.EdgeSnapshot;
import com.work.shield.lattice.domain.TopologySummary;
import com.work.shield.lattice.support.metrics.MetricsSummary;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次拓扑执行的最终报告。
 */
public final class SchedulerReport {

    private final Duration duration;
    private final List<EdgeSnapshot> edges;
    private final TopologySummary topology;
    private final MetricsSummary metrics;
    private final List<EdgeBalanceVerification> edgeBalances;
    private final FinalBalanceReport finalBalances;
    private final BalanceSummary balanceSummary;
    private final int rootMismatches;

    SchedulerReport(Duration duration, List<EdgeSnapshot> edges, TopologySummary topology, MetricsSummary metrics,
                    List<EdgeBalanceVerification> edgeBalances, FinalBalanceReport finalBalances,
                    BalanceSummary balanceSummary, int rootMismatches) {
        this.duration = duration;
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.topology = topology;
        this.metrics = metrics;
        this.edgeBalances = Collections.unmodifiableList(new ArrayList<>(edgeBalances));
        this.finalBalances = finalBalances;
        this.balanceSummary = balanceSummary;
        this.rootMismatches = rootMismatches;
    }

    public Duration getDuration() {
        return duration;
    }

    public List<EdgeSnapshot> getEdges() {
        return edges;
    }

    public EdgeSnapshot edge(String id) {
        for (EdgeSnapshot edge : edges) {
            if (edge.getId().equals(id)) {
                return edge;
            }
        }
        return null;
    }

    public TopologySummary getTopology() {
        return topology;
    }

    /**
     * @return 指标摘要；未使用 {@link com.work.shield.lattice.support.metrics.MetricsCollector} 时为 null
     */
    public MetricsSummary getMetrics() {
        return metrics;
    }

    public List<EdgeBalanceVerification> getEdgeBalances() {
        return edgeBalances;
    }

    /**
     * @return 最终余额校验；关闭余额校验时为 null
     */
    public FinalBalanceReport getFinalBalances() {
        return finalBalances;
    }

    public BalanceSummary getBalanceSummary() {
        return balanceSummary;
    }

    public int getRootMismatches() {
        return rootMismatches;
    }
}
