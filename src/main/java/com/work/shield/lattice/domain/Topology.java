package com.work.shield.lattice.domain;

import com.work.shield.core.model.Wallet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 钱包之上的转账有向图。
 * <p>
 * 依赖只能指向已添加的边，所以图天然无环。边只有在所有依赖都 CONFIRMED 后才算就绪；
 * 依赖失败的边会被级联标记为 FAILED（dependency-failed:&lt;id&gt;），保证整次运行总能结束。
 * </p>
 */
public class Topology {

    private final String name;
    private final Map<String, Wallet> wallets = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();

    public Topology(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Topology addWallet(Wallet wallet) {
        requireNonNull(wallet, "wallet");
        wallets.put(wallet.getId(), wallet);
        return this;
    }

    public Edge addEdge(String id, String from, String to, long amount, String... dependsOn) {
        if (edges.containsKey(id)) {
            throw new IllegalArgumentException("duplicate edge id " + id);
        }
        List<String> deps = Arrays.asList(dependsOn);
        for (String dep : deps) {
            if (!edges.containsKey(dep)) {
                throw new IllegalArgumentException("edge " + id + " depends on unknown edge " + dep);
            }
        }
        Edge edge = new Edge(id, from, to, amount, deps);
        edges.put(id, edge);
        return edge;
    }

    /**
     * @return 钱包；不存在时为 null
     */
    public Wallet wallet(String id) {
        return wallets.get(id);
    }

    public Collection<Wallet> getWallets() {
        return wallets.values();
    }

    public Edge edge(String id) {
        return edges.get(id);
    }

    public Collection<Edge> getEdges() {
        return edges.values();
    }

    public List<Edge> readyEdges() {
        List<Edge> ready = new ArrayList<>();
        for (Edge edge : edges.values()) {
            if (edge.getState() == EdgeState.READY && dependenciesConfirmed(edge)) {
                ready.add(edge);
            }
        }
        return ready;
    }

    public List<Edge> edgesIn(EdgeState state) {
        List<Edge> out = new ArrayList<>();
        for (Edge edge : edges.values()) {
            if (edge.getState() == state) {
                out.add(edge);
            }
        }
        return out;
    }

    /**
     * PROVING 或 SUBMITTED 的边数。
     */
    public int inFlightCount() {
        return edgesIn(EdgeState.PROVING).size() + edgesIn(EdgeState.SUBMITTED).size();
    }

    public boolean isComplete() {
        for (Edge edge : edges.values()) {
            if (!edge.getState().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 级联失败：所有直接或间接依赖 failed 的非终态边。
     *
     * @return 被级联标记的边
     */
    public List<Edge> failDependents(Edge failed, Instant at) {
        List<Edge> cascaded = new ArrayList<>();
        for (Edge edge : edges.values()) {
            if (!edge.getState().isTerminal() && edge.getDependsOn().contains(failed.getId())) {
                edge.fail("dependency-failed:" + failed.getId(), at);
                cascaded.add(edge);
                cascaded.addAll(failDependents(edge, at));
            }
        }
        return cascaded;
    }

    private boolean dependenciesConfirmed(Edge edge) {
        for (String dep : edge.getDependsOn()) {
            if (edges.get(dep).getState() != EdgeState.CONFIRMED) {
                return false;
            }
        }
        return true;
    }

    public TopologySummary summary() {
        Map<EdgeState, Integer> counts = new LinkedHashMap<>();
        for (EdgeState state : EdgeState.values()) {
            counts.put(state, 0);
        }
        List<Long> proofMillis = new ArrayList<>();
        List<Long> totalMillis = new ArrayList<>();
        for (Edge edge : edges.values()) {
            counts.merge(edge.getState(), 1, Integer::sum);
            if (edge.proofDuration() != null) {
                proofMillis.add(edge.proofDuration().toMillis());
            }
            if (edge.getState() == EdgeState.CONFIRMED && edge.totalDuration() != null) {
                totalMillis.add(edge.totalDuration().toMillis());
            }
        }
        return new TopologySummary(name, wallets.size(), edges.size(), counts, proofMillis, totalMillis);
    }
}
