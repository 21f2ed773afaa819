package com.work.shield.demo.web.dto;

import java.util.List;
import java.util.Map;

public class LatticeRunResponse {

    private String topology;
    private long durationMillis;
    private Map<String, Integer> countsByState;
    private List<EdgeView> edges;
    private int rootMismatches;
    private boolean balancesValid;
    private Map<String, Integer> errorsByType;
    private long proofP50Millis;
    private long proofP95Millis;
    private int maxQueueDepth;

    public String getTopology() {
        return topology;
    }

    public void setTopology(String topology) {
        this.topology = topology;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    public Map<String, Integer> getCountsByState() {
        return countsByState;
    }

    public void setCountsByState(Map<String, Integer> countsByState) {
        this.countsByState = countsByState;
    }

    public List<EdgeView> getEdges() {
        return edges;
    }

    public void setEdges(List<EdgeView> edges) {
        this.edges = edges;
    }

    public int getRootMismatches() {
        return rootMismatches;
    }

    public void setRootMismatches(int rootMismatches) {
        this.rootMismatches = rootMismatches;
    }

    public boolean isBalancesValid() {
        return balancesValid;
    }

    public void setBalancesValid(boolean balancesValid) {
        this.balancesValid = balancesValid;
    }

    public Map<String, Integer> getErrorsByType() {
        return errorsByType;
    }

    public void setErrorsByType(Map<String, Integer> errorsByType) {
        this.errorsByType = errorsByType;
    }

    public long getProofP50Millis() {
        return proofP50Millis;
    }

    public void setProofP50Millis(long proofP50Millis) {
        this.proofP50Millis = proofP50Millis;
    }

    public long getProofP95Millis() {
        return proofP95Millis;
    }

    public void setProofP95Millis(long proofP95Millis) {
        this.proofP95Millis = proofP95Millis;
    }

    public int getMaxQueueDepth() {
        return maxQueueDepth;
    }

    public void setMaxQueueDepth(int maxQueueDepth) {
        this.maxQueueDepth = maxQueueDepth;
    }
}
