package com.work.shield.lattice.support.metrics;

/**
 * 默认 no-op 实现。
 */
public class NoopLatticeMetrics implements LatticeMetrics {
}
