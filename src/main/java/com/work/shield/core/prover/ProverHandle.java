package com.work.shield.core.prover;

import java.util.Objects;

/**
 * 一次证明计算的句柄，由 {@link Prover#submit} 返回。
 */
public final class ProverHandle {

    private final String id;

    public ProverHandle(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProverHandle && id.equals(((ProverHandle) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ProverHandle{" + id + "}";
    }
}
