package com.work.shield.lattice.domain;

import com.work.shield.core.model.Wallet;

import java.util.List;

/**
 * 常用拓扑的工厂方法。
 */
public final class Topologies {

    private Topologies() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * w0 → w1 → w2 → ...，每条边依赖前一条。
     */
    public static Topology chain(List<Wallet> wallets, long amount) {
        if (wallets.size() < 2) {
            throw new IllegalArgumentException("chain 至少需要 2 个钱包");
        }
        Topology topology = withWallets("chain", wallets);
        String previous = null;
        for (int i = 0; i < wallets.size() - 1; i++) {
            String id = "chain-" + i;
            if (previous == null) {
                topology.addEdge(id, wallets.get(i).getId(), wallets.get(i + 1).getId(), amount);
            } else {
                topology.addEdge(id, wallets.get(i).getId(), wallets.get(i + 1).getId(), amount, previous);
            }
            previous = id;
        }
        return topology;
    }

    /**
     * source 向每个目标各转一笔，互不依赖。
     */
    public static Topology fanOut(Wallet source, List<Wallet> destinations, long amount) {
        Topology topology = new Topology("fan-out").addWallet(source);
        for (int i = 0; i < destinations.size(); i++) {
            Wallet destination = destinations.get(i);
            topology.addWallet(destination);
            topology.addEdge("fanout-" + i, source.getId(), destination.getId(), amount);
        }
        return topology;
    }

    /**
     * 每个来源各向 destination 转一笔，互不依赖。
     */
    public static Topology fanIn(List<Wallet> sources, Wallet destination, long amount) {
        Topology topology = new Topology("fan-in").addWallet(destination);
        for (int i = 0; i < sources.size(); i++) {
            Wallet source = sources.get(i);
            topology.addWallet(source);
            topology.addEdge("fanin-" + i, source.getId(), destination.getId(), amount);
        }
        return topology;
    }

    /**
     * A → B、A → C，随后 B → D 依赖 A → B，C → D 依赖 A → C。
     */
    public static Topology diamond(List<Wallet> wallets, long ab, long ac, long bd, long cd) {
        if (wallets.size() != 4) {
            throw new IllegalArgumentException("diamond 需要 4 个钱包");
        }
        Topology topology = withWallets("diamond", wallets);
        String a = wallets.get(0).getId();
        String b = wallets.get(1).getId();
        String c = wallets.get(2).getId();
        String d = wallets.get(3).getId();
        topology.addEdge("A->B", a, b, ab);
        topology.addEdge("A->C", a, c, ac);
        topology.addEdge("B->D", b, d, bd, "A->B");
        topology.addEdge("C->D", c, d, cd, "A->C");
        return topology;
    }

    public static Topology diamond(List<Wallet> wallets) {
        return diamond(wallets, 100_000L, 100_000L, 50_000L, 50_000L);
    }

    private static Topology withWallets(String name, List<Wallet> wallets) {
        Topology topology = new Topology(name);
        for (Wallet wallet : wallets) {
            topology.addWallet(wallet);
        }
        return topology;
    }
}
