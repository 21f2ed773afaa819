package com.work.shield.demo.web.dto;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

public class LatticeRunRequest {

    /**
     * chain / fan-out / fan-in / diamond
     */
    @NotBlank
    @Pattern(regexp = "chain|fan-out|fan-in|diamond")
    private String topology = "chain";

    /**
     * 钱包数量，diamond 固定为 4
     */
    @Min(2)
    @Max(32)
    private int walletCount = 3;

    @Min(1)
    private long amount = 1000L;

    public String getTopology() {
        return topology;
    }

    public void setTopology(String topology) {
        this.topology = topology;
    }

    public int getWalletCount() {
        return walletCount;
    }

    public void setWalletCount(int walletCount) {
        this.walletCount = walletCount;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }
}
