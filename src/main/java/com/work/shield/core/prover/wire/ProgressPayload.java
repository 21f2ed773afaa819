package com.work.shield.core.prover.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * stderr 上的单行进度事件，例如 {@code {"stage":"proving","progress":40,"message":"..."}}。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressPayload {

    private String stage;
    private Integer progress;
    private String message;

    public String getStage() {
        return stage;
    }

    public void setStage(String stage) {
        this.stage = stage;
    }

    public Integer getProgress() {
        return progress;
    }

    public void setProgress(Integer progress) {
        this.progress = progress;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
