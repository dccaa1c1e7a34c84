package com.delta.gapreview.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class RunNotFoundException extends RuntimeException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super("run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
