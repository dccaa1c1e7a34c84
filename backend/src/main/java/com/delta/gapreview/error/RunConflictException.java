package com.delta.gapreview.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Another writer advanced the run between our read and our checkpoint append.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class RunConflictException extends RuntimeException {
    public RunConflictException(String message) {
        super(message);
    }
}
