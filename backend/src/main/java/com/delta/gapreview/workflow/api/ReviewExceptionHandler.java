package com.delta.gapreview.workflow.api;

import com.delta.gapreview.error.DocumentNotFoundException;
import com.delta.gapreview.error.InvalidRunInputException;
import com.delta.gapreview.error.ReviewWorkflowException;
import com.delta.gapreview.error.RunConflictException;
import com.delta.gapreview.error.RunNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ReviewExceptionHandler {

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleRunNotFound(RunNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "run_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(RunConflictException.class)
  public ResponseEntity<Map<String, String>> handleConflict(RunConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "run_conflict", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidRunInputException.class)
  public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidRunInputException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.reasonCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleDocumentNotFound(DocumentNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", ex.reasonCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(ReviewWorkflowException.class)
  public ResponseEntity<Map<String, String>> handleWorkflow(ReviewWorkflowException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", ex.reasonCode(), "message", String.valueOf(ex.getMessage())));
  }
}
