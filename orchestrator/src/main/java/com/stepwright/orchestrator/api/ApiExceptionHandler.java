package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.service.JobNotFoundException;
import com.stepwright.orchestrator.service.JobOwnershipException;
import com.stepwright.orchestrator.service.JobStateException;
import com.stepwright.orchestrator.service.QueueValidationException;
import com.stepwright.orchestrator.task.InvalidTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP: not found 404, validation 400,
 * ownership and state conflicts 409.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler({QueueValidationException.class, InvalidTaskException.class,
                       HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return body(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, "validation", detail);
    }

    @ExceptionHandler(JobOwnershipException.class)
    public ResponseEntity<Map<String, Object>> ownership(JobOwnershipException e) {
        log.info("Ownership conflict on job {}: {}", e.getJobId(), e.getMessage());
        return body(HttpStatus.CONFLICT, "ownership", e.getMessage());
    }

    @ExceptionHandler(JobStateException.class)
    public ResponseEntity<Map<String, Object>> state(JobStateException e) {
        return body(HttpStatus.CONFLICT, "state", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status",  status.value());
        body.put("error",   error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
