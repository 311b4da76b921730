package com.clipflow.publisher.exception;

import com.clipflow.publisher.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.stream.Collectors;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ApiResponse<Void>> handlePipelineException(PipelineException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(message));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse<Void>> handleRuntimeException(RuntimeException e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal server error"));
    }

    static HttpStatus statusFor(PipelineException e) {
        if (e instanceof ValidationException || e instanceof NoCredentialsException) {
            return HttpStatus.BAD_REQUEST;
        } else if (e instanceof InvalidStateException) {
            return HttpStatus.CONFLICT;
        } else if (e instanceof ResourceNotFoundException) {
            return HttpStatus.NOT_FOUND;
        } else if (e instanceof CredentialException) {
            return HttpStatus.UNAUTHORIZED;
        } else if (e instanceof RemoteTransientException || e instanceof NetworkException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e instanceof RemoteRejectionException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
