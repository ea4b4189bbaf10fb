package com.filehub.api.controller;

import com.filehub.api.dto.ErrorResponse;
import com.filehub.api.exception.DuplicateNameException;
import com.filehub.api.exception.ErrorKind;
import com.filehub.api.exception.FileHubException;
import com.filehub.api.exception.ReferencesExistException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the store's error kinds onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final String GENERIC_STORAGE_MESSAGE = "A storage error occurred. Please try again.";

    private final boolean includeDetail;

    public ApiExceptionHandler(@Value("${app.errors.include-detail:false}") boolean includeDetail) {
        this.includeDetail = includeDetail;
    }

    @ExceptionHandler(FileHubException.class)
    public ResponseEntity<ErrorResponse> handle(FileHubException e) {
        ErrorResponse.ErrorResponseBuilder body = ErrorResponse.builder()
                .kind(e.getKind())
                .message(e.getMessage());

        if (e instanceof DuplicateNameException) {
            body.existing(((DuplicateNameException) e).getExistingFilename());
        } else if (e instanceof ReferencesExistException) {
            body.referenceCount(((ReferencesExistException) e).getReferenceCount());
        } else if (e.getKind() == ErrorKind.STORAGE_FAILURE) {
            log.error("Storage failure: {}", e.getMessage(), e);
            if (!includeDetail) {
                body.message(GENERIC_STORAGE_MESSAGE);
            }
        }

        return ResponseEntity.status(statusOf(e.getKind())).body(body.build());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case DUPLICATE_NAME:
            case REFERENCE_EXISTS:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STORAGE_FAILURE:
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
