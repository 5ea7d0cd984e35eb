package com.brandmonitor.interfaces.api;

import com.brandmonitor.application.vocabulary.exception.DuplicateKeywordException;
import com.brandmonitor.application.vocabulary.exception.InvalidKeywordException;
import com.brandmonitor.application.vocabulary.exception.KeywordNotFoundException;
import com.brandmonitor.application.vocabulary.exception.TierNotFoundException;
import com.brandmonitor.application.vocabulary.exception.VocabularyUnavailableException;
import com.brandmonitor.infrastructure.vocabulary.VocabularyStorageException;
import com.brandmonitor.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidKeywordException.class)
    public ResponseEntity<ErrorResponse> handleInvalidKeyword(InvalidKeywordException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getMessage(), "INVALID_KEYWORD"));
    }

    @ExceptionHandler(KeywordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleKeywordNotFound(KeywordNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(e.getMessage(), "KEYWORD_NOT_FOUND"));
    }

    @ExceptionHandler(TierNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTierNotFound(TierNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(e.getMessage(), "CATEGORY_NOT_FOUND"));
    }

    @ExceptionHandler(DuplicateKeywordException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKeyword(DuplicateKeywordException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(e.getMessage(), "DUPLICATE_KEYWORD"));
    }

    @ExceptionHandler(VocabularyUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(VocabularyUnavailableException e) {
        log.warn("[GlobalExceptionHandler] Vocabulary unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(e.getMessage(), "VOCABULARY_UNAVAILABLE"));
    }

    @ExceptionHandler(VocabularyStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(VocabularyStorageException e) {
        log.error("[GlobalExceptionHandler] Vocabulary storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Error saving keywords", "STORAGE_ERROR"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(message, "VALIDATION_ERROR"));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Malformed request", "VALIDATION_ERROR"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error, please try again later", "INTERNAL_ERROR"));
    }
}
