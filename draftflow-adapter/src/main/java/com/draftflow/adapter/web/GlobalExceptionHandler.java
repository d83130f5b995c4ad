package com.draftflow.adapter.web;

import com.draftflow.client.dto.Response;
import com.draftflow.domain.exception.InvalidTransitionException;
import com.draftflow.domain.exception.RelocationException;
import com.draftflow.domain.exception.WorkflowException;
import com.draftflow.domain.exception.WorkflowNotFoundException;
import com.draftflow.domain.exception.WorkflowValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 统一异常处理
 * <p>
 * 领域异常按错误码映射 HTTP 状态：VALIDATION_ERROR → 400，NOT_FOUND → 404，
 * INVALID_TRANSITION → 409；其余异常返回 SYSTEM_ERROR 并记录堆栈。
 * </p>
 *
 * @author draftflow
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String SYSTEM_ERROR = "SYSTEM_ERROR";

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<Response> handleValidation(WorkflowValidationException ex, HttpServletRequest request) {
        log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return failure(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(WorkflowNotFoundException.class)
    public ResponseEntity<Response> handleNotFound(WorkflowNotFoundException ex, HttpServletRequest request) {
        log.warn("Not found {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return failure(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Response> handleInvalidTransition(InvalidTransitionException ex, HttpServletRequest request) {
        log.warn("Invalid transition {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return failure(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(RelocationException.class)
    public ResponseEntity<Response> handleRelocation(RelocationException ex, HttpServletRequest request) {
        log.error("Relocation failed {} {}", request.getMethod(), request.getRequestURI(), ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Response> handleArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Response> handleConstraintViolation(ConstraintViolationException ex) {
        String message = ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<Response> handleBadRequest(Exception ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Response.buildFailure(SYSTEM_ERROR, "Internal error"));
    }

    private static ResponseEntity<Response> failure(HttpStatus status, WorkflowException ex) {
        return ResponseEntity.status(status).body(Response.buildFailure(ex.getErrCode(), ex.getMessage()));
    }

    private static ResponseEntity<Response> badRequest(String message) {
        return ResponseEntity.badRequest()
            .body(Response.buildFailure(WorkflowValidationException.ERR_CODE, message));
    }
}
