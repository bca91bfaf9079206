package com.example.clustermonitor.controller;

import com.example.clustermonitor.agent.FailureReport;
import com.example.clustermonitor.mcp.McpClientException;
import com.example.clustermonitor.retry.RetryExhaustedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps MCP client failures to HTTP responses naming the failed step and last cause.
 */
@Slf4j
@RestControllerAdvice
public class McpExceptionHandler {

    @ExceptionHandler(McpClientException.class)
    public ResponseEntity<Map<String, Object>> handleClientFailure(McpClientException e, HttpServletRequest request) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_CONNECTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case PROTOCOL, REMOTE -> HttpStatus.BAD_GATEWAY;
        };
        return respond(status, request, e);
    }

    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(RetryExhaustedException e, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, request, e);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, HttpServletRequest request, Throwable e) {
        String step = request.getMethod() + " " + request.getRequestURI();
        log.error(FailureReport.describe(step, e));
        return ResponseEntity.status(status).body(FailureReport.details(step, e));
    }
}
