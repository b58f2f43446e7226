package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.client.dto.Response;
import com.restaurantbi.insightflow.client.dto.SingleResponse;
import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import com.restaurantbi.insightflow.domain.exception.ConflictException;
import com.restaurantbi.insightflow.domain.exception.InsightflowException;
import com.restaurantbi.insightflow.domain.exception.PipelineNotFoundException;
import com.restaurantbi.insightflow.domain.exception.RunNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 将异常映射为统一的 Response 结构
 * <ul>
 *   <li>ConflictException: 409，data 为仍在运行的 runId</li>
 *   <li>ConfigurationException / 请求校验失败: 400</li>
 *   <li>RunNotFoundException / PipelineNotFoundException: 404</li>
 *   <li>其他: 500</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<SingleResponse<String>> handleConflict(ConflictException e) {
        log.warn("Rejected trigger: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(SingleResponse.buildFailureWith(e.getErrorCode().name(), e.getMessage(), e.getActiveRunId()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Response> handleConfiguration(ConfigurationException e) {
        return failure(HttpStatus.BAD_REQUEST, e.getErrorCode().name(), e.getMessage());
    }

    @ExceptionHandler({RunNotFoundException.class, PipelineNotFoundException.class})
    public ResponseEntity<Response> handleNotFound(InsightflowException e) {
        return failure(HttpStatus.NOT_FOUND, e.getErrorCode().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Response> handleInvalidArgument(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return failure(HttpStatus.BAD_REQUEST, INVALID_REQUEST, message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Response> handleBadRequest(Exception e) {
        return failure(HttpStatus.BAD_REQUEST, INVALID_REQUEST, e.getMessage());
    }

    @ExceptionHandler(InsightflowException.class)
    public ResponseEntity<Response> handleDomain(InsightflowException e) {
        log.error("Request failed with {}", e.getErrorCode(), e);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode().name(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response> handleUnexpected(Exception e) {
        log.error("Unexpected request failure", e);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, e.getMessage());
    }

    private static ResponseEntity<Response> failure(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Response.buildFailure(code, message));
    }
}
