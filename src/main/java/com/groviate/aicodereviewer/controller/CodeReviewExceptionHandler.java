package com.groviate.aicodereviewer.controller;

import com.groviate.aicodereviewer.exception.CodeReviewException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Глобальный обработчик исключений REST-контроллеров.
 * <p>
 * Преобразует доменные исключения ревьюера в единый JSON-ответ и логирует ошибки.
 * Для неизвестных ошибок возвращает стандартный ответ 500.
 */
@RestControllerAdvice
@Slf4j
public class CodeReviewExceptionHandler {

    @ExceptionHandler(CodeReviewException.class)
    public ResponseEntity<Map<String, Object>> handleReviewException(CodeReviewException ex,
                                                                     HttpServletRequest request) {
        log.warn("Исключение ревьюера: code={}, status={}, path={}",
                ex.getCode(), ex.getStatus(), request.getRequestURI(), ex);

        return ResponseEntity.status(ex.getStatus())
                .body(body(request, ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.debug("Некорректный запрос, по пути={}: {}", request.getRequestURI(), ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(request, "BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex,
                                                                HttpServletRequest request) {
        log.error("Непредвиденная ошибка, по пути={}", request.getRequestURI(), ex);

        return ResponseEntity.internalServerError()
                .body(body(request, "UNEXPECTED", "Unexpected server error"));
    }

    private static Map<String, Object> body(HttpServletRequest request, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("path", request.getRequestURI());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
