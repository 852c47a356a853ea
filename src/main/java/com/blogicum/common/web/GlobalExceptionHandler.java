package com.blogicum.common.web;

import com.blogicum.common.api.ApiCodes;
import com.blogicum.common.api.BlogException;
import com.blogicum.common.api.Result;
import com.blogicum.common.ratelimit.RateLimitExceededException;
import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.DenialMode;
import com.blogicum.domain.policy.AccessDeniedException;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;

/**
 * 全局异常处理：把业务异常“翻译”为统一的 Result JSON。
 *
 * <p>HTTP 状态码仍然会设置（400/401/403/404/429/500），但响应体结构始终一致。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BlogException.class)
    public ResponseEntity<Result<Void>> handleBlog(BlogException e) {
        return ResponseEntity.status(e.getKind().getStatus())
                .body(Result.fail(e.getKind().getCode(), e.getMessage()));
    }

    /**
     * 所有权校验失败。跳转还是 403 已经在授权边界决定好了，这里只照做。
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Result<Void>> handleAccessDenied(AccessDeniedException e) {
        if (e.getDecision() == AccessDecision.DENIED_UNAUTHENTICATED) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Result.fail(ApiCodes.UNAUTHORIZED, e.getDecision().getReason()));
        }
        if (e.getDenialMode() == DenialMode.REDIRECT) {
            return ResponseEntity.status(HttpStatus.SEE_OTHER)
                    .location(URI.create("/posts/" + e.getPostId()))
                    .body(Result.fail(ApiCodes.FORBIDDEN, e.getDecision().getReason()));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Result.fail(ApiCodes.FORBIDDEN, e.getDecision().getReason()));
    }

    /**
     * Spring Validation（@Valid）触发的参数错误。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "invalid_request"
                : "invalid_" + e.getBindingResult().getFieldErrors().get(0).getField();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 请求体无法解析，包括日期格式不对的 pubDate。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "malformed_request"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "bad_" + e.getName()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Result<Void>> handleRateLimit(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(Result.fail(ApiCodes.TOO_MANY_REQUESTS, e.getMessage()));
    }

    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Result<Void>> handleJwt(JwtException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, "invalid_token"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    /**
     * 兜底：数据库连接、约束冲突等未预期异常，避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
