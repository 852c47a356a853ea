package com.blogicum.common.web;

import com.blogicum.common.api.ApiCodes;
import com.blogicum.common.api.BlogException;
import com.blogicum.common.api.Result;
import com.blogicum.common.ratelimit.RateLimitExceededException;
import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.DenialMode;
import com.blogicum.domain.policy.AccessDeniedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.GET, "postz/1"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleBlog_ShouldMapKindToStatusAndCode() {
        ResponseEntity<Result<Void>> notFound = handler.handleBlog(BlogException.notFound());
        ResponseEntity<Result<Void>> invalid = handler.handleBlog(BlogException.validation("empty_text"));

        assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(notFound.getBody().message()).isEqualTo("not_found");
        assertThat(invalid.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(invalid.getBody().code()).isEqualTo(ApiCodes.BAD_REQUEST);
        assertThat(invalid.getBody().message()).isEqualTo("empty_text");
    }

    @Test
    void handleAccessDenied_RedirectMode_ShouldReturn303ToPostDetail() {
        ResponseEntity<Result<Void>> resp = handler.handleAccessDenied(
                new AccessDeniedException(AccessDecision.DENIED_NOT_OWNER, DenialMode.REDIRECT, 42));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SEE_OTHER);
        assertThat(resp.getHeaders().getLocation()).isEqualTo(URI.create("/posts/42"));
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.FORBIDDEN);
    }

    @Test
    void handleAccessDenied_ForbiddenMode_ShouldReturn403WithoutLocation() {
        ResponseEntity<Result<Void>> resp = handler.handleAccessDenied(
                new AccessDeniedException(AccessDecision.DENIED_NOT_OWNER, DenialMode.FORBIDDEN, 42));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(resp.getHeaders().getLocation()).isNull();
    }

    @Test
    void handleAccessDenied_Unauthenticated_ShouldAlwaysBe401() {
        ResponseEntity<Result<Void>> resp = handler.handleAccessDenied(
                new AccessDeniedException(AccessDecision.DENIED_UNAUTHENTICATED, DenialMode.REDIRECT, 42));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.UNAUTHORIZED);
    }

    @Test
    void handleRateLimit_ShouldSetRetryAfter() {
        ResponseEntity<Result<Void>> resp = handler.handleRateLimit(new RateLimitExceededException("too_many_requests", 17));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(resp.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("17");
    }

    @Test
    void handleAny_ShouldHideDetails() {
        ResponseEntity<Result<Void>> resp = handler.handleAny(new IllegalStateException("db down"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resp.getBody().message()).isEqualTo("internal_error");
    }
}
