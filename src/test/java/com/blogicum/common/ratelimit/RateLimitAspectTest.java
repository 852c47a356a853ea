package com.blogicum.common.ratelimit;

import com.blogicum.auth.dto.LoginRequest;
import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.auth.web.AuthController;
import com.blogicum.domain.controller.CommentController;
import com.blogicum.domain.policy.Viewer;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;

class RateLimitAspectTest {

    private final RateLimitAspect aspect = new RateLimitAspect(new RateLimitProperties(), mock(StringRedisTemplate.class));

    private static RateLimit annotationOf(Class<?> type, String method, Class<?>... params) throws Exception {
        return type.getMethod(method, params).getAnnotation(RateLimit.class);
    }

    @Test
    void resolveIp_ShouldPreferForwardedHeaders_WhenEnabled() {
        RateLimitProperties props = new RateLimitProperties();
        props.setTrustForwardedHeaders(true);
        RateLimitAspect trusting = new RateLimitAspect(props, mock(StringRedisTemplate.class));

        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.1");
        req.addHeader("X-Forwarded-For", "1.2.3.4, 5.6.7.8");
        assertEquals("1.2.3.4", trusting.resolveIp(req));
    }

    @Test
    void resolveIp_ShouldIgnoreForwardedHeaders_ByDefault() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.2");
        req.addHeader("X-Forwarded-For", "1.2.3.4");
        assertEquals("10.0.0.2", aspect.resolveIp(req));
    }

    @Test
    void buildKey_UserKey_ShouldUseViewerAccount() throws Exception {
        RateLimit rl = annotationOf(CommentController.class, "add",
                HttpServletRequest.class, long.class, CommentController.CommentRequest.class);
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setAttribute(AccessTokenInterceptor.REQ_ATTR_VIEWER, Viewer.of(42, false));

        assertEquals("blog:rl:comment_add:USER:42", aspect.buildKey(req, new Object[0], rl));
    }

    @Test
    void buildKey_UserKey_ShouldSkipAnonymous() throws Exception {
        RateLimit rl = annotationOf(CommentController.class, "add",
                HttpServletRequest.class, long.class, CommentController.CommentRequest.class);

        assertNull(aspect.buildKey(new MockHttpServletRequest(), new Object[0], rl));
    }

    @Test
    void buildKey_IpUserKey_ShouldNormalizeUsername() throws Exception {
        RateLimit rl = annotationOf(AuthController.class, "login", LoginRequest.class);
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.3");

        String key = aspect.buildKey(req, new Object[]{new LoginRequest(" Alice ", "pw")}, rl);

        assertEquals("blog:rl:auth_login:IP_USER:10.0.0.3:alice", key);
    }
}
