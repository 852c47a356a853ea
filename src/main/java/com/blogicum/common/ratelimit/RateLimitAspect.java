package com.blogicum.common.ratelimit;

import com.blogicum.auth.dto.LoginRequest;
import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.domain.policy.Viewer;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.List;
import java.util.Locale;

/**
 * {@link RateLimit} 的实现：Redis INCR + EXPIRE 固定窗口。
 */
@Slf4j
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitProperties props;
    private final StringRedisTemplate redis;

    private final DefaultRedisScript<Long> script = buildScript();

    @Around("@annotation(rateLimit)")
    public Object around(ProceedingJoinPoint pjp, RateLimit rateLimit) throws Throwable {
        if (!props.isEnabled()) {
            return pjp.proceed();
        }
        HttpServletRequest req = currentRequest();
        if (req == null) {
            return pjp.proceed();
        }
        String key = buildKey(req, pjp.getArgs(), rateLimit);
        if (key == null) {
            return pjp.proceed();
        }

        Long retryAfter;
        try {
            retryAfter = redis.execute(
                    script,
                    List.of(key),
                    String.valueOf(Math.max(1, rateLimit.windowSeconds())),
                    String.valueOf(Math.max(1, rateLimit.max()))
            );
        } catch (Exception e) {
            if (!props.isFailOpen()) {
                throw new RateLimitExceededException("too_many_requests", Math.max(1, rateLimit.windowSeconds()));
            }
            log.debug("ratelimit redis failed, fail-open: name={}, method={}, err={}",
                    rateLimit.name(), methodName(pjp), e.toString());
            return pjp.proceed();
        }
        if (retryAfter != null && retryAfter > 0) {
            throw new RateLimitExceededException("too_many_requests", retryAfter);
        }
        return pjp.proceed();
    }

    String buildKey(HttpServletRequest req, Object[] args, RateLimit rateLimit) {
        RateLimitKey keyType = rateLimit.key();
        String value;
        if (keyType == RateLimitKey.IP) {
            value = resolveIp(req);
        } else if (keyType == RateLimitKey.USER) {
            Viewer viewer = AccessTokenInterceptor.viewerOf(req);
            value = viewer.isAuthenticated() ? String.valueOf(viewer.accountId()) : null;
        } else {
            String ip = resolveIp(req);
            String username = extractUsername(args);
            value = ip == null || username == null || username.isBlank()
                    ? null
                    : ip + ":" + username.trim().toLowerCase(Locale.ROOT);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        String prefix = props.getKeyPrefix() == null ? "" : props.getKeyPrefix();
        return prefix + rateLimit.name() + ":" + keyType.name() + ":" + value;
    }

    String extractUsername(Object[] args) {
        if (args == null) {
            return null;
        }
        for (Object arg : args) {
            if (arg instanceof LoginRequest r) {
                return r.username();
            }
        }
        return null;
    }

    String resolveIp(HttpServletRequest req) {
        if (req == null) {
            return null;
        }
        if (props.isTrustForwardedHeaders()) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return req.getRemoteAddr();
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        return attrs instanceof ServletRequestAttributes sra ? sra.getRequest() : null;
    }

    private static String methodName(ProceedingJoinPoint pjp) {
        return pjp.getSignature() instanceof MethodSignature sig ? sig.getMethod().getName() : "?";
    }

    private static DefaultRedisScript<Long> buildScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local c = redis.call('INCR', KEYS[1])
                if c == 1 then
                  redis.call('EXPIRE', KEYS[1], ARGV[1])
                end
                if c > tonumber(ARGV[2]) then
                  local ttl = redis.call('TTL', KEYS[1])
                  if ttl < 0 then ttl = tonumber(ARGV[1]) end
                  return ttl
                end
                return 0
                """);
        return s;
    }
}
