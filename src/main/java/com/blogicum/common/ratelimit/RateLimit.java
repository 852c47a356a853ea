package com.blogicum.common.ratelimit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 固定窗口限流：windowSeconds 内同一 key 最多 max 次。
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    String name();

    long windowSeconds();

    long max();

    RateLimitKey key() default RateLimitKey.USER;
}
