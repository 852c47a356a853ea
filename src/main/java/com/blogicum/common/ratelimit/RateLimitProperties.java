package com.blogicum.common.ratelimit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "blog.ratelimit")
public class RateLimitProperties {

    private boolean enabled = true;

    /** 只有部署在可信反向代理后面时才打开 */
    private boolean trustForwardedHeaders = false;

    /** Redis 不可用时放行 */
    private boolean failOpen = true;

    private String keyPrefix = "blog:rl:";
}
