package com.blogicum.domain.config;

import com.blogicum.domain.policy.AccessPolicyProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({AccessPolicyProperties.class, PaginationProperties.class})
public class DomainConfig {

    /**
     * 可见性判断里的 now 统一从这里取（测试可替换）。
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
