package com.blogicum.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 雪花 ID（IdType.ASSIGN_ID）的 workerId / datacenterId。
 *
 * <p>多实例部署时每个实例必须配置不同的 blog.id.worker-id；未配置则使用 MyBatis-Plus 默认推导。</p>
 */
@Configuration
public class IdGeneratorConfig {
    private static final Logger log = LoggerFactory.getLogger(IdGeneratorConfig.class);

    private final long datacenterId;
    private final long workerId;

    public IdGeneratorConfig(
            @Value("${blog.id.datacenter-id:1}") long datacenterId,
            @Value("${blog.id.worker-id:-1}") long workerId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        if (workerId < 0) {
            log.info("IdGenerator: blog.id.worker-id not set, keep default");
            return DefaultIdentifierGenerator.getInstance();
        }
        long wid = normalize5Bits(workerId);
        long dc = normalize5Bits(datacenterId);
        log.info("IdGenerator: workerId={}, datacenterId={}", wid, dc);
        return new DefaultIdentifierGenerator(wid, dc);
    }

    static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
