package com.blogicum.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "blog.pagination")
public record PaginationProperties(int pageSize) {

    public PaginationProperties {
        if (pageSize <= 0) {
            pageSize = 10;
        }
    }
}
