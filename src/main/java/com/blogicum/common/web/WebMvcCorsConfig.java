package com.blogicum.common.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 前端单独部署时的跨域配置；允许的 origin 来自 blog.cors.allowed-origin-patterns。
 */
@Configuration
public class WebMvcCorsConfig implements WebMvcConfigurer {

    private final String[] allowedOriginPatterns;

    public WebMvcCorsConfig(@Value("${blog.cors.allowed-origin-patterns:http://localhost:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Location", "Retry-After")
                .maxAge(3600);
    }
}
