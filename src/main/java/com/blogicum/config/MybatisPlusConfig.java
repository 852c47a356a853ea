package com.blogicum.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.blogicum.**.mapper")
public class MybatisPlusConfig {
}
