package com.blogicum.domain.dto;

import java.time.LocalDateTime;

/**
 * 创建/编辑帖子的输入。author 不在这里：永远取自访问者。
 */
public record PostForm(
        String title,
        String text,
        String imageRef,
        LocalDateTime pubDate,
        Boolean isPublished,
        Long categoryId,
        Long locationId
) {
}
