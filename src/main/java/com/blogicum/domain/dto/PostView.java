package com.blogicum.domain.dto;

import java.time.LocalDateTime;

/**
 * 列表/详情里的帖子，带作者、分类、地点的展示字段和实时评论数。
 */
public record PostView(
        Long id,
        String title,
        String text,
        String imageRef,
        LocalDateTime pubDate,
        Boolean isPublished,
        Long authorId,
        String authorUsername,
        Long categoryId,
        String categorySlug,
        String categoryTitle,
        Long locationId,
        String locationName,
        long commentCount,
        LocalDateTime createdAt
) {
}
