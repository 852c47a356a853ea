package com.blogicum.domain.dto;

import java.time.LocalDateTime;

public record CommentView(
        Long id,
        Long postId,
        Long authorId,
        String authorUsername,
        String text,
        LocalDateTime createdAt
) {
}
