package com.blogicum.domain.dto;

import lombok.Data;

@Data
public class CommentCountRow {

    private Long postId;

    private Long commentCount;
}
