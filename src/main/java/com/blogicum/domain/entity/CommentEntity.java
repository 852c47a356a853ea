package com.blogicum.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.blogicum.domain.policy.Owned;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_comment")
public class CommentEntity implements Owned {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String text;

    private Long authorId;

    private Long postId;

    private LocalDateTime createdAt;
}
