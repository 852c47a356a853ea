package com.blogicum.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 分类：只由管理端维护。未发布的分类对外等同于不存在。
 */
@Data
@TableName("t_category")
public class CategoryEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String slug;

    private String title;

    private String description;

    private Boolean isPublished;

    private LocalDateTime createdAt;
}
