package com.blogicum.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.blogicum.domain.policy.Owned;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_post")
public class PostEntity implements Owned {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String title;

    private String text;

    /** 图片引用（存储在外部，这里只存路径/URL） */
    private String imageRef;

    /** 计划/实际发布时间；晚于 now 的帖子只有作者能看到 */
    private LocalDateTime pubDate;

    private Boolean isPublished;

    /** 创建时写入，之后不再修改 */
    private Long authorId;

    private Long categoryId;

    private Long locationId;

    private LocalDateTime createdAt;

    /** 联表查询带出的 t_category.is_published；无分类时为 null */
    @TableField(exist = false)
    private Boolean categoryPublished;
}
