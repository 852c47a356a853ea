package com.blogicum.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_account")
public class AccountEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String username;

    private String passwordHash;

    private String firstName;

    private String lastName;

    private String email;

    /** staff 账号：是否能越权由 blog.access.* 决定 */
    private Boolean isStaff;

    private LocalDateTime createdAt;
}
