package com.blogicum.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 个人主页上的账号信息；email 只对本人返回。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountView(
        Long id,
        String username,
        String firstName,
        String lastName,
        String email
) {
}
