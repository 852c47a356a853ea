package com.blogicum.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 所有权校验结果。
 */
@Getter
@RequiredArgsConstructor
public enum AccessDecision {

    ALLOWED("allowed"),

    /** 匿名访问者 */
    DENIED_UNAUTHENTICATED("unauthorized"),

    /** 已登录但不是作者 */
    DENIED_NOT_OWNER("forbidden");

    private final String reason;

    public boolean allowed() {
        return this == ALLOWED;
    }
}
