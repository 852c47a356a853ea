package com.blogicum.domain.enums;

/**
 * 非作者尝试编辑/删除时的响应方式。
 */
public enum DenialMode {

    /** 303 跳回帖子详情页 */
    REDIRECT,

    /** 403 */
    FORBIDDEN
}
