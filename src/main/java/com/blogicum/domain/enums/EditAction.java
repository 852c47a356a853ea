package com.blogicum.domain.enums;

/**
 * 需要所有权校验的写操作。
 */
public enum EditAction {

    EDIT,

    DELETE
}
