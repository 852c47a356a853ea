package com.blogicum.common.api;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 业务错误分类，每类对应一个错误码与 HTTP 状态。
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    /** 实体不存在，或被可见性规则过滤掉 */
    NOT_FOUND(ApiCodes.NOT_FOUND, HttpStatus.NOT_FOUND),

    /** 没有登录身份 */
    DENIED_UNAUTHENTICATED(ApiCodes.UNAUTHORIZED, HttpStatus.UNAUTHORIZED),

    /** 输入不合法：空评论、非法页码、日期格式错误等 */
    VALIDATION(ApiCodes.BAD_REQUEST, HttpStatus.BAD_REQUEST);

    private final int code;

    private final HttpStatus status;
}
