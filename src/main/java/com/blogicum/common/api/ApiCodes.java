package com.blogicum.common.api;

/**
 * 统一错误码定义。
 *
 * <p>按 HTTP 语义分段：4xx00 表示调用方问题，50000 表示服务端未预期异常。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 已登录，但不是资源所有者 */
    public static final int FORBIDDEN = 40300;

    /** 资源不存在，或对当前访问者不可见（两者对调用方不可区分） */
    public static final int NOT_FOUND = 40400;

    /** 触发限流 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
