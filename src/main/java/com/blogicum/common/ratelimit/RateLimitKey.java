package com.blogicum.common.ratelimit;

public enum RateLimitKey {

    /** 客户端 IP */
    IP,

    /** 已登录账号；匿名请求不限流（由业务层返回 401） */
    USER,

    /** IP + 登录用户名，用于登录接口 */
    IP_USER
}
