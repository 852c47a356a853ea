package com.blogicum.domain.policy;

/**
 * 一次请求的访问者身份，可能是匿名的。
 *
 * <p>由 AccessTokenInterceptor 解析后放入 request attribute，controller 显式传给 service；
 * service 层从不读取全局的“当前用户”。</p>
 */
public record Viewer(Long accountId, boolean staff) {

    private static final Viewer ANONYMOUS = new Viewer(null, false);

    public static Viewer anonymous() {
        return ANONYMOUS;
    }

    public static Viewer of(long accountId, boolean staff) {
        return new Viewer(accountId, staff);
    }

    public boolean isAuthenticated() {
        return accountId != null && accountId > 0;
    }

    public boolean is(Long authorId) {
        return isAuthenticated() && authorId != null && accountId.equals(authorId);
    }
}
