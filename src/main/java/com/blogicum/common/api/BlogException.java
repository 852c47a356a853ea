package com.blogicum.common.api;

import lombok.Getter;

/**
 * service 层的业务异常：携带 {@link ErrorKind} 和一个简短的 reason（例如 {@code not_found}）。
 *
 * <p>由 GlobalExceptionHandler 统一翻译成 Result JSON。</p>
 */
@Getter
public class BlogException extends RuntimeException {

    private final ErrorKind kind;

    public BlogException(ErrorKind kind, String reason) {
        super(reason);
        this.kind = kind;
    }

    public static BlogException notFound() {
        return new BlogException(ErrorKind.NOT_FOUND, "not_found");
    }

    public static BlogException unauthenticated() {
        return new BlogException(ErrorKind.DENIED_UNAUTHENTICATED, "unauthorized");
    }

    public static BlogException validation(String reason) {
        return new BlogException(ErrorKind.VALIDATION, reason);
    }
}
