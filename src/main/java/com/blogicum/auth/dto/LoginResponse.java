package com.blogicum.auth.dto;

public record LoginResponse(
        long accountId,
        String username,
        String accessToken,
        long accessTokenExpiresInSeconds
) {
}
