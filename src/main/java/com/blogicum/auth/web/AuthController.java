package com.blogicum.auth.web;

import com.blogicum.auth.dto.LoginRequest;
import com.blogicum.auth.dto.LoginResponse;
import com.blogicum.auth.dto.RegisterRequest;
import com.blogicum.auth.service.AuthService;
import com.blogicum.common.api.Result;
import com.blogicum.common.ratelimit.RateLimit;
import com.blogicum.common.ratelimit.RateLimitKey;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 注册与登录。登录态是无状态的 JWT accessToken，请求时放在 {@code Authorization: Bearer ...}。
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @RateLimit(name = "auth_register", windowSeconds = 60, max = 5, key = RateLimitKey.IP)
    public Result<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        return Result.ok(authService.register(request));
    }

    @PostMapping("/login")
    @RateLimit(name = "auth_login", windowSeconds = 60, max = 5, key = RateLimitKey.IP_USER)
    public Result<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return Result.ok(authService.login(request));
    }
}
