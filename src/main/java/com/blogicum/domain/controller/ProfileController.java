package com.blogicum.domain.controller;

import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.common.api.Result;
import com.blogicum.domain.config.PaginationProperties;
import com.blogicum.domain.dto.AccountView;
import com.blogicum.domain.service.ProfileService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final ProfileService profileService;
    private final PaginationProperties pagination;

    public record EditProfileRequest(
            @Size(max = 150) String firstName,
            @Size(max = 150) String lastName,
            @Email @Size(max = 254) String email
    ) {
    }

    @GetMapping("/{username}")
    public Result<ProfileService.Profile> profile(
            HttpServletRequest request,
            @PathVariable String username,
            @RequestParam(defaultValue = "1") int page
    ) {
        return Result.ok(profileService.getProfile(
                AccessTokenInterceptor.viewerOf(request), username, page, pagination.pageSize()));
    }

    /**
     * 编辑的永远是访问者自己，路径里不带用户名。
     */
    @PutMapping
    public Result<AccountView> edit(HttpServletRequest request, @Valid @RequestBody EditProfileRequest req) {
        return Result.ok(profileService.editOwnProfile(
                AccessTokenInterceptor.viewerOf(request), req.firstName(), req.lastName(), req.email()));
    }
}
