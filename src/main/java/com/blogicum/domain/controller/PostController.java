package com.blogicum.domain.controller;

import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.common.api.Result;
import com.blogicum.domain.config.PaginationProperties;
import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostForm;
import com.blogicum.domain.dto.PostScope;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.service.PostQueryService;
import com.blogicum.domain.service.PostService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class PostController {

    private final PostQueryService postQueryService;
    private final PostService postService;
    private final PaginationProperties pagination;

    public PostController(
            PostQueryService postQueryService,
            PostService postService,
            PaginationProperties pagination
    ) {
        this.postQueryService = postQueryService;
        this.postService = postService;
        this.pagination = pagination;
    }

    public record PostRequest(
            String title,
            String text,
            String imageRef,
            LocalDateTime pubDate,
            Boolean isPublished,
            Long categoryId,
            Long locationId
    ) {
        PostForm toForm() {
            return new PostForm(title, text, imageRef, pubDate, isPublished, categoryId, locationId);
        }
    }

    public record CreatePostResponse(Long postId) {
    }

    @GetMapping("/posts")
    public Result<PageResult<PostView>> index(
            HttpServletRequest request,
            @RequestParam(defaultValue = "1") int page
    ) {
        return Result.ok(postQueryService.page(
                AccessTokenInterceptor.viewerOf(request), PostScope.all(), page, pagination.pageSize()));
    }

    @GetMapping("/category/{slug}")
    public Result<PostQueryService.CategoryPage> category(
            HttpServletRequest request,
            @PathVariable String slug,
            @RequestParam(defaultValue = "1") int page
    ) {
        return Result.ok(postQueryService.byCategory(
                AccessTokenInterceptor.viewerOf(request), slug, page, pagination.pageSize()));
    }

    @GetMapping("/posts/{postId}")
    public Result<PostService.PostDetail> detail(HttpServletRequest request, @PathVariable long postId) {
        return Result.ok(postService.detail(AccessTokenInterceptor.viewerOf(request), postId));
    }

    @PostMapping("/posts")
    public Result<CreatePostResponse> create(HttpServletRequest request, @RequestBody(required = false) PostRequest req) {
        PostForm form = req == null ? null : req.toForm();
        long postId = postService.create(AccessTokenInterceptor.viewerOf(request), form);
        return Result.ok(new CreatePostResponse(postId));
    }

    @PutMapping("/posts/{postId}")
    public Result<Void> edit(
            HttpServletRequest request,
            @PathVariable long postId,
            @RequestBody(required = false) PostRequest req
    ) {
        postService.edit(AccessTokenInterceptor.viewerOf(request), postId, req == null ? null : req.toForm());
        return Result.okVoid();
    }

    @DeleteMapping("/posts/{postId}")
    public Result<Void> delete(HttpServletRequest request, @PathVariable long postId) {
        postService.delete(AccessTokenInterceptor.viewerOf(request), postId);
        return Result.okVoid();
    }
}
