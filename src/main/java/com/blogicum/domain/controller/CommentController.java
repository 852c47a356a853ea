package com.blogicum.domain.controller;

import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.common.api.Result;
import com.blogicum.common.ratelimit.RateLimit;
import com.blogicum.domain.dto.CommentView;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.CommentService;
import com.blogicum.domain.service.PostService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/posts/{postId}/comments")
public class CommentController {

    private final PostService postService;
    private final CommentService commentService;

    public CommentController(PostService postService, CommentService commentService) {
        this.postService = postService;
        this.commentService = commentService;
    }

    public record CommentRequest(String text) {
    }

    /**
     * 读评论要求帖子对访问者可见；写评论只要求帖子存在。
     */
    @GetMapping
    public Result<List<CommentView>> list(HttpServletRequest request, @PathVariable long postId) {
        postService.requireVisible(AccessTokenInterceptor.viewerOf(request), postId);
        return Result.ok(commentService.list(postId));
    }

    @PostMapping
    @RateLimit(name = "comment_add", windowSeconds = 60, max = 20)
    public Result<CommentView> add(
            HttpServletRequest request,
            @PathVariable long postId,
            @RequestBody(required = false) CommentRequest req
    ) {
        Viewer viewer = AccessTokenInterceptor.viewerOf(request);
        return Result.ok(commentService.add(viewer, postId, req == null ? null : req.text()));
    }

    @PutMapping("/{commentId}")
    public Result<Void> edit(
            HttpServletRequest request,
            @PathVariable long postId,
            @PathVariable long commentId,
            @RequestBody(required = false) CommentRequest req
    ) {
        commentService.edit(AccessTokenInterceptor.viewerOf(request), postId, commentId, req == null ? null : req.text());
        return Result.okVoid();
    }

    @DeleteMapping("/{commentId}")
    public Result<Void> delete(
            HttpServletRequest request,
            @PathVariable long postId,
            @PathVariable long commentId
    ) {
        commentService.delete(AccessTokenInterceptor.viewerOf(request), postId, commentId);
        return Result.okVoid();
    }
}
