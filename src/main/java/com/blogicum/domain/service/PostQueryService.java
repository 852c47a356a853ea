package com.blogicum.domain.service;

import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostScope;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.policy.Viewer;

import java.util.List;

/**
 * 帖子列表：按访问者过滤可见性、按 pubDate 倒序（同一时间按 id 正序），
 * 带实时评论数，最后才分页。
 */
public interface PostQueryService {

    /**
     * 过滤 + 排序 + 评论数，不分页。
     */
    List<PostView> resolve(Viewer viewer, PostScope scope);

    PageResult<PostView> page(Viewer viewer, PostScope scope, int page, int pageSize);

    CategoryPage byCategory(Viewer viewer, String slug, int page, int pageSize);

    record CategoryView(
            Long id,
            String slug,
            String title,
            String description
    ) {
    }

    record CategoryPage(
            CategoryView category,
            PageResult<PostView> posts
    ) {
    }
}
