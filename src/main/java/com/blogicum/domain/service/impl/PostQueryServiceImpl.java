package com.blogicum.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.blogicum.common.api.BlogException;
import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostScope;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.entity.CategoryEntity;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.mapper.CategoryMapper;
import com.blogicum.domain.mapper.PostMapper;
import com.blogicum.domain.policy.PostVisibilityPolicy;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.PostQueryService;
import com.blogicum.domain.service.PostViewAssembler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class PostQueryServiceImpl implements PostQueryService {

    /** pubDate 倒序；同一时间按 id 正序，不依赖数据库默认顺序 */
    static final Comparator<PostEntity> NEWEST_FIRST = Comparator
            .comparing(PostEntity::getPubDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(PostEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PostMapper postMapper;
    private final CategoryMapper categoryMapper;
    private final PostVisibilityPolicy visibilityPolicy;
    private final PostViewAssembler assembler;
    private final Clock clock;

    public PostQueryServiceImpl(
            PostMapper postMapper,
            CategoryMapper categoryMapper,
            PostVisibilityPolicy visibilityPolicy,
            PostViewAssembler assembler,
            Clock clock
    ) {
        this.postMapper = postMapper;
        this.categoryMapper = categoryMapper;
        this.visibilityPolicy = visibilityPolicy;
        this.assembler = assembler;
        this.clock = clock;
    }

    @Override
    public List<PostView> resolve(Viewer viewer, PostScope scope) {
        Viewer v = viewer == null ? Viewer.anonymous() : viewer;
        PostScope s = scope == null ? PostScope.all() : scope;

        Long categoryId = null;
        if (s.categorySlug() != null) {
            categoryId = requirePublishedCategory(s.categorySlug()).getId();
        }
        return resolveIn(v, categoryId, s);
    }

    private List<PostView> resolveIn(Viewer v, Long categoryId, PostScope s) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean ownerView = s.ownerView() && s.authorId() != null && v.is(s.authorId());
        boolean unfiltered = ownerView || visibilityPolicy.seesEverything(v);

        List<PostEntity> candidates = postMapper.selectCandidates(
                categoryId, s.authorId(), v.accountId(), !unfiltered, now);
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<PostEntity> visible = new ArrayList<>(candidates.size());
        for (PostEntity p : candidates) {
            if (p == null || p.getId() == null) continue;
            if (unfiltered || visibilityPolicy.canView(v, p, now)) {
                visible.add(p);
            }
        }
        visible.sort(NEWEST_FIRST);
        return assembler.toViews(visible);
    }

    @Override
    public PageResult<PostView> page(Viewer viewer, PostScope scope, int page, int pageSize) {
        PageResult.checkPage(page, pageSize);
        return PageResult.slice(resolve(viewer, scope), page, pageSize);
    }

    @Override
    public CategoryPage byCategory(Viewer viewer, String slug, int page, int pageSize) {
        PageResult.checkPage(page, pageSize);
        CategoryEntity c = requirePublishedCategory(slug);
        Viewer v = viewer == null ? Viewer.anonymous() : viewer;
        List<PostView> ordered = resolveIn(v, c.getId(), PostScope.category(c.getSlug()));
        PageResult<PostView> posts = PageResult.slice(ordered, page, pageSize);
        return new CategoryPage(
                new CategoryView(c.getId(), c.getSlug(), c.getTitle(), c.getDescription()),
                posts
        );
    }

    private CategoryEntity requirePublishedCategory(String slug) {
        String s = slug == null ? "" : slug.trim();
        if (s.isEmpty()) {
            throw BlogException.notFound();
        }
        CategoryEntity c = categoryMapper.selectOne(new LambdaQueryWrapper<CategoryEntity>()
                .eq(CategoryEntity::getSlug, s)
                .last("limit 1"));
        if (c == null || !Boolean.TRUE.equals(c.getIsPublished())) {
            throw BlogException.notFound();
        }
        return c;
    }
}
