package com.blogicum.domain.service;

import com.blogicum.domain.dto.CommentCountRow;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.entity.CategoryEntity;
import com.blogicum.domain.entity.LocationEntity;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.mapper.AccountMapper;
import com.blogicum.domain.mapper.CategoryMapper;
import com.blogicum.domain.mapper.CommentMapper;
import com.blogicum.domain.mapper.LocationMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * PostEntity -> PostView：批量补齐作者名、分类、地点和实时评论数，保持输入顺序。
 */
@Component
public class PostViewAssembler {

    private final CommentMapper commentMapper;
    private final AccountMapper accountMapper;
    private final CategoryMapper categoryMapper;
    private final LocationMapper locationMapper;

    public PostViewAssembler(
            CommentMapper commentMapper,
            AccountMapper accountMapper,
            CategoryMapper categoryMapper,
            LocationMapper locationMapper
    ) {
        this.commentMapper = commentMapper;
        this.accountMapper = accountMapper;
        this.categoryMapper = categoryMapper;
        this.locationMapper = locationMapper;
    }

    public List<PostView> toViews(List<PostEntity> posts) {
        if (posts == null || posts.isEmpty()) {
            return List.of();
        }

        Set<Long> postIds = new LinkedHashSet<>();
        Set<Long> authorIds = new LinkedHashSet<>();
        Set<Long> categoryIds = new LinkedHashSet<>();
        Set<Long> locationIds = new LinkedHashSet<>();
        for (PostEntity p : posts) {
            if (p == null || p.getId() == null) continue;
            postIds.add(p.getId());
            if (p.getAuthorId() != null) authorIds.add(p.getAuthorId());
            if (p.getCategoryId() != null) categoryIds.add(p.getCategoryId());
            if (p.getLocationId() != null) locationIds.add(p.getLocationId());
        }

        Map<Long, Long> counts = commentCounts(postIds);
        Map<Long, AccountEntity> authors = byId(authorIds, accountMapper::selectBatchIds, AccountEntity::getId);
        Map<Long, CategoryEntity> categories = byId(categoryIds, categoryMapper::selectBatchIds, CategoryEntity::getId);
        Map<Long, LocationEntity> locations = byId(locationIds, locationMapper::selectBatchIds, LocationEntity::getId);

        List<PostView> out = new ArrayList<>(posts.size());
        for (PostEntity p : posts) {
            if (p == null || p.getId() == null) continue;
            AccountEntity author = authors.get(p.getAuthorId());
            CategoryEntity category = categories.get(p.getCategoryId());
            LocationEntity location = locations.get(p.getLocationId());
            out.add(new PostView(
                    p.getId(),
                    p.getTitle(),
                    p.getText(),
                    p.getImageRef(),
                    p.getPubDate(),
                    p.getIsPublished(),
                    p.getAuthorId(),
                    author == null ? null : author.getUsername(),
                    p.getCategoryId(),
                    category == null ? null : category.getSlug(),
                    category == null ? null : category.getTitle(),
                    p.getLocationId(),
                    location == null ? null : location.getName(),
                    counts.getOrDefault(p.getId(), 0L),
                    p.getCreatedAt()
            ));
        }
        return out;
    }

    public PostView toView(PostEntity post) {
        List<PostView> views = toViews(List.of(post));
        return views.isEmpty() ? null : views.get(0);
    }

    private Map<Long, Long> commentCounts(Set<Long> postIds) {
        if (postIds.isEmpty()) {
            return Map.of();
        }
        List<CommentCountRow> rows = commentMapper.countByPostIds(postIds);
        Map<Long, Long> out = new HashMap<>();
        if (rows != null) {
            for (CommentCountRow r : rows) {
                if (r != null && r.getPostId() != null) {
                    out.put(r.getPostId(), r.getCommentCount() == null ? 0L : r.getCommentCount());
                }
            }
        }
        return out;
    }

    private static <E> Map<Long, E> byId(Set<Long> ids,
                                         Function<Collection<Long>, List<E>> loader,
                                         Function<E, Long> idOf) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        List<E> rows = loader.apply(ids);
        Map<Long, E> out = new HashMap<>();
        if (rows != null) {
            for (E e : rows) {
                if (e != null && idOf.apply(e) != null) {
                    out.put(idOf.apply(e), e);
                }
            }
        }
        return out;
    }
}
