package com.blogicum.support;

import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.entity.CategoryEntity;
import com.blogicum.domain.entity.CommentEntity;
import com.blogicum.domain.entity.PostEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

public final class Fixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T04:00:00Z"), ZoneOffset.UTC);
    public static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 4, 0);

    private Fixtures() {
    }

    public static PostEntity post(long id, long authorId, LocalDateTime pubDate, boolean published) {
        PostEntity p = new PostEntity();
        p.setId(id);
        p.setTitle("post-" + id);
        p.setText("text-" + id);
        p.setAuthorId(authorId);
        p.setPubDate(pubDate);
        p.setIsPublished(published);
        p.setCreatedAt(NOW.minusDays(30));
        return p;
    }

    public static PostEntity post(long id, long authorId, LocalDateTime pubDate, boolean published,
                                  long categoryId, boolean categoryPublished) {
        PostEntity p = post(id, authorId, pubDate, published);
        p.setCategoryId(categoryId);
        p.setCategoryPublished(categoryPublished);
        return p;
    }

    public static CategoryEntity category(long id, String slug, boolean published) {
        CategoryEntity c = new CategoryEntity();
        c.setId(id);
        c.setSlug(slug);
        c.setTitle("Category " + slug);
        c.setDescription("about " + slug);
        c.setIsPublished(published);
        return c;
    }

    public static AccountEntity account(long id, String username) {
        return AccountEntity.builder()
                .id(id)
                .username(username)
                .firstName("First" + id)
                .lastName("Last" + id)
                .email(username + "@example.com")
                .isStaff(false)
                .build();
    }

    public static CommentEntity comment(long id, long postId, long authorId, LocalDateTime createdAt) {
        CommentEntity c = new CommentEntity();
        c.setId(id);
        c.setPostId(postId);
        c.setAuthorId(authorId);
        c.setText("comment-" + id);
        c.setCreatedAt(createdAt);
        return c;
    }
}
