package com.blogicum.domain.dto;

/**
 * 帖子查询范围。
 *
 * @param categorySlug 只看某个分类；分类未发布/不存在时整个查询 404
 * @param authorId     只看某个作者
 * @param ownerView    作者看自己的主页：不做公开过滤（只有访问者就是 authorId 时生效）
 */
public record PostScope(String categorySlug, Long authorId, boolean ownerView) {

    public static PostScope all() {
        return new PostScope(null, null, false);
    }

    public static PostScope category(String slug) {
        return new PostScope(slug, null, false);
    }

    public static PostScope author(long authorId, boolean ownerView) {
        return new PostScope(null, authorId, ownerView);
    }
}
