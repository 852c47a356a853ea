package com.blogicum.domain.dto;

import com.blogicum.common.api.BlogException;

import java.util.List;

/**
 * 一页数据。page 从 1 开始；超出最后一页返回空列表而不是报错。
 */
public record PageResult<T>(
        List<T> items,
        int page,
        int pageSize,
        long total,
        boolean hasNext
) {

    /**
     * 对已经过滤、排序好的完整序列切页。
     */
    public static <T> PageResult<T> slice(List<T> ordered, int page, int pageSize) {
        checkPage(page, pageSize);
        List<T> all = ordered == null ? List.of() : ordered;
        long from = (long) (page - 1) * pageSize;
        if (from >= all.size()) {
            return new PageResult<>(List.of(), page, pageSize, all.size(), false);
        }
        int to = (int) Math.min(all.size(), from + pageSize);
        List<T> items = List.copyOf(all.subList((int) from, to));
        return new PageResult<>(items, page, pageSize, all.size(), to < all.size());
    }

    public static void checkPage(int page, int pageSize) {
        if (page < 1) {
            throw BlogException.validation("bad_page");
        }
        if (pageSize < 1) {
            throw BlogException.validation("bad_page_size");
        }
    }
}
