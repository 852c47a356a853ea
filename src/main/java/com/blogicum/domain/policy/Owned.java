package com.blogicum.domain.policy;

/**
 * 有作者的实体（帖子、评论）。
 */
public interface Owned {

    Long getAuthorId();
}
