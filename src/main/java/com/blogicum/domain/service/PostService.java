package com.blogicum.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.blogicum.domain.dto.CommentView;
import com.blogicum.domain.dto.PostForm;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.policy.Viewer;

import java.util.List;

public interface PostService extends IService<PostEntity> {

    long create(Viewer viewer, PostForm form);

    /**
     * 对访问者不可见时与不存在一样返回 not_found。
     */
    PostEntity requireVisible(Viewer viewer, long postId);

    PostDetail detail(Viewer viewer, long postId);

    void edit(Viewer viewer, long postId, PostForm form);

    /**
     * 连同评论一起删除；重复删除返回 not_found。
     */
    void delete(Viewer viewer, long postId);

    record PostDetail(
            PostView post,
            List<CommentView> comments
    ) {
    }
}
