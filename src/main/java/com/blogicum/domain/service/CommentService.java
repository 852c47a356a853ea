package com.blogicum.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.blogicum.domain.dto.CommentView;
import com.blogicum.domain.entity.CommentEntity;
import com.blogicum.domain.policy.Viewer;

import java.util.List;

/**
 * 帖子下的评论。发评论只要求帖子存在、访问者已登录，不看帖子是否公开；
 * 编辑/删除时帖子对访问者不可见则按不存在处理。
 */
public interface CommentService extends IService<CommentEntity> {

    /**
     * 按 createdAt 正序（同一时间按 id 正序）。
     */
    List<CommentView> list(long postId);

    CommentView add(Viewer viewer, long postId, String text);

    void edit(Viewer viewer, long postId, long commentId, String text);

    void delete(Viewer viewer, long postId, long commentId);
}
