package com.blogicum.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.blogicum.common.api.BlogException;
import com.blogicum.domain.dto.CommentView;
import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.entity.CommentEntity;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.enums.EditAction;
import com.blogicum.domain.mapper.AccountMapper;
import com.blogicum.domain.mapper.CommentMapper;
import com.blogicum.domain.mapper.PostMapper;
import com.blogicum.domain.policy.OwnershipAuthorizer;
import com.blogicum.domain.policy.PostVisibilityPolicy;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.CommentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class CommentServiceImpl extends ServiceImpl<CommentMapper, CommentEntity> implements CommentService {

    private static final int MAX_TEXT_LEN = 2000;

    private final PostMapper postMapper;
    private final AccountMapper accountMapper;
    private final PostVisibilityPolicy visibilityPolicy;
    private final OwnershipAuthorizer authorizer;
    private final Clock clock;

    public CommentServiceImpl(
            PostMapper postMapper,
            AccountMapper accountMapper,
            PostVisibilityPolicy visibilityPolicy,
            OwnershipAuthorizer authorizer,
            Clock clock
    ) {
        this.postMapper = postMapper;
        this.accountMapper = accountMapper;
        this.visibilityPolicy = visibilityPolicy;
        this.authorizer = authorizer;
        this.clock = clock;
    }

    @Override
    public List<CommentView> list(long postId) {
        if (postId <= 0) {
            return List.of();
        }
        List<CommentEntity> comments = this.list(new LambdaQueryWrapper<CommentEntity>()
                .eq(CommentEntity::getPostId, postId)
                .orderByAsc(CommentEntity::getCreatedAt)
                .orderByAsc(CommentEntity::getId));
        if (comments == null || comments.isEmpty()) {
            return List.of();
        }

        Set<Long> authorIds = new LinkedHashSet<>();
        for (CommentEntity c : comments) {
            if (c != null && c.getAuthorId() != null) {
                authorIds.add(c.getAuthorId());
            }
        }
        Map<Long, String> usernames = new HashMap<>();
        if (!authorIds.isEmpty()) {
            List<AccountEntity> accounts = accountMapper.selectBatchIds(authorIds);
            if (accounts != null) {
                for (AccountEntity a : accounts) {
                    if (a != null && a.getId() != null) {
                        usernames.put(a.getId(), a.getUsername());
                    }
                }
            }
        }

        List<CommentView> out = new ArrayList<>(comments.size());
        for (CommentEntity c : comments) {
            if (c == null || c.getId() == null) continue;
            out.add(toView(c, usernames.get(c.getAuthorId())));
        }
        return out;
    }

    @Transactional
    @Override
    public CommentView add(Viewer viewer, long postId, String text) {
        if (viewer == null || !viewer.isAuthenticated()) {
            throw BlogException.unauthenticated();
        }
        if (postId <= 0 || postMapper.selectById(postId) == null) {
            throw BlogException.notFound();
        }
        String sanitized = validateText(text);

        CommentEntity c = new CommentEntity();
        c.setPostId(postId);
        c.setAuthorId(viewer.accountId());
        c.setText(sanitized);
        c.setCreatedAt(LocalDateTime.now(clock));
        this.save(c);

        log.info("comment added: commentId={}, postId={}, authorId={}", c.getId(), postId, viewer.accountId());
        AccountEntity author = accountMapper.selectById(viewer.accountId());
        return toView(c, author == null ? null : author.getUsername());
    }

    @Transactional
    @Override
    public void edit(Viewer viewer, long postId, long commentId, String text) {
        requireWritable(viewer, postId, commentId, EditAction.EDIT);
        String sanitized = validateText(text);

        this.update(new LambdaUpdateWrapper<CommentEntity>()
                .eq(CommentEntity::getId, commentId)
                .set(CommentEntity::getText, sanitized));
        log.info("comment edited: commentId={}, postId={}, editorId={}", commentId, postId, viewer.accountId());
    }

    @Transactional
    @Override
    public void delete(Viewer viewer, long postId, long commentId) {
        requireWritable(viewer, postId, commentId, EditAction.DELETE);

        if (this.getBaseMapper().deleteById(commentId) != 1) {
            throw BlogException.notFound();
        }
        log.info("comment deleted: commentId={}, postId={}, operatorId={}", commentId, postId, viewer.accountId());
    }

    /**
     * 评论必须属于该帖子；帖子对访问者不可见、且访问者对评论没有写权限时，与不存在一样返回 not_found。
     */
    private CommentEntity requireWritable(Viewer viewer, long postId, long commentId, EditAction action) {
        if (postId <= 0 || commentId <= 0) {
            throw BlogException.notFound();
        }
        CommentEntity c = this.getById(commentId);
        if (c == null || c.getPostId() == null || !c.getPostId().equals(postId)) {
            throw BlogException.notFound();
        }
        PostEntity post = postMapper.selectWithCategoryState(postId);
        if (post == null) {
            throw BlogException.notFound();
        }
        if (!visibilityPolicy.canView(viewer, post, LocalDateTime.now(clock))
                && !authorizer.authorize(viewer, c, action).allowed()) {
            throw BlogException.notFound();
        }
        authorizer.require(viewer, c, action, postId);
        return c;
    }

    private static String validateText(String text) {
        if (text == null || text.isBlank()) {
            throw BlogException.validation("empty_text");
        }
        String trimmed = text.trim();
        if (trimmed.length() > MAX_TEXT_LEN) {
            throw BlogException.validation("text_too_long");
        }
        return trimmed;
    }

    private static CommentView toView(CommentEntity c, String authorUsername) {
        return new CommentView(
                c.getId(),
                c.getPostId(),
                c.getAuthorId(),
                authorUsername,
                c.getText(),
                c.getCreatedAt()
        );
    }
}
