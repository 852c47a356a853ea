package com.blogicum.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.blogicum.common.api.BlogException;
import com.blogicum.domain.dto.PostForm;
import com.blogicum.domain.entity.CommentEntity;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.enums.EditAction;
import com.blogicum.domain.mapper.CategoryMapper;
import com.blogicum.domain.mapper.CommentMapper;
import com.blogicum.domain.mapper.LocationMapper;
import com.blogicum.domain.mapper.PostMapper;
import com.blogicum.domain.policy.OwnershipAuthorizer;
import com.blogicum.domain.policy.PostVisibilityPolicy;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.CommentService;
import com.blogicum.domain.service.PostService;
import com.blogicum.domain.service.PostViewAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
public class PostServiceImpl extends ServiceImpl<PostMapper, PostEntity> implements PostService {

    private static final int MAX_TITLE_LEN = 256;
    private static final int MAX_IMAGE_REF_LEN = 512;

    private final CommentMapper commentMapper;
    private final CategoryMapper categoryMapper;
    private final LocationMapper locationMapper;
    private final PostVisibilityPolicy visibilityPolicy;
    private final OwnershipAuthorizer authorizer;
    private final PostViewAssembler assembler;
    private final CommentService commentService;
    private final Clock clock;

    public PostServiceImpl(
            CommentMapper commentMapper,
            CategoryMapper categoryMapper,
            LocationMapper locationMapper,
            PostVisibilityPolicy visibilityPolicy,
            OwnershipAuthorizer authorizer,
            PostViewAssembler assembler,
            CommentService commentService,
            Clock clock
    ) {
        this.commentMapper = commentMapper;
        this.categoryMapper = categoryMapper;
        this.locationMapper = locationMapper;
        this.visibilityPolicy = visibilityPolicy;
        this.authorizer = authorizer;
        this.assembler = assembler;
        this.commentService = commentService;
        this.clock = clock;
    }

    @Transactional
    @Override
    public long create(Viewer viewer, PostForm form) {
        if (viewer == null || !viewer.isAuthenticated()) {
            throw BlogException.unauthenticated();
        }
        validate(form);

        PostEntity post = new PostEntity();
        post.setTitle(form.title().trim());
        post.setText(form.text().trim());
        post.setImageRef(blankToNull(form.imageRef()));
        post.setPubDate(form.pubDate());
        post.setIsPublished(form.isPublished() == null || form.isPublished());
        post.setAuthorId(viewer.accountId());
        post.setCategoryId(form.categoryId());
        post.setLocationId(form.locationId());
        post.setCreatedAt(LocalDateTime.now(clock));
        this.save(post);

        log.info("post created: postId={}, authorId={}, pubDate={}", post.getId(), post.getAuthorId(), post.getPubDate());
        return post.getId() == null ? 0 : post.getId();
    }

    @Override
    public PostEntity requireVisible(Viewer viewer, long postId) {
        if (postId <= 0) {
            throw BlogException.notFound();
        }
        PostEntity post = this.getBaseMapper().selectWithCategoryState(postId);
        if (post == null || !visibilityPolicy.canView(viewer, post, LocalDateTime.now(clock))) {
            throw BlogException.notFound();
        }
        return post;
    }

    @Override
    public PostDetail detail(Viewer viewer, long postId) {
        PostEntity post = requireVisible(viewer, postId);
        return new PostDetail(assembler.toView(post), commentService.list(postId));
    }

    @Transactional
    @Override
    public void edit(Viewer viewer, long postId, PostForm form) {
        requireWritable(viewer, postId, EditAction.EDIT);
        validate(form);

        // author_id 不在更新列里：作者只在创建时写入
        this.update(new LambdaUpdateWrapper<PostEntity>()
                .eq(PostEntity::getId, postId)
                .set(PostEntity::getTitle, form.title().trim())
                .set(PostEntity::getText, form.text().trim())
                .set(PostEntity::getImageRef, blankToNull(form.imageRef()))
                .set(PostEntity::getPubDate, form.pubDate())
                .set(PostEntity::getIsPublished, form.isPublished() == null || form.isPublished())
                .set(PostEntity::getCategoryId, form.categoryId())
                .set(PostEntity::getLocationId, form.locationId()));
        log.info("post edited: postId={}, editorId={}", postId, viewer.accountId());
    }

    @Transactional
    @Override
    public void delete(Viewer viewer, long postId) {
        requireWritable(viewer, postId, EditAction.DELETE);

        int comments = commentMapper.delete(new LambdaQueryWrapper<CommentEntity>()
                .eq(CommentEntity::getPostId, postId));
        if (this.getBaseMapper().deleteById(postId) != 1) {
            // 并发删除：另一请求已经删掉了
            throw BlogException.notFound();
        }
        log.info("post deleted: postId={}, operatorId={}, comments={}", postId, viewer.accountId(), comments);
    }

    /**
     * 帖子对访问者不可见、且访问者也没有写权限时，与不存在一样返回 not_found。
     */
    private PostEntity requireWritable(Viewer viewer, long postId, EditAction action) {
        PostEntity post = postId <= 0 ? null : this.getBaseMapper().selectWithCategoryState(postId);
        if (post == null) {
            throw BlogException.notFound();
        }
        if (!visibilityPolicy.canView(viewer, post, LocalDateTime.now(clock))
                && !authorizer.authorize(viewer, post, action).allowed()) {
            throw BlogException.notFound();
        }
        authorizer.require(viewer, post, action, postId);
        return post;
    }

    private void validate(PostForm form) {
        if (form == null) {
            throw BlogException.validation("bad_request");
        }
        if (form.title() == null || form.title().isBlank()) {
            throw BlogException.validation("empty_title");
        }
        if (form.title().trim().length() > MAX_TITLE_LEN) {
            throw BlogException.validation("title_too_long");
        }
        if (form.text() == null || form.text().isBlank()) {
            throw BlogException.validation("empty_text");
        }
        if (form.pubDate() == null) {
            throw BlogException.validation("missing_pub_date");
        }
        if (form.imageRef() != null && form.imageRef().length() > MAX_IMAGE_REF_LEN) {
            throw BlogException.validation("image_ref_too_long");
        }
        if (form.categoryId() != null && categoryMapper.selectById(form.categoryId()) == null) {
            throw BlogException.validation("bad_category_id");
        }
        if (form.locationId() != null && locationMapper.selectById(form.locationId()) == null) {
            throw BlogException.validation("bad_location_id");
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
