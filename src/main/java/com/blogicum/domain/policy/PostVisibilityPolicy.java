package com.blogicum.domain.policy;

import com.blogicum.domain.entity.PostEntity;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 帖子可见性。
 *
 * <p>公开可见 = 已发布 + 分类已发布（未设置分类视为已发布）+ 发布时间不晚于 now。
 * 作者永远能看到自己的帖子。</p>
 */
@Component
public class PostVisibilityPolicy {

    private final AccessPolicyProperties props;

    public PostVisibilityPolicy(AccessPolicyProperties props) {
        this.props = props;
    }

    public boolean isPubliclyVisible(PostEntity post, LocalDateTime now) {
        if (post == null || !Boolean.TRUE.equals(post.getIsPublished())) {
            return false;
        }
        if (post.getCategoryId() != null && !Boolean.TRUE.equals(post.getCategoryPublished())) {
            return false;
        }
        return post.getPubDate() != null && !post.getPubDate().isAfter(now);
    }

    public boolean canView(Viewer viewer, PostEntity post, LocalDateTime now) {
        if (post == null) {
            return false;
        }
        if (viewer != null && viewer.is(post.getAuthorId())) {
            return true;
        }
        if (viewer != null && viewer.staff() && props.staffSeesAll()) {
            return true;
        }
        return isPubliclyVisible(post, now);
    }

    /**
     * 当前访问者是否跳过公开过滤（用于 SQL 预过滤）。
     */
    public boolean seesEverything(Viewer viewer) {
        return viewer != null && viewer.isAuthenticated() && viewer.staff() && props.staffSeesAll();
    }
}
