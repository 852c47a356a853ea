package com.blogicum.domain.policy;

import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.EditAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 帖子/评论的写权限：只有作者可以编辑、删除。
 *
 * <p>staff 越权由 {@link AccessPolicyProperties#staffOverride()} 控制，默认关闭。</p>
 */
@Slf4j
@Component
public class OwnershipAuthorizer {

    private final AccessPolicyProperties props;

    public OwnershipAuthorizer(AccessPolicyProperties props) {
        this.props = props;
    }

    public AccessDecision authorize(Viewer viewer, Owned entity, EditAction action) {
        if (viewer == null || !viewer.isAuthenticated()) {
            return AccessDecision.DENIED_UNAUTHENTICATED;
        }
        if (entity != null && viewer.is(entity.getAuthorId())) {
            return AccessDecision.ALLOWED;
        }
        if (props.staffOverride() && viewer.staff()) {
            return AccessDecision.ALLOWED;
        }
        return AccessDecision.DENIED_NOT_OWNER;
    }

    /**
     * 校验通过才返回；否则抛出 {@link AccessDeniedException}，写操作不会执行。
     *
     * @param postId 被拒绝时跳回的帖子（评论则是其所属帖子）
     */
    public void require(Viewer viewer, Owned entity, EditAction action, long postId) {
        AccessDecision decision = authorize(viewer, entity, action);
        if (decision.allowed()) {
            return;
        }
        log.debug("access denied: action={}, postId={}, viewer={}, decision={}",
                action, postId, viewer == null ? null : viewer.accountId(), decision);
        throw new AccessDeniedException(decision, props.denialMode(), postId);
    }
}
