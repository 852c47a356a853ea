package com.blogicum.domain.policy;

import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.DenialMode;
import lombok.Getter;

/**
 * {@link OwnershipAuthorizer#require} 拒绝时抛出。
 *
 * <p>denialMode 在授权边界处确定，异常处理器只负责照做。</p>
 */
@Getter
public class AccessDeniedException extends RuntimeException {

    private final AccessDecision decision;

    private final DenialMode denialMode;

    /** 重定向模式下跳回的帖子 id */
    private final long postId;

    public AccessDeniedException(AccessDecision decision, DenialMode denialMode, long postId) {
        super(decision.getReason());
        this.decision = decision;
        this.denialMode = denialMode;
        this.postId = postId;
    }
}
