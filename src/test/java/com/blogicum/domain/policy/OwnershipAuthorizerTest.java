package com.blogicum.domain.policy;

import com.blogicum.domain.entity.CommentEntity;
import com.blogicum.domain.entity.PostEntity;
import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.DenialMode;
import com.blogicum.domain.enums.EditAction;
import org.junit.jupiter.api.Test;

import static com.blogicum.support.Fixtures.NOW;
import static com.blogicum.support.Fixtures.comment;
import static com.blogicum.support.Fixtures.post;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OwnershipAuthorizerTest {

    private final PostEntity post = post(1, 10, NOW.minusDays(1), true);

    @Test
    void anonymous_ShouldBeDeniedUnauthenticated() {
        OwnershipAuthorizer authorizer = new OwnershipAuthorizer(AccessPolicyProperties.defaults());

        assertEquals(AccessDecision.DENIED_UNAUTHENTICATED,
                authorizer.authorize(Viewer.anonymous(), post, EditAction.DELETE));
        assertEquals(AccessDecision.DENIED_UNAUTHENTICATED,
                authorizer.authorize(null, post, EditAction.EDIT));
    }

    @Test
    void author_ShouldBeAllowed_OthersDenied() {
        OwnershipAuthorizer authorizer = new OwnershipAuthorizer(AccessPolicyProperties.defaults());

        for (EditAction action : EditAction.values()) {
            assertEquals(AccessDecision.ALLOWED, authorizer.authorize(Viewer.of(10, false), post, action));
            assertEquals(AccessDecision.DENIED_NOT_OWNER, authorizer.authorize(Viewer.of(11, false), post, action));
        }
    }

    @Test
    void staff_ShouldNotBypassOwnership_ByDefault() {
        OwnershipAuthorizer authorizer = new OwnershipAuthorizer(AccessPolicyProperties.defaults());

        assertEquals(AccessDecision.DENIED_NOT_OWNER,
                authorizer.authorize(Viewer.of(99, true), post, EditAction.EDIT));
    }

    @Test
    void staff_ShouldBypassOwnership_WhenOverrideEnabled() {
        OwnershipAuthorizer authorizer = new OwnershipAuthorizer(
                new AccessPolicyProperties(true, false, DenialMode.FORBIDDEN));
        CommentEntity c = comment(7, 1, 10, NOW);

        assertEquals(AccessDecision.ALLOWED, authorizer.authorize(Viewer.of(99, true), c, EditAction.DELETE));
        assertEquals(AccessDecision.DENIED_NOT_OWNER, authorizer.authorize(Viewer.of(98, false), c, EditAction.DELETE));
        assertEquals(AccessDecision.DENIED_UNAUTHENTICATED, authorizer.authorize(Viewer.anonymous(), c, EditAction.DELETE));
    }

    @Test
    void require_ShouldCarryConfiguredDenialMode() {
        OwnershipAuthorizer authorizer = new OwnershipAuthorizer(
                new AccessPolicyProperties(false, false, DenialMode.REDIRECT));

        assertDoesNotThrow(() -> authorizer.require(Viewer.of(10, false), post, EditAction.EDIT, 1));
        assertThatThrownBy(() -> authorizer.require(Viewer.of(11, false), post, EditAction.EDIT, 1))
                .isInstanceOfSatisfying(AccessDeniedException.class, e -> {
                    assertThat(e.getDecision()).isEqualTo(AccessDecision.DENIED_NOT_OWNER);
                    assertThat(e.getDenialMode()).isEqualTo(DenialMode.REDIRECT);
                    assertThat(e.getPostId()).isEqualTo(1L);
                });
    }
}
