package com.blogicum.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.blogicum.common.api.BlogException;
import com.blogicum.domain.dto.AccountView;
import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostScope;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.mapper.AccountMapper;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.PostQueryService;
import com.blogicum.domain.service.ProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileServiceImpl extends ServiceImpl<AccountMapper, AccountEntity> implements ProfileService {

    private static final int MAX_NAME_LEN = 150;
    private static final int MAX_EMAIL_LEN = 254;

    private final PostQueryService postQueryService;

    @Override
    public Profile getProfile(Viewer viewer, String username, int page, int pageSize) {
        PageResult.checkPage(page, pageSize);
        Viewer v = viewer == null ? Viewer.anonymous() : viewer;
        String name = username == null ? "" : username.trim();
        if (name.isEmpty()) {
            throw BlogException.notFound();
        }
        AccountEntity account = this.getBaseMapper().selectOne(new LambdaQueryWrapper<AccountEntity>()
                .eq(AccountEntity::getUsername, name)
                .last("limit 1"));
        if (account == null || account.getId() == null) {
            throw BlogException.notFound();
        }

        boolean owner = v.is(account.getId());
        PageResult<PostView> posts = postQueryService.page(v, PostScope.author(account.getId(), owner), page, pageSize);
        return new Profile(toView(account, owner), posts, owner);
    }

    @Transactional
    @Override
    public AccountView editOwnProfile(Viewer viewer, String firstName, String lastName, String email) {
        if (viewer == null || !viewer.isAuthenticated()) {
            throw BlogException.unauthenticated();
        }
        String fn = normalizeName(firstName, "first_name_too_long");
        String ln = normalizeName(lastName, "last_name_too_long");
        String em = email == null ? "" : email.trim();
        // 邮箱格式由请求上的 @Email 校验
        if (em.length() > MAX_EMAIL_LEN) {
            throw BlogException.validation("bad_email");
        }

        this.update(new LambdaUpdateWrapper<AccountEntity>()
                .eq(AccountEntity::getId, viewer.accountId())
                .set(AccountEntity::getFirstName, fn)
                .set(AccountEntity::getLastName, ln)
                .set(AccountEntity::getEmail, em));
        AccountEntity account = this.getById(viewer.accountId());
        if (account == null) {
            throw BlogException.notFound();
        }
        log.info("profile edited: accountId={}", viewer.accountId());
        return toView(account, true);
    }

    private static String normalizeName(String raw, String tooLongReason) {
        String s = raw == null ? "" : raw.trim();
        if (s.length() > MAX_NAME_LEN) {
            throw BlogException.validation(tooLongReason);
        }
        return s;
    }

    private static AccountView toView(AccountEntity a, boolean self) {
        return new AccountView(
                a.getId(),
                a.getUsername(),
                a.getFirstName(),
                a.getLastName(),
                self ? a.getEmail() : null
        );
    }
}
