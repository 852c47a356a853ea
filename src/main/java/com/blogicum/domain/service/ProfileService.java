package com.blogicum.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.blogicum.domain.dto.AccountView;
import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.policy.Viewer;

public interface ProfileService extends IService<AccountEntity> {

    /**
     * 作者本人看到自己的全部帖子；其他人只看到公开可见的。
     */
    Profile getProfile(Viewer viewer, String username, int page, int pageSize);

    /**
     * 只能改自己的资料。
     */
    AccountView editOwnProfile(Viewer viewer, String firstName, String lastName, String email);

    record Profile(
            AccountView account,
            PageResult<PostView> posts,
            boolean owner
    ) {
    }
}
