package com.blogicum.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.blogicum.domain.entity.AccountEntity;

public interface AccountMapper extends BaseMapper<AccountEntity> {
}
