package com.blogicum.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.blogicum.domain.entity.CategoryEntity;

public interface CategoryMapper extends BaseMapper<CategoryEntity> {
}
