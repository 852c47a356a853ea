package com.blogicum.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.blogicum.domain.entity.LocationEntity;

public interface LocationMapper extends BaseMapper<LocationEntity> {
}
