package com.blogicum.domain.controller;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.blogicum.common.api.Result;
import com.blogicum.domain.entity.CategoryEntity;
import com.blogicum.domain.entity.LocationEntity;
import com.blogicum.domain.mapper.CategoryMapper;
import com.blogicum.domain.mapper.LocationMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 发帖表单里可选的分类、地点（只列已发布的）。
 */
@RequiredArgsConstructor
@RestController
public class CatalogController {

    private final CategoryMapper categoryMapper;
    private final LocationMapper locationMapper;

    public record CategoryDto(Long id, String slug, String title, String description) {
    }

    public record LocationDto(Long id, String name) {
    }

    @GetMapping("/categories")
    public Result<List<CategoryDto>> categories() {
        List<CategoryEntity> rows = categoryMapper.selectList(new LambdaQueryWrapper<CategoryEntity>()
                .eq(CategoryEntity::getIsPublished, true)
                .orderByAsc(CategoryEntity::getTitle)
                .orderByAsc(CategoryEntity::getId));
        List<CategoryDto> out = new ArrayList<>(rows.size());
        for (CategoryEntity c : rows) {
            out.add(new CategoryDto(c.getId(), c.getSlug(), c.getTitle(), c.getDescription()));
        }
        return Result.ok(out);
    }

    @GetMapping("/locations")
    public Result<List<LocationDto>> locations() {
        List<LocationEntity> rows = locationMapper.selectList(new LambdaQueryWrapper<LocationEntity>()
                .eq(LocationEntity::getIsPublished, true)
                .orderByAsc(LocationEntity::getName)
                .orderByAsc(LocationEntity::getId));
        List<LocationDto> out = new ArrayList<>(rows.size());
        for (LocationEntity l : rows) {
            out.add(new LocationDto(l.getId(), l.getName()));
        }
        return Result.ok(out);
    }
}
