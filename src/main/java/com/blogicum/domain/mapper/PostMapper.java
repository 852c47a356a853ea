package com.blogicum.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.blogicum.domain.entity.PostEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

public interface PostMapper extends BaseMapper<PostEntity> {

    /**
     * 按范围取候选帖子，并带出分类的发布状态。
     *
     * <p>publicOnly=true 时在 SQL 里先做一遍粗过滤（作者本人或公开可见），
     * 最终结果仍以 PostVisibilityPolicy 为准。</p>
     */
    @Select("""
            <script>
            select p.*, c.is_published as category_published
            from t_post p
            left join t_category c on c.id = p.category_id
            <where>
              <if test="categoryId != null">
                and p.category_id = #{categoryId}
              </if>
              <if test="authorId != null">
                and p.author_id = #{authorId}
              </if>
              <if test="publicOnly">
                and (
                  <if test="viewerId != null">p.author_id = #{viewerId} or</if>
                  (p.is_published = 1
                   and p.pub_date &lt;= #{now}
                   and (p.category_id is null or c.is_published = 1))
                )
              </if>
            </where>
            order by p.pub_date desc, p.id asc
            </script>
            """)
    List<PostEntity> selectCandidates(@Param("categoryId") Long categoryId,
                                      @Param("authorId") Long authorId,
                                      @Param("viewerId") Long viewerId,
                                      @Param("publicOnly") boolean publicOnly,
                                      @Param("now") LocalDateTime now);

    @Select("""
            select p.*, c.is_published as category_published
            from t_post p
            left join t_category c on c.id = p.category_id
            where p.id = #{postId}
            """)
    PostEntity selectWithCategoryState(@Param("postId") long postId);
}
