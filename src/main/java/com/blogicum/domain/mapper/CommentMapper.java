package com.blogicum.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.blogicum.domain.dto.CommentCountRow;
import com.blogicum.domain.entity.CommentEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

public interface CommentMapper extends BaseMapper<CommentEntity> {

    @Select("""
            <script>
            select post_id, count(*) as comment_count
            from t_comment
            where post_id in
            <foreach collection="postIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            group by post_id
            </script>
            """)
    List<CommentCountRow> countByPostIds(@Param("postIds") Collection<Long> postIds);
}
