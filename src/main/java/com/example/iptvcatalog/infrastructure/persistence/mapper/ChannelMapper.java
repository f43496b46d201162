package com.example.iptvcatalog.infrastructure.persistence.mapper;

import com.example.iptvcatalog.infrastructure.persistence.entity.ChannelEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ChannelMapper {

    @Insert("<script>"
            + "INSERT INTO channel(tvg_id, tvg_name, display_name, logo, url, group_title, content_type, metadata, profile_id) "
            + "VALUES "
            + "<foreach item='item' collection='list' separator=','>"
            + "(#{item.tvgId}, #{item.tvgName}, #{item.displayName}, #{item.logo}, #{item.url}, "
            + "#{item.groupTitle}, #{item.contentType}, #{item.metadata}, #{item.profileId})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("list") List<ChannelEntity> list);

    @Delete("DELETE FROM channel WHERE profile_id = #{profileId}")
    int deleteByProfileId(@Param("profileId") Long profileId);
}
