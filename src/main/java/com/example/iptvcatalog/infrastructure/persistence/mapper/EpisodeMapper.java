package com.example.iptvcatalog.infrastructure.persistence.mapper;

import com.example.iptvcatalog.infrastructure.persistence.entity.EpisodeEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface EpisodeMapper {

    @Insert("<script>"
            + "INSERT INTO episode(series_id, season_number, episode_number, title, url, tvg_name) "
            + "VALUES "
            + "<foreach item='item' collection='list' separator=','>"
            + "(#{item.seriesId}, #{item.seasonNumber}, #{item.episodeNumber}, #{item.title}, #{item.url}, #{item.tvgName})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("list") List<EpisodeEntity> list);

    /** Only season and episode numbers are populated. */
    @Select("SELECT season_number, episode_number FROM episode WHERE series_id = #{seriesId}")
    List<EpisodeEntity> selectKeysBySeriesId(@Param("seriesId") Long seriesId);

    @Delete("DELETE e FROM episode e INNER JOIN series s ON e.series_id = s.id WHERE s.profile_id = #{profileId}")
    int deleteByProfileId(@Param("profileId") Long profileId);
}
