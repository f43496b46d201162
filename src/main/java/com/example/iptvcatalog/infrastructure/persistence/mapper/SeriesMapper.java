package com.example.iptvcatalog.infrastructure.persistence.mapper;

import com.example.iptvcatalog.infrastructure.persistence.entity.SeriesEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SeriesMapper {

    @Insert("INSERT INTO series(name, normalized_name, logo, group_title, profile_id) "
            + "VALUES(#{name}, #{normalizedName}, #{logo}, #{groupTitle}, #{profileId})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SeriesEntity entity);

    @Select("SELECT id, name, normalized_name, logo, group_title, profile_id, created_at, updated_at "
            + "FROM series WHERE normalized_name = #{normalizedName} AND profile_id = #{profileId}")
    SeriesEntity selectByNormalizedName(@Param("normalizedName") String normalizedName,
                                        @Param("profileId") Long profileId);

    @Delete("DELETE FROM series WHERE profile_id = #{profileId}")
    int deleteByProfileId(@Param("profileId") Long profileId);
}
