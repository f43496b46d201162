package com.example.iptvcatalog.infrastructure.persistence.mapper;

import com.example.iptvcatalog.infrastructure.persistence.entity.M3uSourceEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface M3uSourceMapper {

    @Insert("INSERT INTO m3u_source(url, name, last_status, total_entries, profile_id) "
            + "VALUES(#{url}, #{name}, #{lastStatus}, #{totalEntries}, #{profileId})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(M3uSourceEntity entity);

    @Select("SELECT id, url, name, last_fetched, last_status, total_entries, last_error, profile_id, "
            + "created_at, updated_at FROM m3u_source WHERE id = #{id}")
    M3uSourceEntity selectById(@Param("id") Long id);

    @Select("SELECT COUNT(1) FROM m3u_source WHERE id = #{id}")
    int countById(@Param("id") Long id);

    @Select("SELECT id, url, name, last_fetched, last_status, total_entries, last_error, profile_id, "
            + "created_at, updated_at FROM m3u_source WHERE profile_id = #{profileId} "
            + "ORDER BY created_at DESC, id DESC")
    List<M3uSourceEntity> selectByProfileId(@Param("profileId") Long profileId);

    @Select("SELECT id, url, name, last_fetched, last_status, total_entries, last_error, profile_id, "
            + "created_at, updated_at FROM m3u_source "
            + "WHERE last_fetched IS NULL OR last_fetched < #{olderThan} "
            + "ORDER BY id")
    List<M3uSourceEntity> selectNeedingRefresh(@Param("olderThan") LocalDateTime olderThan);

    @Update("UPDATE m3u_source SET last_status = #{status}, updated_at = NOW() WHERE id = #{id}")
    int updateStatus(@Param("id") Long id, @Param("status") String status);

    @Update("UPDATE m3u_source SET last_status = #{status}, total_entries = #{totalEntries}, "
            + "last_fetched = NOW(), last_error = NULL, updated_at = NOW() WHERE id = #{id}")
    int markSuccess(@Param("id") Long id,
                    @Param("status") String status,
                    @Param("totalEntries") int totalEntries);

    @Update("UPDATE m3u_source SET last_status = #{status}, last_error = #{lastError}, updated_at = NOW() "
            + "WHERE id = #{id}")
    int markFailed(@Param("id") Long id,
                   @Param("status") String status,
                   @Param("lastError") String lastError);

    @Delete("DELETE FROM m3u_source WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
