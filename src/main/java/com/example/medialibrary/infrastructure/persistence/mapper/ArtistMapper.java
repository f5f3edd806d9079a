package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.ArtistEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ArtistMapper {

    @Insert("<script>"
            + "INSERT INTO artist(id, name, track_count) VALUES "
            + "<foreach item='a' collection='artists' separator=','>"
            + "(#{a.id}, #{a.name}, #{a.trackCount})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "name = VALUES(name), "
            + "track_count = VALUES(track_count), "
            + "updated_at = NOW()"
            + "</script>")
    int batchUpsert(@Param("artists") List<ArtistEntity> artists);

    /**
     * Case-insensitive lookup; {@code names} must already be lowercased.
     */
    @Select("<script>"
            + "SELECT id, name, track_count FROM artist WHERE LOWER(name) IN "
            + "<foreach item='name' collection='names' open='(' separator=',' close=')'>"
            + "#{name}"
            + "</foreach>"
            + "</script>")
    List<ArtistEntity> selectByLowerNames(@Param("names") List<String> names);
}
