package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.SongArtistCrossRefEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface SongArtistCrossRefMapper {

    @Insert("<script>"
            + "INSERT INTO song_artist_cross_ref(song_id, artist_id, is_primary) VALUES "
            + "<foreach item='r' collection='refs' separator=','>"
            + "(#{r.songId}, #{r.artistId}, #{r.isPrimary})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE is_primary = VALUES(is_primary)"
            + "</script>")
    int batchInsertIgnore(@Param("refs") List<SongArtistCrossRefEntity> refs);

    @Delete("<script>"
            + "DELETE FROM song_artist_cross_ref WHERE song_id IN "
            + "<foreach item='id' collection='songIds' open='(' separator=',' close=')'>"
            + "#{id}"
            + "</foreach>"
            + "</script>")
    int deleteBySongIds(@Param("songIds") List<Long> songIds);
}
