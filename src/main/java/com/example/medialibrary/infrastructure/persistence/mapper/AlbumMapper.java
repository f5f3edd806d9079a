package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.infrastructure.persistence.entity.AlbumEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface AlbumMapper {

    @Insert("<script>"
            + "INSERT INTO album(id, title, artist_name, artist_id, `year`, album_art_uri, song_count) VALUES "
            + "<foreach item='a' collection='albums' separator=','>"
            + "(#{a.id}, #{a.title}, #{a.artistName}, #{a.artistId}, #{a.year}, #{a.albumArtUri}, #{a.songCount})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "title = VALUES(title), "
            + "artist_name = VALUES(artist_name), "
            + "artist_id = VALUES(artist_id), "
            + "`year` = VALUES(`year`), "
            + "album_art_uri = COALESCE(VALUES(album_art_uri), album_art_uri), "
            + "song_count = VALUES(song_count), "
            + "updated_at = NOW()"
            + "</script>")
    int batchUpsert(@Param("albums") List<AlbumEntity> albums);
}
