package com.example.medialibrary.infrastructure.persistence.mapper;

import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import java.util.List;
import org.apache.ibatis.annotations.Arg;
import org.apache.ibatis.annotations.ConstructorArgs;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SongMapper {

    String SONG_COLUMNS = "id, title, artist_name, artist_id, album_id, album_name, album_artist, path, "
            + "parent_directory, duration_ms, track_no, `year`, genre, mime_type, bitrate, sample_rate, "
            + "album_art_uri, date_modified";

    @Insert("<script>"
            + "INSERT INTO song(" + SONG_COLUMNS + ") VALUES "
            + "<foreach item='s' collection='songs' separator=','>"
            + "(#{s.id}, #{s.title}, #{s.artistName}, #{s.artistId}, #{s.albumId}, #{s.albumName}, #{s.albumArtist}, "
            + "#{s.path}, #{s.parentDirectory}, #{s.durationMs}, #{s.trackNo}, #{s.year}, #{s.genre}, #{s.mimeType}, "
            + "#{s.bitrate}, #{s.sampleRate}, #{s.albumArtUri}, #{s.dateModified})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "title = VALUES(title), "
            + "artist_name = VALUES(artist_name), "
            + "artist_id = VALUES(artist_id), "
            + "album_id = VALUES(album_id), "
            + "album_name = VALUES(album_name), "
            + "album_artist = VALUES(album_artist), "
            + "path = VALUES(path), "
            + "parent_directory = VALUES(parent_directory), "
            + "duration_ms = VALUES(duration_ms), "
            + "track_no = VALUES(track_no), "
            + "`year` = VALUES(`year`), "
            + "genre = VALUES(genre), "
            + "mime_type = VALUES(mime_type), "
            + "bitrate = VALUES(bitrate), "
            + "sample_rate = VALUES(sample_rate), "
            + "album_art_uri = VALUES(album_art_uri), "
            + "date_modified = VALUES(date_modified), "
            + "updated_at = NOW()"
            + "</script>")
    int batchUpsert(@Param("songs") List<SongEntity> songs);

    @Select("SELECT " + SONG_COLUMNS + " FROM song WHERE id = #{id}")
    SongEntity selectById(@Param("id") Long id);

    @Select("<script>"
            + "SELECT " + SONG_COLUMNS + " FROM song WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>"
            + "#{id}"
            + "</foreach>"
            + "</script>")
    List<SongEntity> selectByIds(@Param("ids") List<Long> ids);

    @ConstructorArgs({
            @Arg(column = "mime_type", javaType = String.class),
            @Arg(column = "bitrate", javaType = Integer.class),
            @Arg(column = "sample_rate", javaType = Integer.class)
    })
    @Select("SELECT mime_type, bitrate, sample_rate FROM song WHERE id = #{id}")
    AudioMeta selectAudioMetaById(@Param("id") Long id);
}
