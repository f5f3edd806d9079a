package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioTags;
import java.io.File;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioTagReader implements AudioTagReader {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    /** Joins multi-value artist fields so the merge step can split them again. */
    static final String MULTI_VALUE_JOINER = "\u0000";

    @Override
    public AudioTags read(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioTags tags = new AudioTags();
        tags.setTitle(safeTagValue(tag, FieldKey.TITLE));
        tags.setArtist(joinedTagValues(tag, FieldKey.ARTIST));
        tags.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        tags.setAlbumArtist(safeTagValue(tag, FieldKey.ALBUM_ARTIST));
        tags.setTrackNo(parseInteger(safeTagValue(tag, FieldKey.TRACK)));
        tags.setYear(parseInteger(safeTagValue(tag, FieldKey.YEAR)));
        tags.setGenre(safeTagValue(tag, FieldKey.GENRE));
        if (header != null) {
            tags.setDurationSec(header.getTrackLength());
        }
        return tags;
    }

    private String joinedTagValues(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        List<String> values = tag.getAll(fieldKey);
        if (values == null || values.size() <= 1) {
            return safeTagValue(tag, fieldKey);
        }
        StringBuilder joined = new StringBuilder();
        for (String value : values) {
            if (value == null || value.trim().isEmpty()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(MULTI_VALUE_JOINER);
            }
            joined.append(value.trim());
        }
        return joined.length() == 0 ? null : joined.toString();
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value = tag.getFirst(fieldKey);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
