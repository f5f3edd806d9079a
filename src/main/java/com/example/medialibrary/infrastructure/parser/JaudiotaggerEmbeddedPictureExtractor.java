package com.example.medialibrary.infrastructure.parser;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerEmbeddedPictureExtractor implements EmbeddedPictureExtractor {

    private static final Logger log = LoggerFactory.getLogger(JaudiotaggerEmbeddedPictureExtractor.class);

    @Override
    public byte[] extract(File audioFile) throws Exception {
        AudioFile parsed;
        try {
            parsed = AudioFileIO.read(audioFile);
        } catch (CannotReadException e) {
            // Path-based open resolves the reader from the file name; reopen the stream and pick the
            // reader from the container signature instead.
            parsed = readBySignature(audioFile, e);
        }
        Tag tag = parsed.getTag();
        if (tag == null) {
            return null;
        }
        Artwork artwork = tag.getFirstArtwork();
        if (artwork == null) {
            return null;
        }
        byte[] data = artwork.getBinaryData();
        return data == null || data.length == 0 ? null : data;
    }

    private AudioFile readBySignature(File audioFile, CannotReadException pathError) throws Exception {
        String extension;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(audioFile.toPath()))) {
            extension = AudioFormats.sniffExtension(in);
        }
        if (extension == null) {
            throw pathError;
        }
        log.debug("Path-based read rejected, retrying by signature: file={}, detected={}", audioFile, extension);
        return AudioFileIO.readAs(audioFile, extension);
    }
}
