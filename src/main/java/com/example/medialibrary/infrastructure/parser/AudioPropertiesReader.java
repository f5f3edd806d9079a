package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioMeta;
import java.io.File;

/**
 * Reads codec-level properties (mime type, bitrate, sample rate) from an audio file. Any field
 * the reader cannot determine is left null; unreadable files raise an exception.
 */
public interface AudioPropertiesReader {

    AudioMeta read(File audioFile) throws Exception;
}
