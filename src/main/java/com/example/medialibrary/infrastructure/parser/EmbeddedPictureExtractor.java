package com.example.medialibrary.infrastructure.parser;

import java.io.File;

public interface EmbeddedPictureExtractor {

    /**
     * @return the first embedded picture's bytes, or null when the file carries none
     */
    byte[] extract(File audioFile) throws Exception;
}
