package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioTags;
import java.io.File;

public interface AudioTagReader {

    AudioTags read(File audioFile) throws Exception;
}
