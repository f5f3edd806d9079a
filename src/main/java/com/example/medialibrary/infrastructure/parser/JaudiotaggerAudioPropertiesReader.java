package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioMeta;
import java.io.File;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.springframework.stereotype.Component;

/**
 * Fast path: reads only the audio header that jaudiotagger parses alongside the tags.
 */
@Component
public class JaudiotaggerAudioPropertiesReader implements AudioPropertiesReader {

    @Override
    public AudioMeta read(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        AudioHeader header = parsed.getAudioHeader();
        String mimeType = AudioFormats.mimeTypeForExtension(AudioFormats.extensionOf(audioFile.getName()));
        if (header == null) {
            return new AudioMeta(mimeType, null, null);
        }
        long kbps = header.getBitRateAsNumber();
        int sampleRate = header.getSampleRateAsNumber();
        return new AudioMeta(
                mimeType,
                kbps > 0 ? (int) (kbps * 1000L) : null,
                sampleRate > 0 ? sampleRate : null);
    }
}
