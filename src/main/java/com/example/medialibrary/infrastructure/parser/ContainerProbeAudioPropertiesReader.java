package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioMeta;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Slow fallback: sniffs the container signature for the mime type and asks the JDK sound
 * providers for the stream format. Only used on deep scans to fill fields the fast path missed.
 */
@Component
public class ContainerProbeAudioPropertiesReader implements AudioPropertiesReader {

    private static final Logger log = LoggerFactory.getLogger(ContainerProbeAudioPropertiesReader.class);

    @Override
    public AudioMeta read(File audioFile) throws Exception {
        String extension;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(audioFile.toPath()))) {
            extension = AudioFormats.sniffExtension(in);
        }
        if (extension == null) {
            extension = AudioFormats.extensionOf(audioFile.getName());
        }
        String mimeType = AudioFormats.mimeTypeForExtension(extension);

        Integer sampleRate = null;
        Integer bitrate = null;
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(audioFile);
            AudioFormat format = fileFormat.getFormat();
            if (format.getSampleRate() > 0) {
                sampleRate = Math.round(format.getSampleRate());
            }
            Object declaredBitrate = format.getProperty("bitrate");
            if (declaredBitrate instanceof Integer && (Integer) declaredBitrate > 0) {
                bitrate = (Integer) declaredBitrate;
            } else if (sampleRate != null && format.getSampleSizeInBits() > 0 && format.getChannels() > 0) {
                bitrate = sampleRate * format.getSampleSizeInBits() * format.getChannels();
            }
        } catch (UnsupportedAudioFileException e) {
            log.debug("Container probe has no provider for {}: {}", audioFile, e.getMessage());
        }
        return new AudioMeta(mimeType, bitrate, sampleRate);
    }
}
