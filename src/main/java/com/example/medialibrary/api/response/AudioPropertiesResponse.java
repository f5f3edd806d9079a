package com.example.medialibrary.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AudioPropertiesResponse {

    private Long songId;
    private String mimeType;
    /** Short display label such as "flac", "-" when unknown. */
    private String format;
    private Integer bitrate;
    private Integer sampleRate;
}
