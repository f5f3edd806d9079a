package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.response.AlbumArtResponse;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.AudioPropertiesResponse;
import com.example.medialibrary.application.service.LibraryQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/songs")
public class LibrarySongController {

    private final LibraryQueryService libraryQueryService;

    public LibrarySongController(LibraryQueryService libraryQueryService) {
        this.libraryQueryService = libraryQueryService;
    }

    @GetMapping("/{id}/art")
    public ApiResponse<AlbumArtResponse> albumArt(@PathVariable("id") Long id,
                                                  @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        return ApiResponse.success(libraryQueryService.albumArtFor(id, refresh));
    }

    @GetMapping("/{id}/audio-properties")
    public ApiResponse<AudioPropertiesResponse> audioProperties(
            @PathVariable("id") Long id,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        return ApiResponse.success(libraryQueryService.audioPropertiesFor(id, refresh));
    }
}
