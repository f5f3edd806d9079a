package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.StartSyncRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.SyncStatusResponse;
import com.example.medialibrary.application.service.LibrarySyncTaskService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/sync")
public class LibrarySyncController {

    private final LibrarySyncTaskService librarySyncTaskService;

    public LibrarySyncController(LibrarySyncTaskService librarySyncTaskService) {
        this.librarySyncTaskService = librarySyncTaskService;
    }

    @PostMapping
    public ApiResponse<SyncStatusResponse> start(@RequestBody(required = false) StartSyncRequest request) {
        Boolean deepScan = request == null ? null : request.getDeepScan();
        return ApiResponse.success(librarySyncTaskService.start(deepScan));
    }

    @GetMapping
    public ApiResponse<SyncStatusResponse> status() {
        SyncStatusResponse response = librarySyncTaskService.getStatus();
        if (response == null) {
            return ApiResponse.fail("404", "No sync has run yet");
        }
        return ApiResponse.success(response);
    }

    @PostMapping("/cancel")
    public ApiResponse<String> cancel() {
        if (!librarySyncTaskService.cancel()) {
            return ApiResponse.fail("404", "No sync is running");
        }
        return ApiResponse.success("CANCEL_REQUESTED");
    }
}
