package com.example.medialibrary.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStatusResponse {

    private String taskId;
    private String state;
    private Boolean cancelRequested;
    private Integer processed;
    private Integer total;
    private Integer enumeratedCount;
    private Integer filteredOutCount;
    private Integer songCount;
    private Integer albumCount;
    private Integer artistCount;
    private Integer crossRefCount;
    private String errorMessage;
    private Long elapsedMs;
}
