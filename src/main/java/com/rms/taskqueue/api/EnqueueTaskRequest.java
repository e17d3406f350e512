package com.rms.taskqueue.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /tasks/enqueue}; published to the main queue as-is.
 */
public record EnqueueTaskRequest(
        @NotNull @Size(max = 255) String title,
        @NotNull String description,
        String status,
        @JsonProperty("should_fail") Boolean shouldFail
) {
    public EnqueueTaskRequest {
        if (status == null || status.isBlank()) status = "pending";
        if (shouldFail == null) shouldFail = Boolean.FALSE;
    }
}
