package com.diskmap.treemap.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Standard error response structure for the API.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @Builder.Default
    OffsetDateTime timestamp = OffsetDateTime.now();

    int status;

    String error;

    String code;

    String message;

    String path;

    Map<String, Object> details;
}
