package com.dentistflow.dentistflowserver.dto;

import com.dentistflow.dentistflowserver.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private ErrorKind kind;
    private String message;
    private T data;
    private Instant timestamp;

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, null, message, data, Instant.now());
    }

    public static <T> ApiResponse<T> error(ErrorKind kind, String message) {
        return new ApiResponse<>(false, kind, message, null, Instant.now());
    }
}
