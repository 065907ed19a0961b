package com.sentiment_retraining.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericResponse<T> {
    private T data;
    private String errorCode;
    private String message;
    private Metadata metadata;

    public static <T> GenericResponse<T> success(String message, T data) {
        return GenericResponse.<T>builder()
                .message(message)
                .data(data)
                .metadata(new Metadata())
                .errorCode("")
                .build();
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message) {
        return GenericResponse.<T>builder()
                .errorCode(errorCode)
                .message(message)
                .metadata(new Metadata())
                .build();
    }
}
