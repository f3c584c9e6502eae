package com.yerin.submitflow.global.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DataResponse<T> {
    private final T data;
    private final Instant timestamp;

    public static <T> DataResponse<T> from(T data) {
        return new DataResponse<>(data, Instant.now());
    }
}
