package io.github.jakubt4.atlas.dto;

public record ErrorResponse(String status, String message) {

    public static ErrorResponse of(final String status, final String message) {
        return new ErrorResponse(status, message);
    }
}
