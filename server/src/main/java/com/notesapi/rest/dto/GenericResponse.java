package com.notesapi.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;

/**
 * Envelope carrying only a status marker and a message. Used for every error response and for
 * the health check.
 */
@OpenApiDescription("Envelope holding a status marker and a human-readable message.")
@OpenApiName("GenericResponse")
public record GenericResponse(
    @OpenApiDescription("\"success\" or \"fail\".")
    @OpenApiExample("fail")
    String status,

    @OpenApiDescription("A human-readable message.")
    @OpenApiExample("Note with ID: 65f1c2a9e4b0a1b2c3d4e5f6 not found")
    String message
) {
    public static final String SUCCESS = "success";
    public static final String FAIL = "fail";

    /** Creates a success envelope with the given message. */
    public static GenericResponse success(String message) {
        return new GenericResponse(SUCCESS, message);
    }

    /** Creates a failure envelope with the given message. */
    public static GenericResponse fail(String message) {
        return new GenericResponse(FAIL, message);
    }
}
