package com.notesapi.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;

/**
 * Response envelope for endpoints that return a single note.
 */
@OpenApiDescription("Envelope holding a single note.")
@OpenApiName("NoteResponse")
public record NoteResponse(
    @OpenApiDescription("Always \"success\" for this envelope.")
    @OpenApiExample("success")
    String status,

    @OpenApiDescription("The note.")
    Note data
) {
    /** Wraps a note in a success envelope. */
    public static NoteResponse success(Note note) {
        return new NoteResponse(GenericResponse.SUCCESS, note);
    }
}
