package com.notesapi.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

/**
 * Response envelope for GET /api/notes.
 *
 * <p>The list may be empty; an empty page is not an error.
 */
@OpenApiDescription("Envelope holding a page of notes.")
@OpenApiName("ListNotesResponse")
public record ListNotesResponse(
    @OpenApiDescription("Always \"success\" for this envelope.")
    @OpenApiExample("success")
    String status,

    @OpenApiDescription("The number of notes in this page.")
    @OpenApiExample("2")
    int results,

    @OpenApiDescription("The notes, ordered by creation time.")
    List<Note> data
) {
    /** Wraps a page of notes in a success envelope. */
    public static ListNotesResponse success(List<Note> notes) {
        return new ListNotesResponse(GenericResponse.SUCCESS, notes.size(), notes);
    }
}
