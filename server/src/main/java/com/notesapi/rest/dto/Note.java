package com.notesapi.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

/**
 * Data Transfer Object for a note as returned by the REST API.
 *
 * <p>Timestamps are milliseconds since the epoch and the id is the 24 character hex form of the
 * database identifier.
 */
@OpenApiDescription("A note stored by the service.")
@OpenApiName("Note")
public record Note(
    @OpenApiDescription("The unique identifier of the note.")
    @OpenApiExample("65f1c2a9e4b0a1b2c3d4e5f6")
    @OpenApiRequired
    String id,

    @OpenApiDescription("The title of the note. Unique across all notes.")
    @OpenApiExample("Buy milk")
    @OpenApiRequired
    String title,

    @OpenApiDescription("The body of the note.")
    @OpenApiExample("2%")
    @OpenApiNullable
    String content,

    @OpenApiDescription("A free-form category. Empty when none was given.")
    @OpenApiExample("errands")
    String category,

    @OpenApiDescription("Whether the note is published.")
    @OpenApiExample("false")
    Boolean published,

    @OpenApiDescription("Creation time in milliseconds since the epoch.")
    @OpenApiExample("1710342825000")
    Long createdAt,

    @OpenApiDescription("Last update time in milliseconds since the epoch.")
    @OpenApiExample("1710342825000")
    Long updatedAt
) {
    /**
     * Converts a stored note to its REST representation.
     *
     * @param note the stored note
     * @return the DTO
     */
    public static Note fromRecord(com.notesapi.db.Note note) {
        return new Note(
            note.idHex(),
            note.title(),
            note.content(),
            note.category(),
            note.published(),
            note.createdAt().toEpochMilli(),
            note.updatedAt().toEpochMilli());
    }
}
