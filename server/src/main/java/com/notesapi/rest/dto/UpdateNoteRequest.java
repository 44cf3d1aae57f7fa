package com.notesapi.rest.dto;

import com.notesapi.db.NotePatch;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiStringValidation;

/**
 * Data Transfer Object for updating a note.
 *
 * <p>This record represents the JSON request body for PATCH /api/notes/{id}. Fields that are
 * absent or null are left unchanged; at least one field must be present.
 */
@OpenApiDescription("Request body for updating a note. Only the fields present are changed.")
@OpenApiName("UpdateNoteRequest")
public record UpdateNoteRequest(
    @OpenApiDescription("The new title for the note.")
    @OpenApiExample("Buy oat milk")
    @OpenApiNullable
    @OpenApiStringValidation(minLength = "1")
    String title,

    @OpenApiDescription("The new body of the note.")
    @OpenApiExample("2%")
    @OpenApiNullable
    String content,

    @OpenApiDescription("The new category.")
    @OpenApiExample("groceries")
    @OpenApiNullable
    String category,

    @OpenApiDescription("The new published flag.")
    @OpenApiExample("true")
    @OpenApiNullable
    Boolean published
) {
    /**
     * Empty constructor that creates an empty request with null values.
     * Required for proper JSON deserialization.
     */
    public UpdateNoteRequest() {
        this(null, null, null, null);
    }

    /** Returns the update fields carried by this request. */
    public NotePatch toPatch() {
        return new NotePatch(title, content, category, published);
    }
}
