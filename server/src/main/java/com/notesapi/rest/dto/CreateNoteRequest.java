package com.notesapi.rest.dto;

import com.notesapi.db.NoteDraft;
import io.javalin.openapi.OpenApiByFields;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import io.javalin.openapi.OpenApiStringValidation;
import io.javalin.openapi.Visibility;

/**
 * Data Transfer Object for creating a new note.
 *
 * <p>This record represents the JSON request body for POST /api/notes. Only the title is
 * required; the category defaults to an empty string and the published flag to false.
 */
@OpenApiDescription("Request body for creating a new note.")
@OpenApiName("NoteCreationRequest")
@OpenApiByFields(Visibility.PUBLIC)
public record CreateNoteRequest(
    @OpenApiDescription("The title of the note. Must be unique across all notes.")
    @OpenApiExample("Buy milk")
    @OpenApiRequired
    @OpenApiStringValidation(minLength = "1")
    String title,

    @OpenApiDescription("The body of the note.")
    @OpenApiExample("Semi-skimmed, two litres")
    @OpenApiNullable
    String content,

    @OpenApiDescription("A free-form category used to group notes.")
    @OpenApiExample("errands")
    @OpenApiNullable
    String category,

    @OpenApiDescription("Whether the note is published. Defaults to false.")
    @OpenApiExample("false")
    @OpenApiNullable
    Boolean published
) {
    /**
     * Default constructor that creates an empty request with null values.
     * Required for proper JSON deserialization.
     */
    public CreateNoteRequest() {
        this(null, null, null, null);
    }

    /** Returns the create fields carried by this request. */
    public NoteDraft toDraft() {
        return new NoteDraft(title, content, category, published);
    }
}
