package com.notesapi.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.patch;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

import com.google.common.base.Strings;
import com.notesapi.NoteServiceImpl;
import com.notesapi.common.status.Status;
import com.notesapi.common.status.StatusOr;
import com.notesapi.db.SortOrder;
import com.notesapi.rest.dto.CreateNoteRequest;
import com.notesapi.rest.dto.GenericResponse;
import com.notesapi.rest.dto.ListNotesResponse;
import com.notesapi.rest.dto.Note;
import com.notesapi.rest.dto.NoteResponse;
import com.notesapi.rest.dto.UpdateNoteRequest;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.List;
import java.util.stream.Collectors;
import org.tinylog.Logger;

/**
 * REST adapter for note endpoints.
 *
 * <p>This adapter handles all REST API endpoints related to notes, including creating,
 * retrieving, listing, updating, and deleting them. Each handler validates what it can read from
 * the request, calls {@link NoteServiceImpl} and renders either a success envelope or, through
 * {@link #setError}, a failure envelope.
 */
public class NoteServiceRestAdapter implements RestAdapter {

  private final NoteServiceImpl noteService;

  /**
   * Creates a new NoteServiceRestAdapter.
   *
   * @param noteService The service to delegate to
   */
  public NoteServiceRestAdapter(NoteServiceImpl noteService) {
    this.noteService = noteService;
  }

  @Override
  public void registerRoutes() {
    path(
        "/api/notes",
        () -> {
          get(this::handleListNotes);
          post(this::handleCreateNote);
          path(
              "{id}",
              () -> {
                get(this::handleGetNote);
                patch(this::handleUpdateNote);
                delete(this::handleDeleteNote);
              });
        });
  }

  /**
   * Handles a REST request to list notes. Accepts either an offset or a 1-based page number, but
   * not both.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/notes",
      methods = {HttpMethod.GET},
      summary = "List notes",
      description =
          "Retrieves a page of notes ordered by creation time. Use either offset or page to move through the collection.",
      operationId = "listNotes",
      tags = "Notes",
      queryParams = {
        @OpenApiParam(
            name = "limit",
            description = "Maximum number of notes to return",
            required = false,
            type = Integer.class,
            example = "10"),
        @OpenApiParam(
            name = "offset",
            description = "Number of notes to skip. Cannot be combined with page.",
            required = false,
            type = Integer.class,
            example = "0"),
        @OpenApiParam(
            name = "page",
            description = "1-based page number; skips (page - 1) * limit notes",
            required = false,
            type = Integer.class,
            example = "1"),
        @OpenApiParam(
            name = "sort_order",
            description = "Sort order by creation time (ASCENDING or DESCENDING)",
            required = false,
            type = String.class,
            example = "ASCENDING")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully retrieved notes",
            content = @OpenApiContent(from = ListNotesResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - bad limit, offset, page or sort_order",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "503",
            description = "The database is unavailable",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleListNotes(Context ctx) {
    Logger.info("REST ListNotes request: {}", ctx.queryString());

    StatusOr<OptionalParam> limitOr = parseIntQueryParam(ctx, "limit");
    if (limitOr.isNotOk()) {
      setError(ctx, limitOr.getStatus());
      return;
    }
    StatusOr<OptionalParam> offsetOr = parseIntQueryParam(ctx, "offset");
    if (offsetOr.isNotOk()) {
      setError(ctx, offsetOr.getStatus());
      return;
    }
    StatusOr<OptionalParam> pageOr = parseIntQueryParam(ctx, "page");
    if (pageOr.isNotOk()) {
      setError(ctx, pageOr.getStatus());
      return;
    }

    Integer limit = limitOr.getValue().value();
    Integer offset = offsetOr.getValue().value();
    Integer page = pageOr.getValue().value();
    if (page != null) {
      if (offset != null) {
        setError(ctx, Status.invalidArgument("Specify either offset or page, not both"));
        return;
      }
      if (page < 1) {
        setError(ctx, Status.invalidArgument("page must be at least 1"));
        return;
      }
      int pageSize = limit != null ? limit : noteService.defaultPageLimit();
      // An out-of-range limit is reported by the service; only the page arithmetic matters here.
      offset = (int) Math.min(Integer.MAX_VALUE, (long) (page - 1) * Math.max(pageSize, 0));
    }

    String sortOrderParam = ctx.queryParam("sort_order");
    SortOrder sortOrder = SortOrder.fromString(sortOrderParam);
    if (!Strings.isNullOrEmpty(sortOrderParam) && sortOrder == SortOrder.SORT_ORDER_UNSPECIFIED) {
      setError(
          ctx,
          Status.invalidArgument(
              "sort_order must be ASCENDING or DESCENDING but was '" + sortOrderParam + "'"));
      return;
    }

    StatusOr<List<com.notesapi.db.Note>> notesOr = noteService.listNotes(limit, offset, sortOrder);
    if (notesOr.isNotOk()) {
      setError(ctx, notesOr.getStatus());
      return;
    }

    List<Note> notes =
        notesOr.getValue().stream().map(Note::fromRecord).collect(Collectors.toList());
    ctx.json(ListNotesResponse.success(notes));
  }

  /**
   * Handles a REST request to create a note.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/notes",
      methods = {HttpMethod.POST},
      summary = "Create a new note",
      description =
          "Creates a new note. The title is required and must be unique; category defaults to an empty string and published to false.",
      operationId = "createNote",
      tags = "Notes",
      requestBody =
          @OpenApiRequestBody(
              description = "Note details",
              required = true,
              content =
                  @OpenApiContent(
                      from = CreateNoteRequest.class,
                      example =
                          """
              {
                "title": "Buy milk",
                "content": "Semi-skimmed, two litres",
                "category": "errands"
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Successfully created note",
            content = @OpenApiContent(from = NoteResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - missing title or malformed body",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "Conflict - a note with this title already exists",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleCreateNote(Context ctx) {
    Logger.info("REST CreateNote request");

    StatusOr<CreateNoteRequest> requestOr = parseBody(ctx, CreateNoteRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }

    StatusOr<com.notesapi.db.Note> noteOr = noteService.createNote(requestOr.getValue().toDraft());
    if (noteOr.isNotOk()) {
      setError(ctx, noteOr.getStatus());
      return;
    }
    ctx.status(201).json(NoteResponse.success(Note.fromRecord(noteOr.getValue())));
  }

  /**
   * Handles a REST request to retrieve a note by ID.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/notes/{id}",
      methods = {HttpMethod.GET},
      summary = "Get a note by ID",
      description = "Retrieves a single note by its identifier.",
      operationId = "getNote",
      tags = "Notes",
      pathParams = {
        @OpenApiParam(
            name = "id",
            description = "The 24 character hex identifier of the note",
            required = true,
            type = String.class,
            example = "65f1c2a9e4b0a1b2c3d4e5f6")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully retrieved note",
            content = @OpenApiContent(from = NoteResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - note ID in invalid format",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "Not found - no note has the specified ID",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleGetNote(Context ctx) {
    String noteId = ctx.pathParam("id");
    Logger.info("REST GetNote request for ID: {}", noteId);

    StatusOr<com.notesapi.db.Note> noteOr = noteService.getNote(noteId);
    if (noteOr.isNotOk()) {
      setError(ctx, noteOr.getStatus());
      return;
    }
    ctx.json(NoteResponse.success(Note.fromRecord(noteOr.getValue())));
  }

  /**
   * Handles a REST request to update a note. Only the fields present in the body change.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/notes/{id}",
      methods = {HttpMethod.PATCH},
      summary = "Update a note",
      description =
          "Changes the provided fields of a note and refreshes its update time. At least one field must be present.",
      operationId = "updateNote",
      tags = "Notes",
      pathParams = {
        @OpenApiParam(
            name = "id",
            description = "The 24 character hex identifier of the note",
            required = true,
            type = String.class,
            example = "65f1c2a9e4b0a1b2c3d4e5f6")
      },
      requestBody =
          @OpenApiRequestBody(
              description = "Fields to change",
              required = true,
              content =
                  @OpenApiContent(
                      from = UpdateNoteRequest.class,
                      example =
                          """
              {
                "content": "2%",
                "published": true
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Successfully updated note",
            content = @OpenApiContent(from = NoteResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - bad ID, empty update or blank title",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "Not found - no note has the specified ID",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "Conflict - another note already has the new title",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleUpdateNote(Context ctx) {
    String noteId = ctx.pathParam("id");
    Logger.info("REST UpdateNote request for ID: {}", noteId);

    StatusOr<UpdateNoteRequest> requestOr = parseBody(ctx, UpdateNoteRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }

    StatusOr<com.notesapi.db.Note> noteOr =
        noteService.updateNote(noteId, requestOr.getValue().toPatch());
    if (noteOr.isNotOk()) {
      setError(ctx, noteOr.getStatus());
      return;
    }
    ctx.json(NoteResponse.success(Note.fromRecord(noteOr.getValue())));
  }

  /**
   * Handles a REST request to delete a note.
   *
   * @param ctx The Javalin context containing the request and response
   */
  @OpenApi(
      path = "/api/notes/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Delete a note",
      description = "Permanently removes a note.",
      operationId = "deleteNote",
      tags = "Notes",
      pathParams = {
        @OpenApiParam(
            name = "id",
            description = "The 24 character hex identifier of the note",
            required = true,
            type = String.class,
            example = "65f1c2a9e4b0a1b2c3d4e5f6")
      },
      responses = {
        @OpenApiResponse(status = "204", description = "Note deleted"),
        @OpenApiResponse(
            status = "400",
            description = "Invalid request - note ID in invalid format",
            content = @OpenApiContent(from = GenericResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "Not found - no note has the specified ID",
            content = @OpenApiContent(from = GenericResponse.class))
      })
  public void handleDeleteNote(Context ctx) {
    String noteId = ctx.pathParam("id");
    Logger.info("REST DeleteNote request for ID: {}", noteId);

    Status status = noteService.deleteNote(noteId);
    if (status.isError()) {
      setError(ctx, status);
      return;
    }
    ctx.status(204);
  }
}
