package com.notesapi;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.notesapi.common.status.Status;
import com.notesapi.common.status.StatusOr;
import com.notesapi.db.Note;
import com.notesapi.db.NoteDocuments;
import com.notesapi.db.NoteDraft;
import com.notesapi.db.NoteErrors;
import com.notesapi.db.NotePatch;
import com.notesapi.db.NoteStore;
import com.notesapi.db.SortOrder;
import com.notesapi.db.util.ObjectIds;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/**
 * Implementation of the note operations: list, create, get, update and delete.
 *
 * <p>Every operation validates its input before touching the store, so malformed ids and invalid
 * fields never cost a database round trip. Failures raised by the store are converted by
 * {@link NoteErrors}; callers only ever see a {@link Status}. The service keeps no mutable state
 * and can be shared by all request threads.
 */
public class NoteServiceImpl {
  private final Config config;

  /**
   * @param store the database the notes live in
   * @param defaultPageLimit the limit used when a list call names none
   * @param maxPageLimit the largest limit a list call may request
   * @param defaultSortOrder the order used when a list call names none
   * @param clock the source of creation and update timestamps
   */
  public record Config(
      NoteStore store,
      int defaultPageLimit,
      int maxPageLimit,
      SortOrder defaultSortOrder,
      Clock clock) {}

  public NoteServiceImpl(Config config) {
    this.config = config;
  }

  /** Returns the page size used when a list call names none. */
  public int defaultPageLimit() {
    return config.defaultPageLimit();
  }

  /**
   * Lists notes ordered by creation time.
   *
   * <p>An empty collection, or an offset past its end, yields an empty list.
   *
   * @param limit the page size, or null for the configured default
   * @param offset the number of notes to skip, or null for 0
   * @param sortOrder the order, or null / unspecified for the configured default
   */
  public StatusOr<List<Note>> listNotes(
      @Nullable Integer limit, @Nullable Integer offset, @Nullable SortOrder sortOrder) {
    int effectiveLimit = limit != null ? limit : config.defaultPageLimit();
    int effectiveOffset = offset != null ? offset : 0;
    if (effectiveLimit < 1 || effectiveLimit > config.maxPageLimit()) {
      return StatusOr.ofStatus(
          Status.invalidArgument("limit must be between 1 and " + config.maxPageLimit()));
    }
    if (effectiveOffset < 0) {
      return StatusOr.ofStatus(Status.invalidArgument("offset must not be negative"));
    }
    SortOrder order =
        (sortOrder != null ? sortOrder : SortOrder.SORT_ORDER_UNSPECIFIED)
            .orDefault(config.defaultSortOrder());

    Logger.info(
        "Listing notes: limit={}, offset={}, order={}", effectiveLimit, effectiveOffset, order);
    List<Document> documents;
    try {
      documents = config.store().findMany(effectiveLimit, effectiveOffset, order);
    } catch (RuntimeException e) {
      return StatusOr.ofStatus(NoteErrors.classify("list notes", e));
    }

    List<Note> notes = new ArrayList<>(documents.size());
    for (Document document : documents) {
      StatusOr<Note> noteOr = NoteDocuments.toNote(document);
      if (noteOr.isNotOk()) {
        Logger.error(
            "Failed to decode note {}: {}", document.get(NoteDocuments.ID), noteOr.getStatus());
        return StatusOr.ofStatus(noteOr.getStatus());
      }
      notes.add(noteOr.getValue());
    }
    return StatusOr.ofValue(ImmutableList.copyOf(notes));
  }

  /**
   * Creates a note. The returned note carries the database id and equal creation and update
   * timestamps.
   *
   * <p>Possible error codes:
   * - INVALID_ARGUMENT: the title is missing or blank
   * - ALREADY_EXISTS: another note has the same title
   */
  public StatusOr<Note> createNote(NoteDraft draft) {
    if (draft == null || Strings.isNullOrEmpty(draft.title()) || draft.title().isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("title is required"));
    }

    Document document = NoteDocuments.toInsertDocument(draft, config.clock().instant());
    ObjectId id;
    try {
      id = config.store().insertOne(document);
    } catch (RuntimeException e) {
      return StatusOr.ofStatus(NoteErrors.classify("create note", e));
    }
    Logger.info("Created note {}", id);
    return NoteDocuments.toNote(NoteDocuments.withId(document, id));
  }

  /**
   * Retrieves a note by its hex id.
   *
   * <p>Possible error codes:
   * - INVALID_ARGUMENT: the id is not a valid ObjectId
   * - NOT_FOUND: no note has this id
   */
  public StatusOr<Note> getNote(String noteId) {
    StatusOr<ObjectId> idOr = ObjectIds.parse(noteId);
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    Optional<Document> document;
    try {
      document = config.store().findOne(idOr.getValue());
    } catch (RuntimeException e) {
      return StatusOr.ofStatus(NoteErrors.classify("get note", e));
    }
    return StatusOr.fromOptional(document, notFoundMessage(noteId))
        .flatMap(NoteDocuments::toNote);
  }

  /**
   * Changes the provided fields of a note and refreshes its update timestamp, even when the new
   * values equal the old ones.
   *
   * <p>Possible error codes:
   * - INVALID_ARGUMENT: the id is malformed, no field is provided, or the new title is blank
   * - NOT_FOUND: no note has this id
   * - ALREADY_EXISTS: another note already has the new title
   */
  public StatusOr<Note> updateNote(String noteId, NotePatch patch) {
    StatusOr<ObjectId> idOr = ObjectIds.parse(noteId);
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }
    if (patch == null || patch.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument("No updatable fields provided"));
    }
    if (patch.title() != null && patch.title().isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("title must not be blank"));
    }

    Document fields = NoteDocuments.toUpdateDocument(patch, config.clock().instant());
    Optional<Document> updated;
    try {
      updated = config.store().updateOne(idOr.getValue(), fields);
    } catch (RuntimeException e) {
      return StatusOr.ofStatus(NoteErrors.classify("update note", e));
    }
    if (updated.isPresent()) {
      Logger.info("Updated note {} fields {}", noteId, fields.keySet());
    }
    return StatusOr.fromOptional(updated, notFoundMessage(noteId)).flatMap(NoteDocuments::toNote);
  }

  /**
   * Deletes a note. Deleting the same id twice reports NOT_FOUND the second time.
   *
   * <p>Possible error codes:
   * - INVALID_ARGUMENT: the id is malformed
   * - NOT_FOUND: no note has this id
   */
  public Status deleteNote(String noteId) {
    StatusOr<ObjectId> idOr = ObjectIds.parse(noteId);
    if (idOr.isNotOk()) {
      return idOr.getStatus();
    }

    long deleted;
    try {
      deleted = config.store().deleteOne(idOr.getValue());
    } catch (RuntimeException e) {
      return NoteErrors.classify("delete note", e);
    }
    if (deleted == 0) {
      return Status.notFound(notFoundMessage(noteId));
    }
    Logger.info("Deleted note {}", noteId);
    return Status.ok();
  }

  private static String notFoundMessage(String noteId) {
    return "Note with ID: " + noteId + " not found";
  }
}
