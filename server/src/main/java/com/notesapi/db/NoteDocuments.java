package com.notesapi.db;

import com.notesapi.common.status.StatusOr;
import com.notesapi.db.util.DecodeError;
import com.notesapi.db.util.DocumentUtil;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * Maps between stored note documents and {@link Note} records.
 *
 * <p>Documents are written with a fixed field order so the same input always produces the same
 * document. Reads validate every required field and report the first offending one; unknown
 * fields are ignored.
 */
public final class NoteDocuments {

  public static final String ID = "_id";
  public static final String TITLE = "title";
  public static final String CONTENT = "content";
  public static final String CATEGORY = "category";
  public static final String PUBLISHED = "published";
  public static final String CREATED_AT = "createdAt";
  public static final String UPDATED_AT = "updatedAt";

  private NoteDocuments() {
    // Utility class
  }

  /**
   * Builds the document inserted for a new note. The document carries no {@code _id}; the
   * database assigns one.
   *
   * @param draft the validated create fields
   * @param now the creation time, used for both timestamps
   * @return the document to insert
   */
  @Nonnull
  public static Document toInsertDocument(NoteDraft draft, Instant now) {
    var timestamp = DocumentUtil.toDate(DocumentUtil.toStoredPrecision(now));
    var document = new Document(TITLE, draft.title());
    if (draft.content() != null) {
      document.append(CONTENT, draft.content());
    }
    return document
        .append(CATEGORY, draft.category() != null ? draft.category() : "")
        .append(PUBLISHED, draft.published() != null ? draft.published() : Boolean.FALSE)
        .append(CREATED_AT, timestamp)
        .append(UPDATED_AT, timestamp);
  }

  /**
   * Builds the {@code $set} body for an update: the provided fields and the refreshed
   * {@code updatedAt}.
   *
   * @param patch the validated, non-empty update fields
   * @param now the update time
   * @return the fields to set
   */
  @Nonnull
  public static Document toUpdateDocument(NotePatch patch, Instant now) {
    var fields = new Document();
    if (patch.title() != null) {
      fields.append(TITLE, patch.title());
    }
    if (patch.content() != null) {
      fields.append(CONTENT, patch.content());
    }
    if (patch.category() != null) {
      fields.append(CATEGORY, patch.category());
    }
    if (patch.published() != null) {
      fields.append(PUBLISHED, patch.published());
    }
    return fields.append(UPDATED_AT, DocumentUtil.toDate(DocumentUtil.toStoredPrecision(now)));
  }

  /**
   * Returns a copy of an inserted document with the identifier the database assigned.
   */
  @Nonnull
  public static Document withId(Document document, ObjectId id) {
    var stored = new Document(ID, id);
    document.forEach(
        (key, value) -> {
          if (!ID.equals(key)) {
            stored.append(key, value);
          }
        });
    return stored;
  }

  /**
   * Decodes a stored document into a Note.
   *
   * @param document the document read from the collection
   * @return StatusOr containing the Note, or an INVALID_ARGUMENT status naming the bad field
   */
  @Nonnull
  public static StatusOr<Note> toNote(Document document) {
    StatusOr<ObjectId> idOr = DocumentUtil.getObjectId(document, ID);
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    StatusOr<String> titleOr = DocumentUtil.getString(document, TITLE);
    if (titleOr.isNotOk()) {
      return StatusOr.ofStatus(titleOr.getStatus());
    }

    StatusOr<Optional<String>> contentOr = DocumentUtil.getOptionalString(document, CONTENT);
    if (contentOr.isNotOk()) {
      return StatusOr.ofStatus(contentOr.getStatus());
    }

    StatusOr<Optional<String>> categoryOr = DocumentUtil.getOptionalString(document, CATEGORY);
    if (categoryOr.isNotOk()) {
      return StatusOr.ofStatus(categoryOr.getStatus());
    }

    StatusOr<Optional<Boolean>> publishedOr =
        DocumentUtil.getOptionalBoolean(document, PUBLISHED);
    if (publishedOr.isNotOk()) {
      return StatusOr.ofStatus(publishedOr.getStatus());
    }

    StatusOr<Instant> createdAtOr = DocumentUtil.getInstant(document, CREATED_AT);
    if (createdAtOr.isNotOk()) {
      return StatusOr.ofStatus(createdAtOr.getStatus());
    }

    StatusOr<Instant> updatedAtOr = DocumentUtil.getInstant(document, UPDATED_AT);
    if (updatedAtOr.isNotOk()) {
      return StatusOr.ofStatus(updatedAtOr.getStatus());
    }
    if (updatedAtOr.getValue().isBefore(createdAtOr.getValue())) {
      return new DecodeError(UPDATED_AT, "before createdAt").toStatusOr();
    }

    return StatusOr.ofValue(
        new Note(
            idOr.getValue(),
            titleOr.getValue(),
            contentOr.getValue().orElse(null),
            categoryOr.getValue().orElse(""),
            publishedOr.getValue().orElse(false),
            createdAtOr.getValue(),
            updatedAtOr.getValue()));
  }
}
