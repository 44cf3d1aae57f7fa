package com.notesapi.db;

import java.time.Instant;
import org.bson.types.ObjectId;

/**
 * Represents a stored note.
 *
 * @param id The identifier assigned by the database on insert
 * @param title The title, unique across the collection
 * @param content The body text (optional, may be null)
 * @param category A free-form category, empty when none was given
 * @param published Whether the note is published
 * @param createdAt Timestamp when the note was created
 * @param updatedAt Timestamp when the note was last updated
 */
public record Note(
    ObjectId id,
    String title,
    String content,
    String category,
    boolean published,
    Instant createdAt,
    Instant updatedAt) {

  /** Returns the identifier in the 24 character hex form used by the REST API. */
  public String idHex() {
    return id.toHexString();
  }
}
