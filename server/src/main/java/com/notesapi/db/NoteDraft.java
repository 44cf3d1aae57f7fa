package com.notesapi.db;

import javax.annotation.Nullable;

/**
 * The fields supplied when creating a note. Absent optional fields are null.
 *
 * @param title The title, required
 * @param content The body text
 * @param category The category; stored as an empty string when null
 * @param published The published flag; stored as false when null
 */
public record NoteDraft(
    String title,
    @Nullable String content,
    @Nullable String category,
    @Nullable Boolean published) {

  /** Convenience constructor for a draft with only a title and content. */
  public NoteDraft(String title, @Nullable String content) {
    this(title, content, null, null);
  }
}
