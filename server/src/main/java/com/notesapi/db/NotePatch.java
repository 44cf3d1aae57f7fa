package com.notesapi.db;

import javax.annotation.Nullable;

/**
 * The fields supplied when updating a note. A null field is left unchanged.
 *
 * @param title The new title
 * @param content The new body text
 * @param category The new category
 * @param published The new published flag
 */
public record NotePatch(
    @Nullable String title,
    @Nullable String content,
    @Nullable String category,
    @Nullable Boolean published) {

  /** A patch that changes nothing. */
  public static final NotePatch EMPTY = new NotePatch(null, null, null, null);

  /** Returns true when no field is provided. */
  public boolean isEmpty() {
    return title == null && content == null && category == null && published == null;
  }
}
