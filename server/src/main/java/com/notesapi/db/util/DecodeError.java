package com.notesapi.db.util;

import com.notesapi.common.status.Status;
import com.notesapi.common.status.StatusOr;

/**
 * Describes why a stored document field could not be read.
 *
 * @param field The name of the offending field
 * @param reason What was wrong with it
 */
public record DecodeError(String field, String reason) {

  /** Returns an INVALID_ARGUMENT status naming the field. */
  public Status toStatus() {
    return Status.invalidArgument("Invalid document field '" + field + "': " + reason);
  }

  /** Returns a failed StatusOr carrying {@link #toStatus()}. */
  public <T> StatusOr<T> toStatusOr() {
    return StatusOr.ofStatus(toStatus());
  }

  static DecodeError missing(String field) {
    return new DecodeError(field, "field is missing");
  }

  static DecodeError wrongType(String field, String expected, Object actual) {
    return new DecodeError(
        field, "expected " + expected + " but found " + actual.getClass().getSimpleName());
  }
}
