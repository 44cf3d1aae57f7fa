package com.notesapi.db.util;

import com.google.common.base.Strings;
import com.notesapi.common.status.Status;
import com.notesapi.common.status.StatusOr;
import javax.annotation.Nonnull;
import org.bson.types.ObjectId;

/** Utility methods for working with the identifiers MongoDB assigns to documents. */
public final class ObjectIds {

  private ObjectIds() {
    // Utility class, no instances
  }

  /**
   * Parses the 24 character hex form of an ObjectId.
   *
   * @param hex the identifier received at the API boundary
   * @return StatusOr containing the ObjectId or an INVALID_ARGUMENT status
   */
  @Nonnull
  public static StatusOr<ObjectId> parse(String hex) {
    if (Strings.isNullOrEmpty(hex)) {
      return StatusOr.ofStatus(Status.invalidArgument("Note ID cannot be null or empty"));
    }
    if (!ObjectId.isValid(hex)) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid ID: " + hex));
    }
    return StatusOr.ofValue(new ObjectId(hex));
  }
}
