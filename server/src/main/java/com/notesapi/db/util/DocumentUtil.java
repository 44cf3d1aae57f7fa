package com.notesapi.db.util;

import com.notesapi.common.status.StatusOr;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * Typed field access for BSON documents.
 *
 * <p>Required getters fail with a {@link DecodeError} when the field is absent, null or of the
 * wrong type; they never substitute a default. Optional getters accept absent and null fields but
 * still reject a value of the wrong type.
 */
public final class DocumentUtil {

  private DocumentUtil() {
    // Utility class, no instances
  }

  /** Converts a java.util.Date read from a document to java.time.Instant. */
  @Nonnull
  public static Instant toInstant(Date date) {
    if (date == null) {
      throw new IllegalArgumentException("Date cannot be null");
    }
    return date.toInstant();
  }

  /** Converts a java.time.Instant to the java.util.Date the driver stores as a BSON date. */
  @Nonnull
  public static Date toDate(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Date.from(instant);
  }

  /** Truncates an instant to the millisecond precision of a BSON date. */
  @Nonnull
  public static Instant toStoredPrecision(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }

  /** Gets a required ObjectId field. */
  @Nonnull
  public static StatusOr<ObjectId> getObjectId(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return DecodeError.missing(field).toStatusOr();
    }
    if (!(value instanceof ObjectId)) {
      return DecodeError.wrongType(field, "ObjectId", value).toStatusOr();
    }
    return StatusOr.ofValue((ObjectId) value);
  }

  /** Gets a required string field. */
  @Nonnull
  public static StatusOr<String> getString(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return DecodeError.missing(field).toStatusOr();
    }
    if (!(value instanceof String)) {
      return DecodeError.wrongType(field, "String", value).toStatusOr();
    }
    return StatusOr.ofValue((String) value);
  }

  /** Gets an optional string field, returning Optional.empty() if it is absent or null. */
  @Nonnull
  public static StatusOr<Optional<String>> getOptionalString(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return StatusOr.ofValue(Optional.empty());
    }
    if (!(value instanceof String)) {
      return DecodeError.wrongType(field, "String", value).toStatusOr();
    }
    return StatusOr.ofValue(Optional.of((String) value));
  }

  /** Gets an optional boolean field, returning Optional.empty() if it is absent or null. */
  @Nonnull
  public static StatusOr<Optional<Boolean>> getOptionalBoolean(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return StatusOr.ofValue(Optional.empty());
    }
    if (!(value instanceof Boolean)) {
      return DecodeError.wrongType(field, "Boolean", value).toStatusOr();
    }
    return StatusOr.ofValue(Optional.of((Boolean) value));
  }

  /** Gets a required date field as an Instant. */
  @Nonnull
  public static StatusOr<Instant> getInstant(Document doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return DecodeError.missing(field).toStatusOr();
    }
    if (!(value instanceof Date)) {
      return DecodeError.wrongType(field, "Date", value).toStatusOr();
    }
    return StatusOr.ofValue(toInstant((Date) value));
  }
}
