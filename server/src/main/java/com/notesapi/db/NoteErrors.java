package com.notesapi.db;

import com.google.common.base.Throwables;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoConnectionPoolClearedException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoServerUnavailableException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.notesapi.common.status.Status;
import javax.annotation.Nonnull;
import org.bson.BSONException;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.tinylog.Logger;

/**
 * Translates failures raised while talking to MongoDB into a {@link Status}.
 *
 * <p>Classification is total: every throwable maps to exactly one code. The whole causal chain is
 * inspected, so a driver exception wrapped by another layer is still recognised. Anything not
 * recognised becomes INTERNAL and is logged with its stack trace; the cause is kept on the status.
 */
public final class NoteErrors {

  static final String DUPLICATE_TITLE_MESSAGE = "A note with this title already exists";
  static final String UNAVAILABLE_MESSAGE = "The database is unavailable, try again later";

  private NoteErrors() {
    // Utility class
  }

  /**
   * Classifies a failure.
   *
   * @param operation short name of the operation that failed, used in log lines
   * @param throwable the failure raised by the store
   * @return a non-OK status
   */
  @Nonnull
  public static Status classify(String operation, Throwable throwable) {
    for (Throwable cause : Throwables.getCausalChain(throwable)) {
      if (isDuplicateKey(cause)) {
        Logger.info("Duplicate key during {}: {}", operation, cause.getMessage());
        return Status.alreadyExists(DUPLICATE_TITLE_MESSAGE);
      }
      if (isUnavailable(cause)) {
        Logger.warn(cause, "Database unavailable during {}", operation);
        return Status.unavailable(UNAVAILABLE_MESSAGE, throwable);
      }
      if (isDecodeFailure(cause)) {
        Logger.warn(cause, "Stored note could not be decoded during {}", operation);
        return Status.invalidArgument(
            "Stored note could not be decoded: " + cause.getMessage(), throwable);
      }
    }
    Logger.error(throwable, "Unclassified failure during {}", operation);
    return Status.internal("Unexpected error during " + operation, throwable);
  }

  /** Returns true for write errors and command errors reporting a unique index violation. */
  static boolean isDuplicateKey(Throwable throwable) {
    return throwable instanceof MongoServerException
        && ErrorCategory.fromErrorCode(((MongoServerException) throwable).getCode())
            == ErrorCategory.DUPLICATE_KEY;
  }

  /** Returns true for timeouts and for failures to reach a usable server. */
  static boolean isUnavailable(Throwable throwable) {
    return throwable instanceof MongoTimeoutException
        || throwable instanceof MongoSocketException
        || throwable instanceof MongoExecutionTimeoutException
        || throwable instanceof MongoServerUnavailableException
        || throwable instanceof MongoConnectionPoolClearedException
        || throwable instanceof MongoNotPrimaryException
        || throwable instanceof MongoNodeIsRecoveringException
        || throwable instanceof MongoInterruptedException;
  }

  /** Returns true when a stored value could not be read as BSON of the expected shape. */
  static boolean isDecodeFailure(Throwable throwable) {
    return throwable instanceof BSONException
        || throwable instanceof CodecConfigurationException
        || throwable instanceof ClassCastException;
  }
}
