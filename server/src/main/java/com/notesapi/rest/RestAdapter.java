package com.notesapi.rest;

import com.google.common.base.Strings;
import com.google.gson.JsonParseException;
import com.notesapi.common.status.Status;
import com.notesapi.common.status.StatusCode;
import com.notesapi.common.status.StatusOr;
import com.notesapi.rest.dto.GenericResponse;
import io.javalin.http.Context;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters that handle REST API endpoints.
 *
 * <p>This interface defines the common functionality that all REST adapters share: rendering a
 * {@link Status} as a failure envelope, parsing request bodies and parsing numeric query
 * parameters.
 */
public interface RestAdapter {

  /**
   * Request attribute set once a handler has rendered an error, so the server's generic error
   * pages leave that body alone.
   */
  String ERROR_RENDERED_ATTRIBUTE = "notesapi.errorRendered";

  /** Message sent in place of the details of an internal failure. */
  String INTERNAL_ERROR_MESSAGE = "Internal server error";

  /**
   * Sets an error response for the given status. The HTTP status code follows the status code;
   * internal failures are reported with a fixed message and their cause goes to the log only.
   *
   * @param ctx The Javalin context to set the error on
   * @param status The error status to render
   */
  default void setError(Context ctx, Status status) {
    String message =
        status.getCode() == StatusCode.INTERNAL ? INTERNAL_ERROR_MESSAGE : status.getMessage();
    if (status.getCause() != null) {
      Logger.error(
          status.getCause(), "Error response: {} - {}", status.getHttpCode(), status.getMessage());
    } else {
      Logger.error("Error response: {} - {}", status.getHttpCode(), status.getMessage());
    }
    ctx.attribute(ERROR_RENDERED_ATTRIBUTE, Boolean.TRUE);
    ctx.status(status.getHttpCode()).json(GenericResponse.fail(message));
  }

  /**
   * Parses the JSON body of the request into the given DTO type.
   *
   * @param ctx The Javalin context holding the body
   * @param type The DTO class
   * @return A StatusOr containing the DTO, or INVALID_ARGUMENT when the body is missing or is not
   *     valid JSON for the type
   */
  default <T> StatusOr<T> parseBody(Context ctx, Class<T> type) {
    T body;
    try {
      body = ctx.bodyAsClass(type);
    } catch (JsonParseException e) {
      Logger.warn("Unparseable request body for {}: {}", type.getSimpleName(), e.getMessage());
      return StatusOr.ofStatus(Status.invalidArgument("Invalid request body", e));
    }
    if (body == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid request body"));
    }
    return StatusOr.ofValue(body);
  }

  /**
   * Reads an optional integer query parameter.
   *
   * @param ctx The Javalin context holding the query string
   * @param name The parameter name
   * @return A StatusOr holding the value, an empty holder when the parameter is absent, or
   *     INVALID_ARGUMENT when the value is not an integer
   */
  default StatusOr<OptionalParam> parseIntQueryParam(Context ctx, String name) {
    String raw = ctx.queryParam(name);
    if (Strings.isNullOrEmpty(raw)) {
      return StatusOr.ofValue(OptionalParam.ABSENT);
    }
    try {
      return StatusOr.ofValue(new OptionalParam(Integer.parseInt(raw.trim())));
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument("Query parameter '" + name + "' must be an integer: " + raw));
    }
  }

  /**
   * An integer query parameter that may be absent.
   *
   * @param value The parsed value, or null when the parameter was not sent
   */
  record OptionalParam(@Nullable Integer value) {
    static final OptionalParam ABSENT = new OptionalParam(null);
  }

  /**
   * Registers the REST endpoints handled by this adapter.
   *
   * <p>Called inside {@code RouterConfig.apiBuilder}, so implementations use the static
   * {@code ApiBuilder} methods to map paths to their handler methods.
   */
  void registerRoutes();
}
