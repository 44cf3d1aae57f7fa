/**
 * Contains classes for error handling and status reporting.
 *
 * <p>This package provides a consistent way to represent operation statuses and errors
 * without relying on exceptions for control flow. The central classes are:
 *
 * <ul>
 *   <li>{@link com.notesapi.common.status.StatusCode} - The closed set of outcome codes, each
 *       tied to an HTTP status</li>
 *   <li>{@link com.notesapi.common.status.Status} - Represents a status with an optional message and cause</li>
 *   <li>{@link com.notesapi.common.status.StatusOr} - Container that holds either a successful value or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Note&gt; result = noteService.getNote(id);
 * if (result.isOk()) {
 *     Note note = result.getValue();
 *     // Render the note...
 * } else {
 *     Status error = result.getStatus();
 *     Logger.error("Failed to get note: {}", error);
 *     // Render the error based on error.getHttpCode()...
 * }
 * </pre>
 */
package com.notesapi.common.status;
