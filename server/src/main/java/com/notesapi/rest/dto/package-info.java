/**
 * Data Transfer Objects (DTOs) for the notes REST API.
 *
 * <p>This package contains Java records that define the JSON structure of request bodies and
 * response envelopes. They are annotated for OpenAPI so the generated documentation matches
 * what the handlers actually send.
 *
 * <h2>Conventions</h2>
 *
 * <ul>
 *   <li>Request DTOs carry an empty constructor for JSON deserialization and convert themselves
 *       to the persistence layer's input types ({@code toDraft()}, {@code toPatch()})</li>
 *   <li>Absent and null request fields mean the same thing: not provided</li>
 *   <li>Ids are 24 character hex strings; timestamps are milliseconds since the epoch</li>
 *   <li>Every response carries a {@code status} marker, "success" or "fail"</li>
 * </ul>
 *
 * <h2>Request/Response Patterns</h2>
 *
 * <ul>
 *   <li>Create: {@code CreateNoteRequest} -&gt; {@code NoteResponse} (201)</li>
 *   <li>Get: path id -&gt; {@code NoteResponse}</li>
 *   <li>List: query parameters -&gt; {@code ListNotesResponse}</li>
 *   <li>Update: {@code UpdateNoteRequest} -&gt; {@code NoteResponse}</li>
 *   <li>Delete: path id -&gt; No content response (204)</li>
 *   <li>Any failure: {@code GenericResponse} with status "fail"</li>
 * </ul>
 */
package com.notesapi.rest.dto;
