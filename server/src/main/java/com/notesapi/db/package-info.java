/**
 * The persistence layer for notes.
 *
 * <p>This package contains the {@link com.notesapi.db.Note} record, the mapper between stored
 * BSON documents and that record ({@link com.notesapi.db.NoteDocuments}), the query port the
 * service talks to ({@link com.notesapi.db.NoteStore}) with its MongoDB implementation, and the
 * classifier that turns driver failures into statuses ({@link com.notesapi.db.NoteErrors}).
 *
 * <p>The layer follows a consistent pattern:
 *
 * <ul>
 *   <li>Decoding returns {@code StatusOr<Note>}; a missing or mistyped field is an
 *       INVALID_ARGUMENT status naming the field, never an exception
 *   <li>Store methods return raw documents and let driver exceptions propagate
 *   <li>Only {@code NoteErrors} knows about driver exception types
 * </ul>
 */
package com.notesapi.db;
