package com.notesapi.db;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * The queries the note service issues against the database.
 *
 * <p>Implementations return raw documents and let driver failures (the unchecked
 * {@code com.mongodb.MongoException} family) propagate; translating them is the job of
 * {@link NoteErrors}.
 */
public interface NoteStore {

  /**
   * Loads a page of notes ordered by creation time.
   *
   * @param limit the maximum number of documents to return
   * @param offset the number of documents to skip
   * @param sortOrder {@link SortOrder#ASCENDING} or {@link SortOrder#DESCENDING}
   */
  @Nonnull
  List<Document> findMany(int limit, int offset, SortOrder sortOrder);

  /** Loads a single note document by id. */
  @Nonnull
  Optional<Document> findOne(ObjectId id);

  /**
   * Inserts a new note document.
   *
   * @return the identifier assigned by the database
   */
  @Nonnull
  ObjectId insertOne(Document document);

  /**
   * Atomically sets the given fields on a note.
   *
   * @return the document after the update, or empty if no note has this id
   */
  @Nonnull
  Optional<Document> updateOne(ObjectId id, Document fields);

  /**
   * Deletes a note.
   *
   * @return the number of documents removed, 0 or 1
   */
  long deleteOne(ObjectId id);
}
