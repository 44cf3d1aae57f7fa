package com.notesapi;

import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.notesapi.db.NoteDocuments;
import com.notesapi.db.NoteStore;
import com.notesapi.db.SortOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * A {@link NoteStore} kept in memory for service and adapter tests. It enforces the unique title
 * index the way MongoDB does, by throwing a duplicate key write error, and counts every call so
 * tests can assert that invalid input never reached the database.
 */
public class InMemoryNoteStore implements NoteStore {

  private final Map<ObjectId, Document> documents = new LinkedHashMap<>();
  private final AtomicInteger calls = new AtomicInteger();
  private RuntimeException nextFailure;

  /** Returns how many store operations have been invoked. */
  public int callCount() {
    return calls.get();
  }

  /** Makes the next store operation throw the given exception instead of running. */
  public void failNextWith(RuntimeException failure) {
    this.nextFailure = failure;
  }

  /** Stores a raw document as-is, bypassing validation. Does not count as a call. */
  public ObjectId putRaw(Document document) {
    ObjectId id = document.getObjectId(NoteDocuments.ID);
    documents.put(id, new Document(document));
    return id;
  }

  /** Returns a copy of the stored document, bypassing the call counter. */
  public Optional<Document> peek(ObjectId id) {
    return Optional.ofNullable(documents.get(id)).map(Document::new);
  }

  @Override
  public synchronized List<Document> findMany(int limit, int offset, SortOrder sortOrder) {
    beforeCall();
    Comparator<Document> order =
        Comparator.comparing((Document d) -> d.getDate(NoteDocuments.CREATED_AT))
            .thenComparing(d -> d.getObjectId(NoteDocuments.ID));
    if (sortOrder == SortOrder.DESCENDING) {
      order = order.reversed();
    }
    List<Document> result = new ArrayList<>();
    documents.values().stream()
        .sorted(order)
        .skip(offset)
        .limit(limit)
        .forEach(d -> result.add(new Document(d)));
    return result;
  }

  @Override
  public synchronized Optional<Document> findOne(ObjectId id) {
    beforeCall();
    return peek(id);
  }

  @Override
  public synchronized ObjectId insertOne(Document document) {
    beforeCall();
    checkUniqueTitle(document.getString(NoteDocuments.TITLE), null);
    ObjectId id = new ObjectId();
    Document stored = new Document(NoteDocuments.ID, id);
    stored.putAll(document);
    documents.put(id, stored);
    return id;
  }

  @Override
  public synchronized Optional<Document> updateOne(ObjectId id, Document fields) {
    beforeCall();
    Document stored = documents.get(id);
    if (stored == null) {
      return Optional.empty();
    }
    if (fields.containsKey(NoteDocuments.TITLE)) {
      checkUniqueTitle(fields.getString(NoteDocuments.TITLE), id);
    }
    stored.putAll(fields);
    return Optional.of(new Document(stored));
  }

  @Override
  public synchronized long deleteOne(ObjectId id) {
    beforeCall();
    return documents.remove(id) != null ? 1 : 0;
  }

  private void beforeCall() {
    calls.incrementAndGet();
    if (nextFailure != null) {
      RuntimeException failure = nextFailure;
      nextFailure = null;
      throw failure;
    }
  }

  private void checkUniqueTitle(String title, ObjectId self) {
    for (Document existing : documents.values()) {
      if (title != null
          && title.equals(existing.getString(NoteDocuments.TITLE))
          && !existing.getObjectId(NoteDocuments.ID).equals(self)) {
        throw new MongoWriteException(
            new WriteError(
                11000,
                "E11000 duplicate key error collection: notes index: title_unique",
                new BsonDocument()),
            new ServerAddress());
      }
    }
  }
}
