package com.notesapi.db;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.result.InsertOneResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.tinylog.Logger;

/** {@link NoteStore} backed by a MongoDB collection. */
public final class MongoNoteStore implements NoteStore {

  static final String TITLE_INDEX = "title_unique";
  static final String CREATED_AT_INDEX = "createdAt_asc";

  private final MongoCollection<Document> collection;

  public MongoNoteStore(MongoDatabase database, String collectionName) {
    this(database.getCollection(collectionName));
  }

  public MongoNoteStore(MongoCollection<Document> collection) {
    this.collection = collection;
  }

  /**
   * Creates the unique index on {@code title} and the index backing creation-time ordering.
   * Safe to call on every startup.
   */
  public void ensureIndexes() {
    collection.createIndex(
        Indexes.ascending(NoteDocuments.TITLE), new IndexOptions().unique(true).name(TITLE_INDEX));
    collection.createIndex(
        Indexes.ascending(NoteDocuments.CREATED_AT), new IndexOptions().name(CREATED_AT_INDEX));
    Logger.info(
        "Ensured indexes {} and {} on {}",
        TITLE_INDEX,
        CREATED_AT_INDEX,
        collection.getNamespace());
  }

  @Nonnull
  @Override
  public List<Document> findMany(int limit, int offset, SortOrder sortOrder) {
    // _id breaks ties between notes created in the same millisecond.
    Bson sort =
        sortOrder == SortOrder.DESCENDING
            ? Sorts.descending(NoteDocuments.CREATED_AT, NoteDocuments.ID)
            : Sorts.ascending(NoteDocuments.CREATED_AT, NoteDocuments.ID);
    return collection.find().sort(sort).skip(offset).limit(limit).into(new ArrayList<>());
  }

  @Nonnull
  @Override
  public Optional<Document> findOne(ObjectId id) {
    return Optional.ofNullable(collection.find(Filters.eq(NoteDocuments.ID, id)).first());
  }

  @Nonnull
  @Override
  public ObjectId insertOne(Document document) {
    InsertOneResult result = collection.insertOne(document);
    BsonValue insertedId = result.getInsertedId();
    if (insertedId != null && insertedId.isObjectId()) {
      return insertedId.asObjectId().getValue();
    }
    return document.getObjectId(NoteDocuments.ID);
  }

  @Nonnull
  @Override
  public Optional<Document> updateOne(ObjectId id, Document fields) {
    return Optional.ofNullable(
        collection.findOneAndUpdate(
            Filters.eq(NoteDocuments.ID, id),
            new Document("$set", fields),
            new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER)));
  }

  @Override
  public long deleteOne(ObjectId id) {
    return collection.deleteOne(Filters.eq(NoteDocuments.ID, id)).getDeletedCount();
  }
}
