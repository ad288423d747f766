package com.teachertraining.api.repository;

import com.mongodb.MongoException;
import com.teachertraining.api.config.TrainingApiProperties;
import com.teachertraining.api.exception.InvalidIdentifierException;
import com.teachertraining.api.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Schemaless access to the training collections.
 * Records are plain BSON documents; every driver or template failure
 * surfaces as a {@link StorageException}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DocumentStore {

    public static final String ID_FIELD = "_id";

    private final MongoTemplate mongoTemplate;
    private final TrainingApiProperties properties;

    /**
     * Inserts one document and returns its ObjectId as a hex string.
     */
    public String insert(String collection, Document document) {
        ObjectId id = new ObjectId();
        document.put(ID_FIELD, id);

        execute("insert", collection, () -> mongoTemplate.insert(document, collection));
        log.debug("Inserted document {} into '{}'", id, collection);
        return id.toHexString();
    }

    /**
     * Exact-match lookup in natural order. An empty or null filter matches everything;
     * a null limit falls back to {@code training.api.default-list-limit}.
     */
    public List<Document> findMany(String collection, Map<String, ?> filter, Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.getDefaultListLimit();
        Query query = exactMatch(filter).limit(effectiveLimit);
        return execute("find", collection, () -> mongoTemplate.find(query, Document.class, collection));
    }

    public Optional<Document> findOne(String collection, Map<String, ?> filter) {
        Query query = exactMatch(filter);
        return Optional.ofNullable(
                execute("findOne", collection, () -> mongoTemplate.findOne(query, Document.class, collection)));
    }

    /**
     * @throws InvalidIdentifierException if {@code id} is not a 24-character hex ObjectId
     */
    public Optional<Document> findById(String collection, String id) {
        if (id == null || !ObjectId.isValid(id)) {
            throw new InvalidIdentifierException(id);
        }
        ObjectId objectId = new ObjectId(id);
        return Optional.ofNullable(
                execute("findById", collection, () -> mongoTemplate.findById(objectId, Document.class, collection)));
    }

    /**
     * Atomic insert-or-overwrite keyed by {@code key}: every entry of {@code fields}
     * is {@code $set} on the matching document. Returns the stored document.
     */
    public Document upsert(String collection, Map<String, ?> key, Map<String, ?> fields) {
        Query query = exactMatch(key);
        Update update = new Update();
        fields.forEach(update::set);

        execute("upsert", collection, () -> mongoTemplate.upsert(query, update, collection));
        return findOne(collection, key)
                .orElseThrow(() -> new StorageException(
                        "upsert on '" + collection + "' succeeded but the record could not be read back", null));
    }

    public long count(String collection) {
        return execute("count", collection, () -> mongoTemplate.count(new Query(), collection));
    }

    public List<String> collectionNames() {
        return execute("listCollections", "*", () -> new ArrayList<>(mongoTemplate.getCollectionNames()));
    }

    public String databaseName() {
        return execute("getDatabase", "*", () -> mongoTemplate.getDb().getName());
    }

    public void ensureUniqueIndex(String collection, String... keys) {
        Index index = new Index().unique().named(String.join("_", keys) + "_unique");
        for (String key : keys) {
            index.on(key, Sort.Direction.ASC);
        }
        execute("ensureIndex", collection, () -> mongoTemplate.indexOps(collection).ensureIndex(index));
    }

    private static Query exactMatch(Map<String, ?> filter) {
        Query query = new Query();
        if (filter != null) {
            filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        }
        return query;
    }

    private <T> T execute(String operation, String collection, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            log.debug("MongoDB {} on '{}' failed: {}", operation, collection, e.getMessage());
            throw new StorageException(operation, collection, e, properties.getErrorMessageLength());
        }
    }
}
