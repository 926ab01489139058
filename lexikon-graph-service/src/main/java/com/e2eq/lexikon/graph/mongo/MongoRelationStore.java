package com.e2eq.lexikon.graph.mongo;

import com.e2eq.lexikon.graph.core.*;
import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.*;
import com.mongodb.client.result.UpdateResult;
import io.quarkus.logging.Log;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.*;
import java.util.function.Supplier;

import static com.e2eq.lexikon.graph.mongo.RelationDocuments.*;

/**
 * {@link RelationStore} over a single MongoDB collection.
 * <p>
 * A unique index on {@code key} is the dedup boundary: a write first tries a plain insert and, when the index
 * rejects it, folds the incoming relation into the existing row with a conditional update that only matches
 * the row state the merge decision was made against. Neighborhood reads are one aggregation that seeds from
 * the outgoing edges of the requested terms and expands the rest with {@code $graphLookup}.
 * </p>
 */
public class MongoRelationStore implements RelationStore {

    static final int MAX_MERGE_ATTEMPTS = 5;

    private final MongoCollection<Document> col;
    private final RelationTypeRegistry registry;

    public MongoRelationStore(MongoCollection<Document> collection, RelationTypeRegistry registry) {
        this.col = Objects.requireNonNull(collection, "collection");
        this.registry = Objects.requireNonNull(registry, "registry");
        ensureIndexes();
    }

    private void ensureIndexes() {
        call("ensureIndexes", () -> {
            col.createIndex(Indexes.ascending(KEY), new IndexOptions().name("uniq_relation_key").unique(true));
            col.createIndex(Indexes.compoundIndex(Indexes.ascending(SOURCE), Indexes.ascending(TYPE)),
                    new IndexOptions().name("idx_source_type"));
            col.createIndex(Indexes.compoundIndex(Indexes.ascending(TARGET), Indexes.ascending(TYPE)),
                    new IndexOptions().name("idx_target_type"));
            col.createIndex(Indexes.compoundIndex(Indexes.ascending(FROM_TERMS), Indexes.ascending(STATUS)),
                    new IndexOptions().name("idx_from_terms_status"));
            col.createIndex(Indexes.ascending(DERIVATION), new IndexOptions().name("idx_derivation"));
            col.createIndex(Indexes.compoundIndex(Indexes.ascending(STATUS), Indexes.ascending(ID)),
                    new IndexOptions().name("idx_status_id"));
            return null;
        });
    }

    @Override
    public RelationTypeRegistry registry() {
        return registry;
    }

    @Override
    public PutResult put(Relation relation) {
        RelationValidator.validate(relation, registry);
        Relation row = relation.copy();
        if (row.getId() == null) row.setId(UUID.randomUUID().toString());
        if (row.getCreatedAt() == null) row.setCreatedAt(now());
        Document doc = toDocument(row, registry);
        try {
            col.insertOne(doc);
            return PutResult.created(row.getId());
        } catch (MongoWriteException e) {
            if (ErrorCategory.fromErrorCode(e.getCode()) != ErrorCategory.DUPLICATE_KEY) {
                throw new StoreUnavailableException("Insert of " + relation + " failed: " + e.getMessage(), e);
            }
        } catch (MongoException e) {
            throw new StoreUnavailableException("Insert of " + relation + " failed: " + e.getMessage(), e);
        }
        return call("merge", () -> merge(doc.getString(KEY), relation));
    }

    private PutResult merge(String key, Relation incoming) {
        for (int attempt = 1; attempt <= MAX_MERGE_ATTEMPTS; attempt++) {
            Document current = col.find(Filters.eq(KEY, key)).first();
            if (current == null) {
                // the conflicting row was deleted in between; retry as a plain insert
                Relation row = incoming.copy();
                if (row.getId() == null) row.setId(UUID.randomUUID().toString());
                if (row.getCreatedAt() == null) row.setCreatedAt(now());
                try {
                    col.insertOne(toDocument(row, registry));
                    return PutResult.created(row.getId());
                } catch (MongoWriteException e) {
                    if (ErrorCategory.fromErrorCode(e.getCode()) != ErrorCategory.DUPLICATE_KEY) throw e;
                    continue;
                }
            }
            Relation existing = fromDocument(current);
            MergePolicy.Action action = MergePolicy.decide(existing, incoming);
            if (action == MergePolicy.Action.SKIP) {
                return PutResult.skipped(existing.getId());
            }
            PutResult result = MergePolicy.apply(action, existing, incoming);
            Bson unchanged = Filters.and(
                    Filters.eq(ID, existing.getId()),
                    Filters.eq(STATUS, current.getString(STATUS)),
                    Filters.eq(CONFIDENCE, current.get(CONFIDENCE)));
            UpdateResult updated = col.updateOne(unchanged, new Document("$set", mutableFields(existing)));
            if (updated.getMatchedCount() == 1) {
                Log.debugf("put %s resolved as %s against %s", incoming, action, existing.getId());
                return result;
            }
        }
        throw new StoreUnavailableException("Concurrent updates kept conflicting with merge of key " + key);
    }

    @Override
    public Optional<Relation> get(String id) {
        return call("get", () -> Optional.ofNullable(col.find(Filters.eq(ID, id)).first())
                .map(RelationDocuments::fromDocument));
    }

    @Override
    public Optional<Relation> find(String sourceId, String targetId, String relationType) {
        String key = RelationKey.of(sourceId, relationType, targetId, registry.isSymmetric(relationType)).asString();
        return call("find", () -> Optional.ofNullable(col.find(Filters.eq(KEY, key)).first())
                .map(RelationDocuments::fromDocument));
    }

    @Override
    public List<Relation> getOutgoing(String termId, String relationType) {
        return byEnd(SOURCE, termId, relationType);
    }

    @Override
    public List<Relation> getIncoming(String termId, String relationType) {
        return byEnd(TARGET, termId, relationType);
    }

    private List<Relation> byEnd(String field, String termId, String relationType) {
        Bson filter = relationType == null
                ? Filters.eq(field, termId)
                : Filters.and(Filters.eq(field, termId), Filters.eq(TYPE, relationType));
        return call("lookup " + field, () -> list(col.find(filter)
                .sort(Sorts.ascending(TYPE, ID))));
    }

    @Override
    public List<Relation> neighborhood(Collection<String> seedTermIds, int depth) {
        if (depth <= 0 || seedTermIds.isEmpty()) return List.of();
        List<Bson> pipeline = new ArrayList<>();
        pipeline.add(Aggregates.match(Filters.and(
                Filters.in(FROM_TERMS, new ArrayList<>(seedTermIds)),
                Filters.eq(STATUS, Relation.Status.CONFIRMED.name()))));
        if (depth > 1) {
            pipeline.add(Aggregates.graphLookup(col.getNamespace().getCollectionName(), "$" + TO_TERMS,
                    TO_TERMS, FROM_TERMS, "reach",
                    new GraphLookupOptions()
                            .maxDepth(depth - 2)
                            .restrictSearchWithMatch(Filters.eq(STATUS, Relation.Status.CONFIRMED.name()))));
        }
        return call("neighborhood", () -> {
            Map<String, Relation> found = new LinkedHashMap<>();
            for (Document d : col.aggregate(pipeline)) {
                found.putIfAbsent(d.getString(ID), fromDocument(d));
                List<Document> reach = d.getList("reach", Document.class);
                if (reach == null) continue;
                for (Document r : reach) {
                    found.putIfAbsent(r.getString(ID), fromDocument(r));
                }
            }
            return new ArrayList<>(found.values());
        });
    }

    @Override
    public List<Relation> delete(String id) {
        return call("delete", () -> {
            Document removed = col.findOneAndDelete(Filters.eq(ID, id));
            if (removed == null) throw new RelationNotFoundException(id);
            return derivedFrom(id);
        });
    }

    @Override
    public List<Relation> findDerivedFrom(String relationId) {
        return call("findDerivedFrom", () -> derivedFrom(relationId));
    }

    private List<Relation> derivedFrom(String relationId) {
        return list(col.find(Filters.eq(DERIVATION, relationId)).sort(Sorts.ascending(ID)));
    }

    @Override
    public void update(Relation relation) {
        RelationValidator.validate(relation, registry);
        call("update", () -> {
            UpdateResult r = col.updateOne(Filters.eq(ID, relation.getId()),
                    new Document("$set", mutableFields(relation)));
            if (r.getMatchedCount() == 0) throw new RelationNotFoundException(relation.getId());
            return null;
        });
    }

    @Override
    public List<Relation> findByStatus(Relation.Status status, int limit) {
        if (limit <= 0) return List.of();
        return call("findByStatus", () -> list(col.find(Filters.eq(STATUS, status.name()))
                .sort(Sorts.ascending(ID)).limit(limit)));
    }

    @Override
    public long count() {
        return call("count", col::countDocuments);
    }

    @Override
    public List<Relation> page(String afterId, int limit) {
        if (limit <= 0) return List.of();
        Bson filter = afterId == null ? new Document() : Filters.gt(ID, afterId);
        return call("page", () -> list(col.find(filter).sort(Sorts.ascending(ID)).limit(limit)));
    }

    @Override
    public List<String> termIds(String afterTermId, int limit) {
        if (limit <= 0) return List.of();
        List<Bson> pipeline = new ArrayList<>();
        pipeline.add(Aggregates.project(new Document(ID, 0)
                .append("term", Arrays.asList("$" + SOURCE, "$" + TARGET))));
        pipeline.add(Aggregates.unwind("$term"));
        if (afterTermId != null) pipeline.add(Aggregates.match(Filters.gt("term", afterTermId)));
        pipeline.add(Aggregates.group("$term"));
        pipeline.add(Aggregates.sort(Sorts.ascending(ID)));
        pipeline.add(Aggregates.limit(limit));
        return call("termIds", () -> {
            List<String> out = new ArrayList<>();
            for (Document d : col.aggregate(pipeline)) out.add(d.getString(ID));
            return out;
        });
    }

    @Override
    public void restore(Relation relation) {
        RelationValidator.validate(relation, registry);
        if (relation.getId() == null) {
            throw new IllegalArgumentException("restore requires a relation id");
        }
        Document doc = toDocument(relation, registry);
        call("restore", () -> {
            col.deleteMany(Filters.and(Filters.eq(KEY, doc.getString(KEY)), Filters.ne(ID, relation.getId())));
            col.replaceOne(Filters.eq(ID, relation.getId()), doc, new ReplaceOptions().upsert(true));
            return null;
        });
    }

    private static List<Relation> list(Iterable<Document> docs) {
        List<Relation> out = new ArrayList<>();
        for (Document d : docs) out.add(fromDocument(d));
        return out;
    }

    private static <T> T call(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (MongoException e) {
            Log.warnf("mongo %s failed: %s", op, e.getMessage());
            throw new StoreUnavailableException("MongoDB " + op + " failed: " + e.getMessage(), e);
        }
    }
}
