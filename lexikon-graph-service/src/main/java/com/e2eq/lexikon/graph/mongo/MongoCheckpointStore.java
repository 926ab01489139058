package com.e2eq.lexikon.graph.mongo;

import com.e2eq.lexikon.graph.core.CheckpointStore;
import com.e2eq.lexikon.graph.core.InferenceRule;
import com.e2eq.lexikon.graph.core.ReinferenceCheckpoint;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bulk re-inference checkpoints, one document per job keyed by job id.
 */
public class MongoCheckpointStore implements CheckpointStore {

    private final MongoCollection<Document> col;

    public MongoCheckpointStore(MongoCollection<Document> collection) {
        this.col = Objects.requireNonNull(collection, "collection");
    }

    @Override
    public void save(ReinferenceCheckpoint cp) {
        List<String> rules = new ArrayList<>();
        for (InferenceRule r : cp.rules()) rules.add(r.name());
        Document doc = new Document("_id", cp.jobId())
                .append("status", cp.status().name())
                .append("rules", rules)
                .append("maxDepth", cp.maxDepth())
                .append("lastTermId", cp.lastTermId())
                .append("processedTerms", cp.processedTerms())
                .append("skippedTerms", cp.skippedTerms())
                .append("inferredRelations", cp.inferredRelations())
                .append("error", cp.error())
                .append("startedAt", cp.startedAt())
                .append("updatedAt", cp.updatedAt());
        try {
            col.replaceOne(Filters.eq("_id", cp.jobId()), doc, new ReplaceOptions().upsert(true));
        } catch (MongoException e) {
            throw new StoreUnavailableException("Saving checkpoint of job " + cp.jobId() + " failed", e);
        }
    }

    @Override
    public Optional<ReinferenceCheckpoint> find(String jobId) {
        Document d;
        try {
            d = col.find(Filters.eq("_id", jobId)).first();
        } catch (MongoException e) {
            throw new StoreUnavailableException("Loading checkpoint of job " + jobId + " failed", e);
        }
        if (d == null) return Optional.empty();
        List<InferenceRule> rules = new ArrayList<>();
        for (String name : d.getList("rules", String.class, List.of())) rules.add(InferenceRule.valueOf(name));
        return Optional.of(new ReinferenceCheckpoint(
                d.getString("_id"),
                ReinferenceCheckpoint.Status.valueOf(d.getString("status")),
                rules,
                d.getInteger("maxDepth", 0),
                d.getString("lastTermId"),
                number(d, "processedTerms"),
                number(d, "skippedTerms"),
                number(d, "inferredRelations"),
                d.getString("error"),
                d.getDate("startedAt"),
                d.getDate("updatedAt")));
    }

    private static long number(Document d, String field) {
        Number n = d.get(field, Number.class);
        return n != null ? n.longValue() : 0L;
    }
}
