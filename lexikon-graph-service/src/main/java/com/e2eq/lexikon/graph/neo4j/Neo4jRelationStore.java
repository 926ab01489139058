package com.e2eq.lexikon.graph.neo4j;

import com.e2eq.lexikon.graph.core.*;
import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import org.neo4j.driver.*;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Relationship;

import java.util.*;
import java.util.function.Function;

/**
 * {@link RelationStore} on Neo4j. Terms are {@code (:Term {id})} nodes and every relation is one
 * {@code [:RELATION]} relationship from its source to its target carrying all relation fields as properties.
 * <p>
 * A relationship property uniqueness constraint on {@code key} backs insert-or-merge: a losing concurrent insert
 * is retried as a merge, and merges write-lock the row before reading it. Neighborhood reads are a
 * single variable-length match that follows relationships forward, or backward only when they are symmetric.
 * </p>
 */
public class Neo4jRelationStore implements RelationStore, AutoCloseable {

    static final int MAX_MERGE_ATTEMPTS = 5;
    private static final String CONSTRAINT_FAILED = "Neo.ClientError.Schema.ConstraintValidationFailed";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Driver driver;
    private final RelationTypeRegistry registry;
    private final ObjectMapper mapper;

    public Neo4jRelationStore(Driver driver, RelationTypeRegistry registry, ObjectMapper mapper) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mapper = mapper != null ? mapper : new ObjectMapper();
        ensureSchema();
    }

    public static Neo4jRelationStore connect(String uri, String username, String password,
                                             RelationTypeRegistry registry, ObjectMapper mapper) {
        Log.infof("Connecting graph replica to Neo4j at %s", uri);
        Driver driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password));
        try {
            return new Neo4jRelationStore(driver, registry, mapper);
        } catch (StoreUnavailableException e) {
            driver.close();
            throw e;
        }
    }

    private void ensureSchema() {
        call("ensureSchema", session -> {
            session.run("CREATE CONSTRAINT term_id IF NOT EXISTS FOR (t:Term) REQUIRE t.id IS UNIQUE").consume();
            session.run("CREATE CONSTRAINT relation_key IF NOT EXISTS FOR ()-[r:RELATION]-() REQUIRE r.key IS UNIQUE").consume();
            session.run("CREATE INDEX relation_id IF NOT EXISTS FOR ()-[r:RELATION]-() ON (r.id)").consume();
            session.run("CREATE INDEX relation_status IF NOT EXISTS FOR ()-[r:RELATION]-() ON (r.status)").consume();
            return null;
        });
    }

    @Override
    public void close() {
        driver.close();
        Log.info("Neo4j connection closed");
    }

    @Override
    public RelationTypeRegistry registry() {
        return registry;
    }

    @Override
    public PutResult put(Relation relation) {
        RelationValidator.validate(relation, registry);
        String key = RelationKey.of(relation, registry).asString();
        for (int attempt = 1; attempt <= MAX_MERGE_ATTEMPTS; attempt++) {
            try {
                return call("put", session -> session.executeWrite(tx -> {
                    // write-lock the row before reading it so concurrent merges of one key serialize
                    tx.run("MATCH ()-[r:RELATION {key: $key}]->() SET r._lock = true REMOVE r._lock",
                            Map.of("key", key)).consume();
                    Result existing = tx.run("MATCH ()-[r:RELATION {key: $key}]->() RETURN r", Map.of("key", key));
                    if (!existing.hasNext()) {
                        Relation row = relation.copy();
                        if (row.getId() == null) row.setId(UUID.randomUUID().toString());
                        if (row.getCreatedAt() == null) row.setCreatedAt(new Date());
                        create(tx, row, key);
                        return PutResult.created(row.getId());
                    }
                    Relation current = fromRelationship(existing.single().get("r").asRelationship());
                    MergePolicy.Action action = MergePolicy.decide(current, relation);
                    if (action == MergePolicy.Action.SKIP) return PutResult.skipped(current.getId());
                    PutResult result = MergePolicy.apply(action, current, relation);
                    setMutable(tx, current);
                    return result;
                }));
            } catch (StoreUnavailableException e) {
                if (!(e.getCause() instanceof ClientException)
                        || !CONSTRAINT_FAILED.equals(((ClientException) e.getCause()).code())) {
                    throw e;
                }
                Log.debugf("concurrent insert of key %s, retrying as merge (attempt %d)", key, attempt);
            }
        }
        throw new StoreUnavailableException("Concurrent inserts kept conflicting with key " + key);
    }

    private void create(TransactionContext tx, Relation row, String key) {
        Map<String, Object> params = new HashMap<>();
        params.put("source", row.getSourceId());
        params.put("target", row.getTargetId());
        params.put("props", properties(row, key));
        tx.run("MERGE (s:Term {id: $source}) MERGE (t:Term {id: $target}) "
                + "CREATE (s)-[r:RELATION]->(t) SET r = $props", params).consume();
    }

    private void setMutable(TransactionContext tx, Relation r) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", r.getId());
        params.put("confidence", r.getConfidence());
        params.put("provenance", r.getProvenance().name());
        params.put("status", r.getStatus().name());
        params.put("derivationPath", r.getDerivationPath());
        params.put("rulePath", r.getRulePath());
        params.put("createdBy", r.getCreatedBy());
        params.put("metadata", writeMetadata(r.getMetadata()));
        tx.run("MATCH ()-[r:RELATION {id: $id}]->() SET r.confidence = $confidence, r.provenance = $provenance, "
                + "r.status = $status, r.derivationPath = $derivationPath, r.rulePath = $rulePath, "
                + "r.createdBy = $createdBy, r.metadata = $metadata", params).consume();
    }

    @Override
    public Optional<Relation> get(String id) {
        return single("MATCH ()-[r:RELATION {id: $id}]->() RETURN r", Map.of("id", id));
    }

    @Override
    public Optional<Relation> find(String sourceId, String targetId, String relationType) {
        String key = RelationKey.of(sourceId, relationType, targetId, registry.isSymmetric(relationType)).asString();
        return single("MATCH ()-[r:RELATION {key: $key}]->() RETURN r", Map.of("key", key));
    }

    @Override
    public List<Relation> getOutgoing(String termId, String relationType) {
        return byEnd("MATCH (:Term {id: $term})-[r:RELATION]->() ", termId, relationType);
    }

    @Override
    public List<Relation> getIncoming(String termId, String relationType) {
        return byEnd("MATCH ()-[r:RELATION]->(:Term {id: $term}) ", termId, relationType);
    }

    private List<Relation> byEnd(String match, String termId, String relationType) {
        Map<String, Object> params = new HashMap<>();
        params.put("term", termId);
        params.put("type", relationType);
        return list(match + "WHERE $type IS NULL OR r.type = $type RETURN r ORDER BY r.type, r.id", params);
    }

    @Override
    public List<Relation> neighborhood(Collection<String> seedTermIds, int depth) {
        if (depth <= 0 || seedTermIds.isEmpty()) return List.of();
        String cypher = String.format("MATCH p = (s:Term)-[:RELATION*1..%d]-(:Term) "
                + "WHERE s.id IN $seeds AND all(i IN range(0, length(p) - 1) WHERE "
                + "relationships(p)[i].status = 'CONFIRMED' AND "
                + "(startNode(relationships(p)[i]) = nodes(p)[i] OR relationships(p)[i].symmetric)) "
                + "UNWIND relationships(p) AS r RETURN DISTINCT r", depth);
        return list(cypher, Map.of("seeds", new ArrayList<>(seedTermIds)));
    }

    @Override
    public List<Relation> delete(String id) {
        long deleted = call("delete", session -> session.executeWrite(tx ->
                tx.run("MATCH ()-[r:RELATION {id: $id}]->() DELETE r RETURN count(*) AS n", Map.of("id", id))
                        .single().get("n").asLong()));
        if (deleted == 0) throw new RelationNotFoundException(id);
        return findDerivedFrom(id);
    }

    @Override
    public List<Relation> findDerivedFrom(String relationId) {
        return list("MATCH ()-[r:RELATION]->() WHERE $id IN r.derivationPath RETURN r ORDER BY r.id",
                Map.of("id", relationId));
    }

    @Override
    public void update(Relation relation) {
        RelationValidator.validate(relation, registry);
        boolean found = call("update", session -> session.executeWrite(tx -> {
            if (!tx.run("MATCH ()-[r:RELATION {id: $id}]->() RETURN r.id", Map.of("id", relation.getId())).hasNext()) {
                return false;
            }
            setMutable(tx, relation);
            return true;
        }));
        if (!found) throw new RelationNotFoundException(relation.getId());
    }

    @Override
    public List<Relation> findByStatus(Relation.Status status, int limit) {
        if (limit <= 0) return List.of();
        return list("MATCH ()-[r:RELATION]->() WHERE r.status = $status RETURN r ORDER BY r.id LIMIT $limit",
                Map.of("status", status.name(), "limit", limit));
    }

    @Override
    public long count() {
        return call("count", session -> session.executeRead(tx ->
                tx.run("MATCH ()-[r:RELATION]->() RETURN count(r) AS n").single().get("n").asLong()));
    }

    @Override
    public List<Relation> page(String afterId, int limit) {
        if (limit <= 0) return List.of();
        Map<String, Object> params = new HashMap<>();
        params.put("after", afterId);
        params.put("limit", limit);
        return list("MATCH ()-[r:RELATION]->() WHERE $after IS NULL OR r.id > $after "
                + "RETURN r ORDER BY r.id LIMIT $limit", params);
    }

    @Override
    public List<String> termIds(String afterTermId, int limit) {
        if (limit <= 0) return List.of();
        Map<String, Object> params = new HashMap<>();
        params.put("after", afterTermId);
        params.put("limit", limit);
        return call("termIds", session -> session.executeRead(tx -> {
            Result result = tx.run("MATCH ()-[r:RELATION]->() UNWIND [r.sourceId, r.targetId] AS t "
                    + "WITH DISTINCT t WHERE $after IS NULL OR t > $after RETURN t ORDER BY t LIMIT $limit", params);
            List<String> out = new ArrayList<>();
            while (result.hasNext()) out.add(result.next().get("t").asString());
            return out;
        }));
    }

    @Override
    public void restore(Relation relation) {
        RelationValidator.validate(relation, registry);
        if (relation.getId() == null) {
            throw new IllegalArgumentException("restore requires a relation id");
        }
        String key = RelationKey.of(relation, registry).asString();
        call("restore", session -> session.executeWrite(tx -> {
            tx.run("MATCH ()-[r:RELATION]->() WHERE r.id = $id OR r.key = $key DELETE r",
                    Map.of("id", relation.getId(), "key", key)).consume();
            create(tx, relation, key);
            return null;
        }));
    }

    // --- mapping --------------------------------------------------------------------------------

    private Map<String, Object> properties(Relation r, String key) {
        Map<String, Object> p = new HashMap<>();
        p.put("id", r.getId());
        p.put("key", key);
        p.put("sourceId", r.getSourceId());
        p.put("targetId", r.getTargetId());
        p.put("type", r.getRelationType());
        p.put("symmetric", registry.isSymmetric(r.getRelationType()));
        p.put("confidence", r.getConfidence());
        p.put("provenance", r.getProvenance().name());
        p.put("status", r.getStatus().name());
        p.put("derivationPath", r.getDerivationPath());
        p.put("rulePath", r.getRulePath());
        p.put("createdAt", r.getCreatedAt() != null ? r.getCreatedAt().getTime() : null);
        p.put("createdBy", r.getCreatedBy());
        p.put("metadata", writeMetadata(r.getMetadata()));
        return p;
    }

    Relation fromRelationship(Relationship rel) {
        Relation r = new Relation();
        r.setId(rel.get("id").asString());
        r.setSourceId(rel.get("sourceId").asString());
        r.setTargetId(rel.get("targetId").asString());
        r.setRelationType(rel.get("type").asString());
        r.setConfidence(rel.get("confidence").asDouble(1.0d));
        r.setProvenance(Relation.Provenance.valueOf(rel.get("provenance").asString(Relation.Provenance.ASSERTED.name())));
        r.setStatus(Relation.Status.valueOf(rel.get("status").asString(Relation.Status.CONFIRMED.name())));
        r.setDerivationPath(rel.get("derivationPath").asList(Value::asString, List.of()));
        r.setRulePath(rel.get("rulePath").asList(Value::asString, List.of()));
        Value created = rel.get("createdAt");
        r.setCreatedAt(created.isNull() ? null : new Date(created.asLong()));
        r.setCreatedBy(rel.get("createdBy").asString(null));
        r.setMetadata(readMetadata(rel.get("metadata").asString(null)));
        return r;
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Relation metadata is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            Log.warnf("unreadable relation metadata ignored: %s", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    // --- session helpers ------------------------------------------------------------------------

    private Optional<Relation> single(String cypher, Map<String, Object> params) {
        List<Relation> rows = list(cypher, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<Relation> list(String cypher, Map<String, Object> params) {
        return call("read", session -> session.executeRead(tx -> {
            Result result = tx.run(cypher, params);
            List<Relation> out = new ArrayList<>();
            while (result.hasNext()) {
                out.add(fromRelationship(result.next().get("r").asRelationship()));
            }
            return out;
        }));
    }

    private <T> T call(String op, Function<Session, T> work) {
        try (Session session = driver.session()) {
            return work.apply(session);
        } catch (Neo4jException e) {
            Log.warnf("neo4j %s failed: %s", op, e.getMessage());
            throw new StoreUnavailableException("Neo4j " + op + " failed: " + e.getMessage(), e);
        }
    }
}
