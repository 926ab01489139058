package com.e2eq.lexikon.graph.mongo;

import com.e2eq.lexikon.graph.core.Relation;
import com.e2eq.lexikon.graph.core.RelationKey;
import com.e2eq.lexikon.graph.core.RelationTypeRegistry;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps relations to and from raw BSON documents.
 * <p>
 * Besides the relation fields each document carries its uniqueness {@code key} and two traversal arrays:
 * {@code fromTerms} lists the ends a traversal may leave from and {@code toTerms} the ends it arrives at.
 * Directed edges list one term in each; symmetric edges list both ends in both arrays.
 * </p>
 */
final class RelationDocuments {
    private RelationDocuments() {}

    static final String ID = "_id";
    static final String KEY = "key";
    static final String SOURCE = "sourceId";
    static final String TARGET = "targetId";
    static final String TYPE = "relationType";
    static final String CONFIDENCE = "confidence";
    static final String PROVENANCE = "provenance";
    static final String STATUS = "status";
    static final String DERIVATION = "derivationPath";
    static final String RULES = "rulePath";
    static final String CREATED_AT = "createdAt";
    static final String CREATED_BY = "createdBy";
    static final String METADATA = "metadata";
    static final String FROM_TERMS = "fromTerms";
    static final String TO_TERMS = "toTerms";

    static Document toDocument(Relation r, RelationTypeRegistry registry) {
        boolean symmetric = registry.isSymmetric(r.getRelationType());
        List<String> from = new ArrayList<>(2);
        List<String> to = new ArrayList<>(2);
        from.add(r.getSourceId());
        to.add(r.getTargetId());
        if (symmetric) {
            from.add(r.getTargetId());
            to.add(r.getSourceId());
        }
        return new Document(ID, r.getId())
                .append(KEY, RelationKey.of(r, registry).asString())
                .append(SOURCE, r.getSourceId())
                .append(TARGET, r.getTargetId())
                .append(TYPE, r.getRelationType())
                .append(CONFIDENCE, r.getConfidence())
                .append(PROVENANCE, r.getProvenance().name())
                .append(STATUS, r.getStatus().name())
                .append(DERIVATION, new ArrayList<>(r.getDerivationPath()))
                .append(RULES, new ArrayList<>(r.getRulePath()))
                .append(CREATED_AT, r.getCreatedAt())
                .append(CREATED_BY, r.getCreatedBy())
                .append(METADATA, new Document(r.getMetadata()))
                .append(FROM_TERMS, from)
                .append(TO_TERMS, to);
    }

    /** The fields a merge, review or re-derivation may change. */
    static Document mutableFields(Relation r) {
        return new Document(CONFIDENCE, r.getConfidence())
                .append(PROVENANCE, r.getProvenance().name())
                .append(STATUS, r.getStatus().name())
                .append(DERIVATION, new ArrayList<>(r.getDerivationPath()))
                .append(RULES, new ArrayList<>(r.getRulePath()))
                .append(CREATED_BY, r.getCreatedBy())
                .append(METADATA, new Document(r.getMetadata()));
    }

    static Relation fromDocument(Document d) {
        Relation r = new Relation();
        r.setId(d.getString(ID));
        r.setSourceId(d.getString(SOURCE));
        r.setTargetId(d.getString(TARGET));
        r.setRelationType(d.getString(TYPE));
        Number confidence = d.get(CONFIDENCE, Number.class);
        r.setConfidence(confidence != null ? confidence.doubleValue() : 1.0d);
        String provenance = d.getString(PROVENANCE);
        if (provenance != null) r.setProvenance(Relation.Provenance.valueOf(provenance));
        String status = d.getString(STATUS);
        if (status != null) r.setStatus(Relation.Status.valueOf(status));
        r.setDerivationPath(d.getList(DERIVATION, String.class));
        r.setRulePath(d.getList(RULES, String.class));
        r.setCreatedAt(d.getDate(CREATED_AT));
        r.setCreatedBy(d.getString(CREATED_BY));
        Document metadata = d.get(METADATA, Document.class);
        Map<String, Object> meta = new LinkedHashMap<>();
        if (metadata != null) meta.putAll(metadata);
        r.setMetadata(meta);
        return r;
    }

    static Date now() {
        return new Date();
    }
}
