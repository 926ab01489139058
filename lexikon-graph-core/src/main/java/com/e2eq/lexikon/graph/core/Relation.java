package com.e2eq.lexikon.graph.core;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, directed, weighted edge between two terms.
 * <p>
 * Asserted relations carry an empty derivation path. Inferred relations carry the ordered ids of
 * the relations that justify them together with the rule applied at each hop.
 * </p>
 */
public class Relation {

    public enum Provenance { ASSERTED, INFERRED }

    public enum Status { CONFIRMED, PROVISIONAL }

    private String id;
    private String sourceId;
    private String targetId;
    private String relationType;
    private double confidence = 1.0d;
    private Provenance provenance = Provenance.ASSERTED;
    private List<String> derivationPath = new ArrayList<>();
    private List<String> rulePath = new ArrayList<>();
    private Status status = Status.CONFIRMED;
    private Date createdAt;
    private String createdBy;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Relation() { }

    public Relation(String sourceId, String relationType, String targetId, double confidence) {
        this.sourceId = sourceId;
        this.relationType = relationType;
        this.targetId = targetId;
        this.confidence = confidence;
    }

    /**
     * Builds an asserted, confirmed relation as created directly by a user.
     */
    public static Relation asserted(String sourceId, String relationType, String targetId,
                                    double confidence, String createdBy) {
        Relation r = new Relation(sourceId, relationType, targetId, confidence);
        r.setCreatedBy(createdBy);
        r.setCreatedAt(new Date());
        return r;
    }

    /**
     * Builds an inferred, provisional relation awaiting review.
     */
    public static Relation inferred(String sourceId, String relationType, String targetId, double confidence,
                                    List<String> derivationPath, List<String> rulePath, String createdBy) {
        Relation r = new Relation(sourceId, relationType, targetId, confidence);
        r.setProvenance(Provenance.INFERRED);
        r.setStatus(Status.PROVISIONAL);
        r.setDerivationPath(derivationPath);
        r.setRulePath(rulePath);
        r.setCreatedBy(createdBy);
        r.setCreatedAt(new Date());
        return r;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSourceId() { return sourceId; }
    public void setSourceId(String sourceId) { this.sourceId = sourceId; }
    public String getTargetId() { return targetId; }
    public void setTargetId(String targetId) { this.targetId = targetId; }
    public String getRelationType() { return relationType; }
    public void setRelationType(String relationType) { this.relationType = relationType; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public Provenance getProvenance() { return provenance; }
    public void setProvenance(Provenance provenance) { this.provenance = provenance; }
    public List<String> getDerivationPath() { return derivationPath; }
    public void setDerivationPath(List<String> derivationPath) {
        this.derivationPath = derivationPath != null ? new ArrayList<>(derivationPath) : new ArrayList<>();
    }
    public List<String> getRulePath() { return rulePath; }
    public void setRulePath(List<String> rulePath) {
        this.rulePath = rulePath != null ? new ArrayList<>(rulePath) : new ArrayList<>();
    }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Date getCreatedAt() { return createdAt; }
    public void setCreatedAt(Date createdAt) { this.createdAt = createdAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public boolean isConfirmed() { return status == Status.CONFIRMED; }
    public boolean isInferred() { return provenance == Provenance.INFERRED; }

    /**
     * @return true when this relation touches the given term on either end
     */
    public boolean touches(String termId) {
        return Objects.equals(sourceId, termId) || Objects.equals(targetId, termId);
    }

    /**
     * @return the end of this relation opposite to {@code termId}
     */
    public String otherEnd(String termId) {
        return Objects.equals(sourceId, termId) ? targetId : sourceId;
    }

    public Relation copy() {
        Relation r = new Relation();
        r.id = id;
        r.sourceId = sourceId;
        r.targetId = targetId;
        r.relationType = relationType;
        r.confidence = confidence;
        r.provenance = provenance;
        r.derivationPath = new ArrayList<>(derivationPath);
        r.rulePath = new ArrayList<>(rulePath);
        r.status = status;
        r.createdAt = createdAt;
        r.createdBy = createdBy;
        r.metadata = new LinkedHashMap<>(metadata);
        return r;
    }

    @Override
    public String toString() {
        return sourceId + " -[" + relationType + "]-> " + targetId
                + " (" + confidence + ", " + provenance + ", " + status + ")";
    }
}
