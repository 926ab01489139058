package com.e2eq.lexikon.graph.mongo;

import com.e2eq.lexikon.graph.core.Relation;
import com.e2eq.lexikon.graph.core.RelationTypeRegistry;
import com.e2eq.lexikon.graph.runtime.GraphWiring;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RelationDocumentsTest {

    private final RelationTypeRegistry registry = GraphWiring.inMemory().registry;

    @Test
    public void directedEdgeIsTraversableForwardOnly() {
        Relation r = Relation.asserted("Cat", "is_a", "Mammal", 1.0, "tester");
        r.setId("r1");

        Document d = RelationDocuments.toDocument(r, registry);

        assertEquals(List.of("Cat"), d.getList(RelationDocuments.FROM_TERMS, String.class));
        assertEquals(List.of("Mammal"), d.getList(RelationDocuments.TO_TERMS, String.class));
        assertEquals("Cat|is_a|Mammal", d.getString(RelationDocuments.KEY));
    }

    @Test
    public void symmetricEdgeIsTraversableBothWaysWithCanonicalKey() {
        Relation r = Relation.asserted("Wolf", "related_to", "Dog", 0.8, "tester");
        r.setId("r2");

        Document d = RelationDocuments.toDocument(r, registry);

        assertEquals(List.of("Wolf", "Dog"), d.getList(RelationDocuments.FROM_TERMS, String.class));
        assertEquals(List.of("Dog", "Wolf"), d.getList(RelationDocuments.TO_TERMS, String.class));
        assertEquals("Dog|related_to|Wolf", d.getString(RelationDocuments.KEY));
    }

    @Test
    public void inferredRelationKeepsDerivationAndMetadata() {
        Relation r = Relation.inferred("Cat", "is_a", "Animal", 0.9, List.of("r1", "r3"),
                List.of("TRANSITIVE"), "inference");
        r.setId("r9");
        r.setMetadata(Map.of("batch", "nightly"));

        Relation back = RelationDocuments.fromDocument(RelationDocuments.toDocument(r, registry));

        assertEquals(List.of("r1", "r3"), back.getDerivationPath());
        assertEquals(List.of("TRANSITIVE"), back.getRulePath());
        assertEquals(Relation.Status.PROVISIONAL, back.getStatus());
        assertEquals(Relation.Provenance.INFERRED, back.getProvenance());
        assertEquals("nightly", back.getMetadata().get("batch"));
        assertEquals(r.getCreatedAt(), back.getCreatedAt());
    }
}
