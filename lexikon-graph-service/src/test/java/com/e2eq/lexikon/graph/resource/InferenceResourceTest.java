package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.core.CandidateRelation;
import com.e2eq.lexikon.graph.core.InferenceRule;
import com.e2eq.lexikon.graph.core.Relation;
import com.e2eq.lexikon.graph.resource.models.InferenceRequest;
import com.e2eq.lexikon.graph.runtime.GraphWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InferenceResourceTest {

    private GraphWiring graph;
    private InferenceResource resource;

    @BeforeEach
    public void setUp() {
        graph = GraphWiring.inMemory().withTaxonomy();
        resource = new InferenceResource();
        resource.orchestrator = graph.orchestrator;
    }

    @Test
    public void transitiveChainIsStoredAsProvisional() {
        List<CandidateRelation> out = resource.infer(InferenceRequest.builder()
                .sourceTermId("Cat").rules(List.of("transitive")).maxDepth(2).build());

        assertEquals(1, out.size());
        CandidateRelation c = out.get(0);
        assertEquals("Animal", c.targetId());
        assertEquals(0.9, c.confidence(), 1e-9);
        assertEquals(2, c.derivationPath().size());

        Relation stored = graph.store.require(c.relationId());
        assertEquals(Relation.Status.PROVISIONAL, stored.getStatus());
        assertEquals(Relation.Provenance.INFERRED, stored.getProvenance());
    }

    @Test
    public void missingDepthUsesConfiguredDefault() {
        List<CandidateRelation> out = resource.infer(InferenceRequest.builder().sourceTermId("Cat").build());

        assertEquals(1, out.size());
    }

    @Test
    public void badRequestsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> resource.infer(null));
        assertThrows(IllegalArgumentException.class,
                () -> resource.infer(InferenceRequest.builder().sourceTermId(" ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> resource.infer(InferenceRequest.builder().sourceTermId("Cat").rules(List.of("magic")).build()));
    }

    @Test
    public void ruleNamesAreParsed() {
        assertEquals(List.of(InferenceRule.TRANSITIVE, InferenceRule.INVERSE),
                InferenceResource.parseRules(List.of("Transitive", "inverse")));
        assertTrue(InferenceResource.parseRules(null).isEmpty());
    }
}
