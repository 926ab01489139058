package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.e2eq.lexikon.graph.core.GraphFixtures.asserted;
import static org.junit.jupiter.api.Assertions.*;

public class RelationStoreMigratorTest {

    private InMemoryRelationStore graph;
    private InMemoryRelationStore relational;

    @BeforeEach
    public void setUp() {
        graph = GraphFixtures.store();
        graph.put(asserted("A", "is_a", "B", 1.0));
        graph.put(asserted("B", "is_a", "C", 0.8));
        graph.put(asserted("A", "related_to", "Z", 0.6));
        InferenceSettings settings = InferenceSettings.defaults();
        new InferenceOrchestrator(graph, new RuleEngine(graph.registry(), settings), settings)
                .infer("A", List.of(InferenceRule.TRANSITIVE), 2);
        relational = new InMemoryRelationStore(GraphFixtures.registry());
    }

    @Test
    public void migrationPreservesIdsDerivationsAndStatus() {
        MigrationReport report = new RelationStoreMigrator(2).migrate(graph, relational);

        assertTrue(report.completed());
        assertEquals(4, report.copied());
        assertEquals(4, report.sourceCount());
        assertEquals(4, report.targetCount());
        for (Relation r : graph.page(null, 100)) {
            Relation copy = relational.require(r.getId());
            assertEquals(r.getDerivationPath(), copy.getDerivationPath());
            assertEquals(r.getConfidence(), copy.getConfidence(), 1e-12);
            assertEquals(r.getStatus(), copy.getStatus());
            assertEquals(r.getProvenance(), copy.getProvenance());
        }
        Relation inferred = relational.findByStatus(Relation.Status.PROVISIONAL, 10).get(0);
        assertEquals(1, relational.findDerivedFrom(inferred.getDerivationPath().get(0)).size());
    }

    @Test
    public void rerunningMigrationIsIdempotent() {
        RelationStoreMigrator migrator = new RelationStoreMigrator(3);
        migrator.migrate(graph, relational);
        MigrationReport again = migrator.migrate(graph, relational);

        assertTrue(again.completed());
        assertEquals(4, relational.count());
    }

    @Test
    public void interruptedMigrationResumesFromCursor() {
        FlakyRelationStoreTestDouble target = new FlakyRelationStoreTestDouble(relational);
        RelationStoreMigrator migrator = new RelationStoreMigrator(2);

        target.failRestore(true);
        MigrationReport stopped = migrator.migrate(graph, target);
        assertFalse(stopped.completed());
        assertEquals(0, stopped.copied());
        assertNull(stopped.lastId());
        assertNotNull(stopped.error());

        target.failRestore(false);
        String cursor = graph.page(null, 2).get(1).getId();
        MigrationReport tail = migrator.migrate(graph, target, cursor);
        assertTrue(tail.completed());
        assertEquals(2, tail.copied());
        assertEquals(2, relational.count());

        MigrationReport rest = migrator.migrate(graph, target, stopped.lastId());
        assertEquals(4, rest.copied());
        assertEquals(4, relational.count());
    }

    @Test
    public void importMissingNeverOverwritesTargetRows() {
        Relation held = graph.page(null, 1).get(0);
        Relation older = held.copy();
        older.setConfidence(0.3);
        relational.restore(older);
        relational.put(asserted("B", "is_a", "C", 0.2));
        RelationStoreMigrator migrator = new RelationStoreMigrator(2);

        MigrationReport report = migrator.importMissing(graph, relational, null);

        assertTrue(report.completed());
        assertEquals(2, report.copied());
        assertEquals(2, report.skipped());
        assertEquals(4, relational.count());
        assertEquals(0.3, relational.require(held.getId()).getConfidence(), 1e-12);
        assertEquals(0.2, relational.find("B", "C", "is_a").orElseThrow().getConfidence(), 1e-12);

        MigrationReport again = migrator.importMissing(graph, relational, null);
        assertEquals(0, again.copied());
        assertEquals(4, again.skipped());
        assertEquals(4, relational.count());
    }
}
