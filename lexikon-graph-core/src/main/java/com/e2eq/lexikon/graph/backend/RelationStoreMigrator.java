package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.Relation;
import com.e2eq.lexikon.graph.core.RelationStore;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Copies every relation from one store to another with ids, derivation paths, status and confidence intact.
 * Uses {@link RelationStore#restore}, so re-running over already copied rows changes nothing, and a stopped
 * migration resumes from the cursor in its {@link MigrationReport}. The source keeps serving reads throughout.
 * {@link #importMissing} is the rollback direction: it only adds rows the target does not hold yet.
 */
public class RelationStoreMigrator {
    private static final Logger LOG = Logger.getLogger(RelationStoreMigrator.class);

    private final int pageSize;

    public RelationStoreMigrator(int pageSize) {
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be positive");
        this.pageSize = pageSize;
    }

    public MigrationReport migrate(RelationStore from, RelationStore to) {
        return migrate(from, to, null);
    }

    public MigrationReport migrate(RelationStore from, RelationStore to, String afterId) {
        return copy(from, to, afterId, false);
    }

    /**
     * Copies the relations of {@code from} that {@code to} holds neither by id nor by key. Rows already in the
     * target are never overwritten, so re-running it is a no-op.
     */
    public MigrationReport importMissing(RelationStore from, RelationStore to, String afterId) {
        return copy(from, to, afterId, true);
    }

    private MigrationReport copy(RelationStore from, RelationStore to, String afterId, boolean keepExisting) {
        String cursor = afterId;
        long copied = 0;
        long skipped = 0;
        try {
            while (true) {
                List<Relation> page = from.page(cursor, pageSize);
                if (page.isEmpty()) break;
                for (Relation r : page) {
                    if (keepExisting && held(to, r)) {
                        skipped++;
                    } else {
                        to.restore(r);
                        copied++;
                    }
                    cursor = r.getId();
                }
                LOG.debugf("migrated %d relation(s), skipped %d, cursor %s", copied, skipped, cursor);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "migration stopped after %d relation(s) at cursor %s", copied, cursor);
            return new MigrationReport(copied, skipped, cursor, false, from.count(), -1L, e.getMessage());
        }
        long sourceCount = from.count();
        long targetCount = to.count();
        LOG.infof("migration complete: %d relation(s) copied, %d skipped, source %d, target %d",
                copied, skipped, sourceCount, targetCount);
        return new MigrationReport(copied, skipped, cursor, true, sourceCount, targetCount, null);
    }

    private static boolean held(RelationStore store, Relation r) {
        return store.get(r.getId()).isPresent()
                || store.find(r.getSourceId(), r.getTargetId(), r.getRelationType()).isPresent();
    }
}
