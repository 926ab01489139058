package com.e2eq.lexikon.graph.core;

/**
 * Outcome of an insert-or-merge.
 *
 * @param id id of the stored relation; for MERGED and SKIPPED this is the pre-existing row
 */
public record PutResult(String id, Outcome outcome) {

    public enum Outcome {
        /** A new row was written. */
        CREATED,
        /** An existing row with the same key absorbed the incoming relation. */
        MERGED,
        /** An inferred relation matched an existing confirmed row and was dropped. */
        SKIPPED
    }

    public static PutResult created(String id) { return new PutResult(id, Outcome.CREATED); }
    public static PutResult merged(String id) { return new PutResult(id, Outcome.MERGED); }
    public static PutResult skipped(String id) { return new PutResult(id, Outcome.SKIPPED); }

    public boolean isCreated() { return outcome == Outcome.CREATED; }
    public boolean isSkipped() { return outcome == Outcome.SKIPPED; }
}
