package com.gridcalc.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one mutating call on the engine.
 *
 * An accepted result lists every recomputed coordinate in the order it was
 * evaluated (a topological order of the affected closure) and the cells whose
 * evaluation raised an advisory outcome. A rejected result carries the
 * {@link EngineError} and no affected cells.
 */
public record CommitResult(long epoch, Coordinate target, EngineError error,
        List<Coordinate> affected, Map<Coordinate, EvalOutcome> issues) {

    public CommitResult {
        affected = List.copyOf(affected);
        issues = Collections.unmodifiableMap(new LinkedHashMap<>(issues));
    }

    public static CommitResult accepted(long epoch, Coordinate target, List<Coordinate> affected,
            Map<Coordinate, EvalOutcome> issues) {
        return new CommitResult(epoch, target, null, affected, issues);
    }

    public static CommitResult rejected(long epoch, Coordinate target, EngineError error) {
        return new CommitResult(epoch, target, error, List.of(), Map.of());
    }

    public boolean isAccepted() {
        return error == null;
    }

    public CommitStatus status() {
        return error == null ? CommitStatus.OK : error.status();
    }

    /** Advisory outcome for a recomputed cell, {@link EvalOutcome#OK} when none was raised. */
    public EvalOutcome outcome(Coordinate c) {
        return issues.getOrDefault(c, EvalOutcome.OK);
    }
}
