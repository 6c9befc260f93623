package com.coach.linkage.merge;

import com.coach.linkage.error.MergeStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs the steps of a merge strictly in sequence and remembers how far it got.
 *
 * <p>A step only starts after the previous one returned. The first failure stops the
 * transaction and is rethrown as a {@link MergeStepException} naming the step. Completed
 * steps are not undone: the store is left as the completed steps wrote it, and the
 * caller reports the failed step so the operator can re-initiate the merge.</p>
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction("coach")) {
 *     tx.execute(MergeStep.RECONCILE_FIELDS, () -> updateKeeper(...));
 *     int moved = tx.execute(MergeStep.REPOINT_ATTENDANCE, () -> repoint(...));
 *     tx.execute(MergeStep.DELETE_LOSER, () -> deleteLoser(...));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final String recordKind;
    private final List<MergeStep> completedSteps = new ArrayList<>();
    private MergeStep failedStep;
    private boolean success = false;
    private boolean closed = false;

    public MergeTransaction(String recordKind) {
        this.recordKind = recordKind;
    }

    /**
     * Runs one step.
     *
     * @throws MergeStepException if the step throws
     * @throws IllegalStateException if the transaction is closed or a previous step failed
     */
    public void execute(MergeStep step, Runnable operation) {
        execute(step, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Runs one step and returns its result.
     */
    public <R> R execute(MergeStep step, Supplier<R> operation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        if (failedStep != null) {
            throw new IllegalStateException("Transaction already failed at step " + failedStep);
        }

        try {
            log.debug("Executing {} merge step: {}", recordKind, step.description());
            R result = operation.get();
            completedSteps.add(step);
            return result;
        } catch (RuntimeException e) {
            failedStep = step;
            log.warn("Merge step '{}' failed after {}: {}", step.description(), completedSteps, e.getMessage());
            throw new MergeStepException(step, e);
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<MergeStep> getCompletedSteps() {
        return List.copyOf(completedSteps);
    }

    public MergeStep getFailedStep() {
        return failedStep;
    }

    @Override
    public void close() {
        if (!closed && !success && !completedSteps.isEmpty()) {
            log.warn("{} merge left incomplete: completed={} failed={}", recordKind, completedSteps, failedStep);
        }
        closed = true;
    }
}
