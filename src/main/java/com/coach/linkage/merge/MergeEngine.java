package com.coach.linkage.merge;

import com.coach.linkage.core.model.LinkableRecord;
import com.coach.linkage.error.ConstraintViolationException;
import com.coach.linkage.error.LinkageException;
import com.coach.linkage.error.MergeStepException;
import com.coach.linkage.error.RecordNotFoundException;
import com.coach.linkage.error.ValidationException;
import com.coach.linkage.logging.LogContext;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges a loser record into a keeper record.
 *
 * <p>Merge process, each step starting only after the previous one committed:</p>
 * <ol>
 *   <li>Field reconciliation: empty keeper fields take the loser's values, in one update.</li>
 *   <li>Dependent repoint: rows referencing the loser are pointed at the keeper.</li>
 *   <li>Loser deletion.</li>
 * </ol>
 *
 * <p>A loser or keeper that no longer exists yields {@link MergeStatus#ALREADY_RESOLVED}
 * without touching the keeper. Any other failure yields {@link MergeStatus#FAILED} with the
 * failed step and the store's message; nothing is retried.</p>
 */
public abstract class MergeEngine<T extends LinkableRecord> {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final String recordKind;
    private final MetricsService metricsService;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    protected MergeEngine(String recordKind, MetricsService metricsService) {
        this.recordKind = recordKind;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    protected abstract Optional<T> load(String id);

    /**
     * @throws ValidationException if the two records must not be merged
     */
    protected abstract void requireMergeable(T keeper, T loser);

    protected abstract FieldReconciliation<T> reconcile(T keeper, T loser);

    protected abstract void applyUpdates(String keeperId, Map<String, Object> updates);

    protected abstract MergeStep dependentStep();

    protected abstract DependentMove moveDependents(String keeperId, String loserId);

    protected abstract void deleteLoser(String loserId);

    protected abstract String dependentLabel(int count);

    /**
     * Merges {@code loserId} into {@code keeperId}.
     *
     * @throws ValidationException if the ids are missing or equal, or the records cannot be merged
     */
    public MergeResult<T> merge(String keeperId, String loserId) {
        if (keeperId == null || loserId == null) {
            throw new ValidationException("Both keeper and loser ids are required");
        }
        if (keeperId.equals(loserId)) {
            throw new ValidationException("A record cannot be merged into itself: " + keeperId);
        }

        try (LogContext logCtx = LogContext.forMerge(
                LogContext.generateCorrelationId(), recordKind, keeperId, loserId)) {
            log.info("merge.starting recordKind={} keeperId={} loserId={}", recordKind, keeperId, loserId);
            MergeResult<T> result = doMerge(keeperId, loserId);
            metricsService.incrementMerge(recordKind, result.status());
            if (result.isSuccess()) {
                notifyMergeListeners(keeperId, loserId);
            }
            return result;
        }
    }

    private MergeResult<T> doMerge(String keeperId, String loserId) {
        Optional<T> keeperOpt;
        Optional<T> loserOpt;
        try {
            loserOpt = load(loserId);
            keeperOpt = load(keeperId);
        } catch (LinkageException e) {
            log.error("merge.failed step={} error={}", MergeStep.LOAD_RECORDS, e.getMessage());
            return MergeResult.failed(keeperId, loserId, MergeStep.LOAD_RECORDS, e.getMessage());
        }

        if (loserOpt.isEmpty()) {
            log.info("merge.already-resolved loserId={} reason=loser-missing", loserId);
            return MergeResult.alreadyResolved(keeperId, loserId,
                    "Duplicate " + loserId + " no longer exists; already resolved");
        }
        if (keeperOpt.isEmpty()) {
            log.info("merge.already-resolved keeperId={} reason=keeper-missing", keeperId);
            return MergeResult.alreadyResolved(keeperId, loserId,
                    "Keeper " + keeperId + " no longer exists; already resolved");
        }

        T keeper = keeperOpt.get();
        T loser = loserOpt.get();
        requireMergeable(keeper, loser);
        FieldReconciliation<T> reconciliation = reconcile(keeper, loser);

        try (MergeTransaction tx = new MergeTransaction(recordKind)) {
            tx.execute(MergeStep.RECONCILE_FIELDS, () -> {
                if (reconciliation.hasUpdates()) {
                    applyUpdates(keeperId, reconciliation.updates());
                }
            });
            DependentMove move = tx.execute(dependentStep(), () -> moveDependents(keeperId, loserId));
            tx.execute(MergeStep.DELETE_LOSER, () -> deleteLoser(loserId));
            tx.markSuccess();

            String message = summarize(keeper, loser, reconciliation.mergedFields(), move);
            log.info("merge.completed keeperId={} loserId={} mergedFields={} moved={} dropped={}",
                    keeperId, loserId, reconciliation.mergedFields(), move.moved(), move.dropped());
            return MergeResult.merged(reconciliation.updatedKeeper(), loserId,
                    reconciliation.mergedFields(), move, message);
        } catch (MergeStepException e) {
            return stepFailed(keeperId, loserId, e);
        }
    }

    private MergeResult<T> stepFailed(String keeperId, String loserId, MergeStepException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RecordNotFoundException notFound
                && (e.getStep() == MergeStep.DELETE_LOSER || e.getStep() == MergeStep.RECONCILE_FIELDS)) {
            log.info("merge.already-resolved step={} missingId={}", e.getStep(), notFound.getRecordId());
            return MergeResult.alreadyResolved(keeperId, loserId,
                    "Record " + notFound.getRecordId() + " no longer exists; already resolved");
        }
        String message;
        if (cause instanceof ConstraintViolationException violation) {
            message = "Constraint " + violation.getConstraint() + " violated during "
                    + e.getStep().description() + ": " + violation.getMessage();
        } else {
            message = "Merge failed during " + e.getStep().description() + ": "
                    + (cause != null ? cause.getMessage() : e.getMessage());
        }
        log.error("merge.failed step={} keeperId={} loserId={} error={}", e.getStep(), keeperId, loserId, message);
        return MergeResult.failed(keeperId, loserId, e.getStep(), message);
    }

    private String summarize(T keeper, T loser, List<String> mergedFields, DependentMove move) {
        StringBuilder message = new StringBuilder()
                .append("Merged \"").append(loser.displayName())
                .append("\" into \"").append(keeper.displayName()).append('"');
        if (move.moved() > 0) {
            message.append(" (").append(dependentLabel(move.moved())).append(" reassigned)");
        }
        if (move.dropped() > 0) {
            message.append(" (").append(move.dropped()).append(" redundant removed)");
        }
        if (!mergedFields.isEmpty()) {
            message.append("; added ").append(String.join(", ", mergedFields));
        }
        return message.toString();
    }

    public String getRecordKind() {
        return recordKind;
    }

    /**
     * Adds a listener notified after successful merges.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private void notifyMergeListeners(String keeperId, String loserId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(recordKind, keeperId, loserId);
            } catch (Exception e) {
                log.warn("Merge listener notification failed: {}", e.getMessage());
            }
        }
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static void requireSame(Object a, Object b, String message) {
        if (!Objects.equals(a, b)) {
            throw new ValidationException(message);
        }
    }
}
