package com.coach.linkage.error;

import com.coach.linkage.merge.MergeStep;

/**
 * Raised by {@link com.coach.linkage.merge.MergeTransaction} when a step fails.
 * Carries the failed step so the operator can judge whether cleanup is needed.
 */
public class MergeStepException extends LinkageException {

    private final MergeStep step;

    public MergeStepException(MergeStep step, Throwable cause) {
        super("Merge step '" + step.description() + "' failed: " + cause.getMessage(), cause);
        this.step = step;
    }

    public MergeStep getStep() {
        return step;
    }
}
