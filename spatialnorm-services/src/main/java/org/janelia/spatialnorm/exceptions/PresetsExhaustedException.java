package org.janelia.spatialnorm.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.janelia.spatialnorm.common.ComputationException;

/**
 * Every registration preset has been tried and none succeeded.
 */
public class PresetsExhaustedException extends ComputationException {

    private final int attempts;
    private final List<String> failureLogs;

    public PresetsExhaustedException(int attempts, List<String> failureLogs) {
        super(String.format("Robust spatial normalization failed after %d retries.", attempts));
        this.attempts = attempts;
        this.failureLogs = ImmutableList.copyOf(failureLogs);
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return the diagnostic files saved for the failed attempts
     */
    public List<String> getFailureLogs() {
        return failureLogs;
    }
}
