package org.janelia.spatialnorm.normalization;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Progress of the retry loop. The attempt counter is 1-based and the state cannot change once an attempt succeeded.
 */
class RetryState {

    private final String referenceImage;
    private final List<Path> failureLogs = new ArrayList<>();
    private int attempt = 1;
    private boolean succeeded;

    RetryState(String referenceImage) {
        this.referenceImage = referenceImage;
    }

    int getAttempt() {
        return attempt;
    }

    String getReferenceImage() {
        return referenceImage;
    }

    List<Path> getFailureLogs() {
        return ImmutableList.copyOf(failureLogs);
    }

    int getFailedAttempts() {
        return attempt - 1;
    }

    void recordFailure(RegistrationAttemptResult.Failure failure) {
        Preconditions.checkState(!succeeded, "Registration already succeeded");
        Preconditions.checkArgument(failure.getAttempt() == attempt, "Unexpected attempt %s - current attempt is %s", failure.getAttempt(), attempt);
        failureLogs.addAll(failure.getDiagnostics());
        attempt++;
    }

    void recordSuccess(RegistrationAttemptResult.Success success) {
        Preconditions.checkState(!succeeded, "Registration already succeeded");
        Preconditions.checkArgument(success.getAttempt() == attempt, "Unexpected attempt %s - current attempt is %s", success.getAttempt(), attempt);
        succeeded = true;
    }
}
