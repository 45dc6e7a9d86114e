package com.companyintel.research.task;

import com.companyintel.research.model.ErrorKind;
import com.companyintel.research.model.Finding;
import com.companyintel.research.model.WorkerError;
import org.springframework.lang.Nullable;

/**
 * Either a finding or a typed failure, never both.
 */
public record TaskOutcome(@Nullable Finding finding, @Nullable WorkerError failure) {

    public TaskOutcome {
        if ((finding == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of finding or failure must be set.");
        }
    }

    public static TaskOutcome success(Finding finding) {
        return new TaskOutcome(finding, null);
    }

    public static TaskOutcome failure(ErrorKind kind, String message) {
        return new TaskOutcome(null, WorkerError.of(kind, message));
    }

    public boolean succeeded() {
        return finding != null;
    }
}
