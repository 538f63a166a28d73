package org.walletsync.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sync phase failed. Carries the failing phase and the phases that had already completed,
 * whose writes stand.
 */
@SuppressWarnings("serial")
public class SyncPipelineException extends SyncException {

    private final String phase;
    private final List<String> completedPhases;

    public SyncPipelineException(String phase, List<String> completedPhases, Throwable cause) {
        super(String.format("Sync phase %s failed after [%s]: %s", phase, String.join(", ", completedPhases), cause.getMessage()), cause);

        this.phase = phase;
        this.completedPhases = Collections.unmodifiableList(new ArrayList<>(completedPhases));
    }

    public String getPhase() {
        return this.phase;
    }

    public List<String> getCompletedPhases() {
        return this.completedPhases;
    }

}
