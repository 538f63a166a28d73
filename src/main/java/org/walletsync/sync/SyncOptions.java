package org.walletsync.sync;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Optional phase filtering and progress callback for {@link SyncPipeline#run(String, java.util.List, SyncOptions)}.
 */
public class SyncOptions {

    @FunctionalInterface
    public interface PhaseCompletionListener {
        void onPhaseComplete(String phaseName, SyncContext context);
    }

    private Set<String> onlyPhases = Collections.emptySet();
    private Set<String> skipPhases = Collections.emptySet();
    private PhaseCompletionListener phaseCompletionListener;

    public static SyncOptions defaults() {
        return new SyncOptions();
    }

    /** Run only the named phases, keeping their pipeline order. */
    public SyncOptions onlyPhases(String... phaseNames) {
        this.onlyPhases = new HashSet<>(Arrays.asList(phaseNames));
        return this;
    }

    public SyncOptions skipPhases(String... phaseNames) {
        this.skipPhases = new HashSet<>(Arrays.asList(phaseNames));
        return this;
    }

    public SyncOptions onPhaseComplete(PhaseCompletionListener listener) {
        this.phaseCompletionListener = listener;
        return this;
    }

    public boolean isSelected(String phaseName) {
        if (!this.onlyPhases.isEmpty() && !this.onlyPhases.contains(phaseName))
            return false;

        return !this.skipPhases.contains(phaseName);
    }

    public PhaseCompletionListener getPhaseCompletionListener() {
        return this.phaseCompletionListener;
    }
}
