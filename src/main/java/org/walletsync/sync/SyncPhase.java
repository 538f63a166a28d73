package org.walletsync.sync;

import org.walletsync.node.NodeClientException;
import org.walletsync.repository.DataException;

/**
 * One step of a wallet sync run.
 * <p>
 * Phases must be safe to re-run from the top: each is either idempotent or purely additive.
 */
public interface SyncPhase {

    /** Returns name used to select, skip and report this phase. */
    String getName();

    /**
     * Applies this phase to the sync run's context.
     *
     * @return context to hand to the next phase
     */
    SyncContext execute(SyncContext context) throws DataException, NodeClientException;

}
