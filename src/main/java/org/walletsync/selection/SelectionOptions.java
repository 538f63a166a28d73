package org.walletsync.selection;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Filters applied to a wallet's UTXOs before selection.
 */
public class SelectionOptions {

    private boolean includeFrozen = false;
    private boolean excludeUnconfirmed = false;
    private final Set<String> excludedUtxoKeys = new HashSet<>();

    public static SelectionOptions defaults() {
        return new SelectionOptions();
    }

    public SelectionOptions includeFrozen(boolean includeFrozen) {
        this.includeFrozen = includeFrozen;
        return this;
    }

    public SelectionOptions excludeUnconfirmed(boolean excludeUnconfirmed) {
        this.excludeUnconfirmed = excludeUnconfirmed;
        return this;
    }

    /** Excludes UTXOs by <tt>txid:vout</tt> key. */
    public SelectionOptions excludeUtxoKeys(String... utxoKeys) {
        Collections.addAll(this.excludedUtxoKeys, utxoKeys);
        return this;
    }

    public boolean isIncludeFrozen() {
        return this.includeFrozen;
    }

    public boolean isExcludeUnconfirmed() {
        return this.excludeUnconfirmed;
    }

    public Set<String> getExcludedUtxoKeys() {
        return Collections.unmodifiableSet(this.excludedUtxoKeys);
    }

}
