package org.walletsync.selection.strategies;

import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;

import java.util.Comparator;

/**
 * Spends most-confirmed UTXOs first, reducing the age of the wallet's UTXO set.
 */
public class OldestFirstStrategy extends AbstractSelectionStrategy {

    public static final String ID = "oldest_first";

    public OldestFirstStrategy() {
        super(ID, "Oldest first", "Uses the oldest UTXOs first", "age");
    }

    @Override
    protected Comparator<UtxoData> getOrdering() {
        return Comparator.comparingInt(UtxoData::getConfirmations).reversed();
    }

}
