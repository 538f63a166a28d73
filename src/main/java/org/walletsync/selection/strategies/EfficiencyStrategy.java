package org.walletsync.selection.strategies;

import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;

import java.util.Comparator;

/**
 * Spends largest UTXOs first, keeping the input count and so the fee as low as possible.
 */
public class EfficiencyStrategy extends AbstractSelectionStrategy {

    public static final String ID = "efficiency";

    public EfficiencyStrategy() {
        super(ID, "Efficiency", "Minimizes fees by using as few inputs as possible", "fees", "default");
    }

    @Override
    protected Comparator<UtxoData> getOrdering() {
        return byAmountDescending();
    }

}
