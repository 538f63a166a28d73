package org.walletsync.selection.strategies;

import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;

import java.util.Comparator;

public class LargestFirstStrategy extends AbstractSelectionStrategy {

    public static final String ID = "largest_first";

    public LargestFirstStrategy() {
        super(ID, "Largest first", "Uses the largest UTXOs first", "fees");
    }

    @Override
    protected Comparator<UtxoData> getOrdering() {
        return byAmountDescending();
    }

}
