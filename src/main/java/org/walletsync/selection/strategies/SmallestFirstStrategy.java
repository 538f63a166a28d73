package org.walletsync.selection.strategies;

import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;
import org.walletsync.selection.SelectionContext;
import org.walletsync.selection.SelectionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Consolidation mode: spends smallest UTXOs first, at the cost of a bigger transaction.
 */
public class SmallestFirstStrategy extends AbstractSelectionStrategy {

    public static final String ID = "smallest_first";

    /** More inputs than this earns a fee warning. */
    public static final int MANY_INPUTS_THRESHOLD = 5;

    public SmallestFirstStrategy() {
        super(ID, "Smallest first", "Consolidates small UTXOs", "consolidation");
    }

    @Override
    protected Comparator<UtxoData> getOrdering() {
        return Comparator.comparingLong(UtxoData::getAmount);
    }

    @Override
    protected SelectionResult buildResult(SelectionContext context, List<UtxoData> selected, long total, List<String> warnings) {
        List<String> allWarnings = new ArrayList<>(warnings);

        if (selected.size() > MANY_INPUTS_THRESHOLD)
            allWarnings.add(String.format("Using %d small UTXOs increases transaction size and fee", selected.size()));

        return super.buildResult(context, selected, total, allWarnings);
    }

}
