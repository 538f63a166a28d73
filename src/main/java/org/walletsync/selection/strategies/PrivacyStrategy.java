package org.walletsync.selection.strategies;

import com.google.common.math.LongMath;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;
import org.walletsync.selection.SelectionContext;
import org.walletsync.selection.SelectionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimizes address linkage.
 * <p>
 * Outputs of the same funding transaction are already linked on chain, so if one such group
 * covers the payment it is spent as a whole. Otherwise UTXOs on addresses already being spent
 * from are preferred, then larger amounts.
 */
public class PrivacyStrategy extends AbstractSelectionStrategy {

    public static final String ID = "privacy";

    public PrivacyStrategy() {
        super(ID, "Privacy", "Minimizes linking of addresses", "privacy");
    }

    @Override
    protected Comparator<UtxoData> getOrdering() {
        return byAmountDescending();
    }

    @Override
    public SelectionResult select(SelectionContext context) {
        if (context.getUtxos().isEmpty())
            return emptyResult();

        // Group by funding transaction, keeping candidate order within each group
        Map<String, List<UtxoData>> byTxid = new LinkedHashMap<>();
        for (UtxoData utxo : context.getUtxos())
            byTxid.computeIfAbsent(utxo.getTxid(), txid -> new ArrayList<>()).add(utxo);

        List<List<UtxoData>> groups = new ArrayList<>(byTxid.values());
        groups.sort(Comparator.comparingLong(PrivacyStrategy::groupTotal).reversed());

        List<UtxoData> selected = new ArrayList<>();
        Set<String> addressesSeen = new HashSet<>();
        long total = 0L;

        for (List<UtxoData> group : groups) {
            long groupTotal = groupTotal(group);

            if (groupTotal >= context.requiredAmount(group.size())) {
                selected.addAll(group);
                total = groupTotal;
                break;
            }
        }

        if (selected.isEmpty()) {
            // No single transaction will do, so some linkage is unavoidable
            List<UtxoData> remaining = new ArrayList<>(context.getUtxos());
            remaining.sort(byAmountDescending());

            while (!remaining.isEmpty()
                    && total < context.requiredAmount(selected.size() + 1)) {
                UtxoData next = takePreferred(remaining, addressesSeen);
                selected.add(next);
                addressesSeen.add(next.getAddress());
                total = LongMath.saturatedAdd(total, next.getAmount());
            }
        }

        List<String> warnings = new ArrayList<>();
        // Outputs of a single funding transaction are linked already
        if (addressesSeen.size() > 1)
            warnings.add(String.format("Spending from %d different addresses links them together", addressesSeen.size()));

        return buildResult(context, selected, total, warnings);
    }

    /** Removes and returns largest remaining UTXO on an address already spent from, else largest remaining. */
    private static UtxoData takePreferred(List<UtxoData> remaining, Set<String> addressesSeen) {
        for (int i = 0; i < remaining.size(); ++i)
            if (addressesSeen.contains(remaining.get(i).getAddress()))
                return remaining.remove(i);

        return remaining.remove(0);
    }

    private static long groupTotal(List<UtxoData> group) {
        long total = 0L;
        for (UtxoData utxo : group)
            total = LongMath.saturatedAdd(total, utxo.getAmount());

        return total;
    }

}
