package org.walletsync.selection;

import com.google.common.collect.ImmutableSet;
import com.google.common.math.LongMath;
import org.walletsync.data.wallet.UtxoData;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Greedy coin selection over a strategy-specific ordering.
 * <p>
 * Inputs are taken in order until the selected amount covers the target plus the fee
 * for the inputs selected so far. The fee is re-estimated on every step as it grows
 * with the input count.
 */
public abstract class AbstractSelectionStrategy implements SelectionStrategy {

    private final String id;
    private final String name;
    private final String description;
    private final Set<String> tags;

    protected AbstractSelectionStrategy(String id, String name, String description, String... tags) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.tags = ImmutableSet.copyOf(tags);
    }

    @Override
    public String getId() {
        return this.id;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public String getDescription() {
        return this.description;
    }

    @Override
    public Set<String> getTags() {
        return this.tags;
    }

    @Override
    public SelectionResult select(SelectionContext context) {
        if (context.getUtxos().isEmpty())
            return emptyResult();

        List<UtxoData> ordered = new ArrayList<>(context.getUtxos());
        ordered.sort(getOrdering());

        List<UtxoData> selected = new ArrayList<>();
        long total = accumulate(context, ordered, selected, 0L);

        return buildResult(context, selected, total, new ArrayList<>());
    }

    /** Returns candidate ordering, first candidate is spent first. */
    protected abstract Comparator<UtxoData> getOrdering();

    /**
     * Appends candidates to <tt>selected</tt> until <tt>total</tt> covers target plus fee.
     *
     * @return new selected total
     */
    protected static long accumulate(SelectionContext context, List<UtxoData> candidates, List<UtxoData> selected, long total) {
        for (UtxoData utxo : candidates) {
            if (total >= context.requiredAmount(selected.size() + 1))
                break;

            selected.add(utxo);
            total = LongMath.saturatedAdd(total, utxo.getAmount());
        }

        return total;
    }

    /**
     * Builds result for final selection. Adds the insufficient funds warning
     * ahead of any strategy-specific <tt>warnings</tt>.
     */
    protected SelectionResult buildResult(SelectionContext context, List<UtxoData> selected, long total, List<String> warnings) {
        long fee = context.estimateFee(selected.size());
        long required = context.requiredAmount(selected.size());
        boolean sufficient = total >= required;
        long change = sufficient ? total - required : 0L;

        List<String> allWarnings = new ArrayList<>();
        if (!sufficient)
            allWarnings.add(SelectionResult.WARNING_INSUFFICIENT_FUNDS);
        allWarnings.addAll(warnings);

        List<SelectedUtxo> selectedUtxos = selected.stream().map(SelectedUtxo::fromUtxo).collect(Collectors.toList());

        return new SelectionResult(this.id, selectedUtxos, total, fee, change, sufficient, allWarnings,
                PrivacyImpact.fromLinkedAddresses(countAddresses(selected)));
    }

    protected SelectionResult emptyResult() {
        List<String> warnings = new ArrayList<>();
        warnings.add(SelectionResult.WARNING_NO_UTXOS);

        return new SelectionResult(this.id, new ArrayList<>(), 0L, 0L, 0L, false, warnings, null);
    }

    protected static int countAddresses(Collection<UtxoData> utxos) {
        Set<String> addresses = new HashSet<>();
        for (UtxoData utxo : utxos)
            addresses.add(utxo.getAddress());

        return addresses.size();
    }

    protected static Comparator<UtxoData> byAmountDescending() {
        return Comparator.comparingLong(UtxoData::getAmount).reversed();
    }

}
