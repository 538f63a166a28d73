package org.walletsync.selection;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import java.util.Collections;
import java.util.List;

@XmlAccessorType(XmlAccessType.FIELD)
public class SelectionResult {

    public static final String WARNING_NO_UTXOS = "No available UTXOs";
    public static final String WARNING_INSUFFICIENT_FUNDS = "Insufficient funds for this amount";

    private String strategyId;
    private List<SelectedUtxo> selected;
    private long totalSelected;
    private long estimatedFee;
    private long changeAmount;
    private boolean sufficient;
    private List<String> warnings;
    private PrivacyImpact privacyImpact;

    protected SelectionResult() {
    }

    public SelectionResult(String strategyId, List<SelectedUtxo> selected, long totalSelected, long estimatedFee,
            long changeAmount, boolean sufficient, List<String> warnings, PrivacyImpact privacyImpact) {
        this.strategyId = strategyId;
        this.selected = Collections.unmodifiableList(selected);
        this.totalSelected = totalSelected;
        this.estimatedFee = estimatedFee;
        this.changeAmount = changeAmount;
        this.sufficient = sufficient;
        this.warnings = Collections.unmodifiableList(warnings);
        this.privacyImpact = privacyImpact;
    }

    public String getStrategyId() {
        return this.strategyId;
    }

    public List<SelectedUtxo> getSelected() {
        return this.selected;
    }

    public long getTotalSelected() {
        return this.totalSelected;
    }

    public long getEstimatedFee() {
        return this.estimatedFee;
    }

    public long getChangeAmount() {
        return this.changeAmount;
    }

    /** Returns whether selected amount covers target plus fee. */
    public boolean isSufficient() {
        return this.sufficient;
    }

    public List<String> getWarnings() {
        return this.warnings;
    }

    public PrivacyImpact getPrivacyImpact() {
        return this.privacyImpact;
    }
}
