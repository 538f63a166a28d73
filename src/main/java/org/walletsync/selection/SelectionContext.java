package org.walletsync.selection;

import com.google.common.math.LongMath;
import org.bitcoinj.core.NetworkParameters;
import org.walletsync.data.wallet.UtxoData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of one coin selection: candidate UTXOs, amount to fund and fee parameters.
 */
public class SelectionContext {

    private final List<UtxoData> utxos;
    private final long targetAmount;
    /** sat/vB */
    private final double feeRate;
    private final ScriptType scriptType;

    public SelectionContext(List<UtxoData> utxos, long targetAmount, double feeRate, ScriptType scriptType) {
        if (targetAmount < 0)
            throw new IllegalArgumentException("Target amount can't be negative");

        if (targetAmount > NetworkParameters.MAX_MONEY.value)
            throw new IllegalArgumentException("Target amount can't exceed total money supply");

        if (!Double.isFinite(feeRate))
            throw new IllegalArgumentException("Fee rate must be a finite number");

        if (feeRate < 0)
            throw new IllegalArgumentException("Fee rate can't be negative");

        this.utxos = Collections.unmodifiableList(new ArrayList<>(utxos));
        this.targetAmount = targetAmount;
        this.feeRate = feeRate;
        this.scriptType = scriptType != null ? scriptType : ScriptType.NATIVE_SEGWIT;
    }

    public List<UtxoData> getUtxos() {
        return this.utxos;
    }

    public long getTargetAmount() {
        return this.targetAmount;
    }

    public double getFeeRate() {
        return this.feeRate;
    }

    public ScriptType getScriptType() {
        return this.scriptType;
    }

    /** Returns estimated fee when spending <tt>inputCount</tt> inputs. */
    public long estimateFee(int inputCount) {
        return FeeEstimator.estimateFee(inputCount, this.feeRate, this.scriptType);
    }

    /** Returns target plus estimated fee for <tt>inputCount</tt> inputs, saturating at <tt>Long.MAX_VALUE</tt>. */
    public long requiredAmount(int inputCount) {
        return LongMath.saturatedAdd(this.targetAmount, this.estimateFee(inputCount));
    }
}
