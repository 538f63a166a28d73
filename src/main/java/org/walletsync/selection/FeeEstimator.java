package org.walletsync.selection;

/**
 * Transaction fee estimates from virtual size.
 */
public abstract class FeeEstimator {

    /** Version, locktime, counts and segwit marker */
    public static final double TX_OVERHEAD_VBYTES = 10.5;
    public static final double OUTPUT_VBYTES = 34.0;
    /** Payment plus change */
    public static final int DEFAULT_OUTPUT_COUNT = 2;

    public static double estimateVBytes(int inputCount, int outputCount, ScriptType scriptType) {
        return TX_OVERHEAD_VBYTES + inputCount * scriptType.inputVBytes + outputCount * OUTPUT_VBYTES;
    }

    /**
     * Returns estimated fee in satoshis, rounded up.
     *
     * @param feeRate sat/vB
     */
    public static long estimateFee(int inputCount, int outputCount, double feeRate, ScriptType scriptType) {
        return (long) Math.ceil(estimateVBytes(inputCount, outputCount, scriptType) * feeRate);
    }

    /** Returns estimated fee of a payment-plus-change transaction with <tt>inputCount</tt> inputs. */
    public static long estimateFee(int inputCount, double feeRate, ScriptType scriptType) {
        return estimateFee(inputCount, DEFAULT_OUTPUT_COUNT, feeRate, scriptType);
    }
}
