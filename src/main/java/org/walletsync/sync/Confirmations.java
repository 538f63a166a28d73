package org.walletsync.sync;

public abstract class Confirmations {

    /**
     * Returns confirmation count of something mined at <tt>height</tt>.
     *
     * @param currentHeight current chain tip height
     * @param height block height, or null / 0 if unconfirmed
     * @return confirmations, never negative, 0 if unconfirmed
     */
    public static int fromHeight(int currentHeight, Integer height) {
        if (height == null || height <= 0)
            return 0;

        return Math.max(0, currentHeight - height + 1);
    }

    /** Converts node-style height (0 = unconfirmed) into nullable block height. */
    public static Integer toBlockHeight(int height) {
        return height > 0 ? height : null;
    }

}
