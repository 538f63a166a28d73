package org.walletsync.utils;

import org.bitcoinj.core.Coin;

public abstract class Amounts {

	/** Returns satoshi amount as plain BTC string, e.g. 150000000 as "1.5". */
	public static String prettyAmount(long sats) {
		return Coin.valueOf(sats).toPlainString();
	}

	/** Returns satoshi amount as BTC string with currency suffix, e.g. "1.5 BTC". */
	public static String prettyAmountWithCode(long sats) {
		return prettyAmount(sats) + " BTC";
	}

	public static long sum(Iterable<Long> amounts) {
		long total = 0L;
		for (Long amount : amounts)
			if (amount != null)
				total = Math.addExact(total, amount);

		return total;
	}

}
