package org.walletsync.test.sync;

import org.junit.Assert;
import org.junit.Test;
import org.walletsync.sync.TransactionCache;
import org.walletsync.test.common.WalletTestUtils;

public class TransactionCacheTests {

	@Test
	public void testCacheClearedAtLimit() {
		TransactionCache cache = new TransactionCache(3);

		for (int i = 0; i < 3; ++i)
			cache.addTransaction(WalletTestUtils.incomingTransaction(WalletTestUtils.txid(i), 800_000, WalletTestUtils.address(0), 1000L));

		Assert.assertEquals(3, cache.size());
		Assert.assertTrue(cache.getTransactionByHash(WalletTestUtils.txid(0)).isPresent());
		Assert.assertFalse(cache.getTransactionByHash(WalletTestUtils.txid(3)).isPresent());

		cache.addTransaction(WalletTestUtils.incomingTransaction(WalletTestUtils.txid(3), 800_000, WalletTestUtils.address(0), 1000L));

		Assert.assertEquals(1, cache.size());
		Assert.assertFalse(cache.getTransactionByHash(WalletTestUtils.txid(0)).isPresent());
		Assert.assertEquals(WalletTestUtils.txid(3), cache.getTransactionByHash(WalletTestUtils.txid(3)).get().getTxid());
	}

}
