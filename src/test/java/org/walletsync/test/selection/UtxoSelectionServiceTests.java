package org.walletsync.test.selection;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.data.wallet.DraftTransactionData;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.selection.ScriptType;
import org.walletsync.selection.SelectionOptions;
import org.walletsync.selection.SelectionResult;
import org.walletsync.selection.UtxoSelectionService;
import org.walletsync.selection.UtxoSelectionService.Recommendation;
import org.walletsync.test.common.Common;
import org.walletsync.test.common.WalletTestUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class UtxoSelectionServiceTests {

	private static final String WALLET_ID = "selection";

	private final UtxoSelectionService selectionService = new UtxoSelectionService();

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();

		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);

			WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(1), 0, "a1", 100_000L, 3, 800_000);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(2), 0, "a2", 50_000L, 0, null);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(3), 0, "a3", 80_000L, 3, 800_000);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(4), 0, "a4", 60_000L, 3, 800_000);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(5), 1, "a5", 70_000L, 3, 800_000);

			repository.getUtxoRepository().setFrozen(WALLET_ID, WalletTestUtils.txid(3), 0, true);
			repository.getUtxoRepository().markSpent(WALLET_ID, Collections.singletonList(UtxoData.buildKey(WalletTestUtils.txid(4), 0)));

			repository.getDraftRepository().save(new DraftTransactionData("draft-1", WALLET_ID, "Rent", "bc1qrecipient", 40_000L, 5.0,
					System.currentTimeMillis(), Collections.singletonList(UtxoData.buildKey(WalletTestUtils.txid(5), 1))));

			repository.saveChanges();
		}
	}

	@After
	public void afterTest() throws DataException {
		Common.tearDown();
	}

	private List<Long> availableAmounts(SelectionOptions options) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return this.selectionService.getAvailableUtxos(repository, WALLET_ID, options).stream()
					.map(UtxoData::getAmount)
					.collect(Collectors.toList());
		}
	}

	@Test
	public void testAvailableUtxos() throws DataException {
		// Frozen, spent and draft-locked UTXOs excluded
		Assert.assertEquals(Arrays.asList(100_000L, 50_000L), this.availableAmounts(SelectionOptions.defaults()));
	}

	@Test
	public void testAvailableUtxoOptions() throws DataException {
		Assert.assertEquals(Arrays.asList(100_000L, 80_000L, 50_000L), this.availableAmounts(SelectionOptions.defaults().includeFrozen(true)));
		Assert.assertEquals(Collections.singletonList(100_000L), this.availableAmounts(SelectionOptions.defaults().excludeUnconfirmed(true)));
		Assert.assertEquals(Collections.singletonList(50_000L),
				this.availableAmounts(SelectionOptions.defaults().excludeUtxoKeys(UtxoData.buildKey(WalletTestUtils.txid(1), 0))));
	}

	@Test
	public void testDraftDeletionReleasesLock() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getDraftRepository().delete(Collections.singletonList("draft-1"));
			repository.saveChanges();
		}

		Assert.assertEquals(Arrays.asList(100_000L, 70_000L, 50_000L), this.availableAmounts(SelectionOptions.defaults()));
	}

	@Test
	public void testSelectUtxos() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			SelectionResult result = this.selectionService.selectUtxos(repository, WALLET_ID, "efficiency", 30_000L, 1.0,
					ScriptType.NATIVE_SEGWIT, SelectionOptions.defaults());

			Assert.assertEquals(1, result.getSelected().size());
			Assert.assertEquals(WalletTestUtils.txid(1), result.getSelected().get(0).getTxid());
			Assert.assertEquals(147L, result.getEstimatedFee());
			Assert.assertEquals(69_853L, result.getChangeAmount());
		}
	}

	@Test
	public void testSelectWithNothingAvailable() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			SelectionResult result = this.selectionService.selectUtxos(repository, WALLET_ID, "privacy", 30_000L, 1.0,
					ScriptType.NATIVE_SEGWIT, SelectionOptions.defaults().excludeUtxoKeys(
							UtxoData.buildKey(WalletTestUtils.txid(1), 0), UtxoData.buildKey(WalletTestUtils.txid(2), 0)));

			Assert.assertTrue(result.getSelected().isEmpty());
			Assert.assertEquals(Collections.singletonList(SelectionResult.WARNING_NO_UTXOS), result.getWarnings());
		}
	}

	@Test
	public void testCompareStrategies() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			Map<String, SelectionResult> results = this.selectionService.compareStrategies(repository, WALLET_ID, 120_000L, 2.0, ScriptType.NATIVE_SEGWIT);

			Assert.assertEquals(Arrays.asList("privacy", "efficiency", "oldest_first", "largest_first", "smallest_first"),
					results.keySet().stream().collect(Collectors.toList()));

			for (Map.Entry<String, SelectionResult> entry : results.entrySet()) {
				Assert.assertEquals(entry.getKey(), entry.getValue().getStrategyId());
				Assert.assertEquals(150_000L, entry.getValue().getTotalSelected());
				Assert.assertTrue(entry.getValue().isSufficient());
			}
		}
	}

	@Test
	public void testRecommendedStrategy() {
		Recommendation recommendation = UtxoSelectionService.getRecommendedStrategy(10, 10.0, true);
		Assert.assertEquals("privacy", recommendation.getStrategyId());
		Assert.assertNotNull(recommendation.getReason());

		Assert.assertEquals("efficiency", UtxoSelectionService.getRecommendedStrategy(10, 60.0, false).getStrategyId());
		Assert.assertEquals("privacy", UtxoSelectionService.getRecommendedStrategy(100, 60.0, true).getStrategyId());
		Assert.assertEquals("smallest_first", UtxoSelectionService.getRecommendedStrategy(21, 2.0, false).getStrategyId());
		Assert.assertEquals("efficiency", UtxoSelectionService.getRecommendedStrategy(20, 2.0, false).getStrategyId());
		Assert.assertEquals("efficiency", UtxoSelectionService.getRecommendedStrategy(100, 5.0, false).getStrategyId());
		Assert.assertEquals("efficiency", UtxoSelectionService.getRecommendedStrategy(100, 10.0, false).getStrategyId());
	}

}
