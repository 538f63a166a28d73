package org.walletsync.test.sync;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.data.wallet.DraftTransactionData;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.sync.SyncException;
import org.walletsync.sync.SyncPhase;
import org.walletsync.sync.SyncPipeline;
import org.walletsync.sync.SyncResult;
import org.walletsync.sync.phases.FetchUtxosPhase;
import org.walletsync.sync.phases.ReconcileUtxosPhase;
import org.walletsync.test.common.Common;
import org.walletsync.test.common.FakeNodeClient;
import org.walletsync.test.common.WalletTestUtils;
import org.walletsync.test.common.WalletTestUtils.LogCollector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ReconcileUtxosTests {

	private static final String WALLET_ID = "reconcile";
	private static final int HEIGHT = 800_005;

	private final LogCollector logCollector = new LogCollector();
	private FakeNodeClient nodeClient;
	private SyncPipeline syncPipeline;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
		Common.addListener(this.logCollector);

		this.nodeClient = new FakeNodeClient(HEIGHT);
		this.syncPipeline = new SyncPipeline(this.nodeClient);

		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);
			WalletTestUtils.createAddresses(repository, WALLET_ID, 3);
		}
	}

	@After
	public void afterTest() throws DataException {
		Common.tearDown();
	}

	private SyncResult reconcile() throws SyncException {
		List<SyncPhase> phases = Arrays.asList(new FetchUtxosPhase(), new ReconcileUtxosPhase());
		return this.syncPipeline.run(WALLET_ID, phases);
	}

	private UtxoData storeUtxo(int txNumber, int addressIndex, long amount, int confirmations, Integer blockHeight) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return WalletTestUtils.storeUtxo(repository, WALLET_ID, WalletTestUtils.txid(txNumber), 0,
					WalletTestUtils.address(addressIndex), amount, confirmations, blockHeight);
		}
	}

	private UtxoData fetchUtxo(int txNumber) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getUtxoRepository().fromKey(WALLET_ID, WalletTestUtils.txid(txNumber), 0);
		}
	}

	private void saveDraft(String draftId, String label, UtxoData... lockedUtxos) throws DataException {
		List<String> keys = new ArrayList<>();
		for (UtxoData utxo : lockedUtxos)
			keys.add(utxo.getKey());

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getDraftRepository().save(new DraftTransactionData(draftId, WALLET_ID, label, "bc1qrecipient", 10_000L, 3.0,
					System.currentTimeMillis(), keys));
			repository.saveChanges();
		}
	}

	@Test
	public void testStaleConfirmationsUpdated() throws DataException, SyncException {
		// Stored when chain tip was 800002
		this.storeUtxo(1, 0, 150_000_000L, 3, 800_000);
		this.nodeClient.addUtxo(WalletTestUtils.address(0), WalletTestUtils.txid(1), 0, 800_000, 150_000_000L);

		SyncResult result = this.reconcile();

		UtxoData utxo = this.fetchUtxo(1);
		Assert.assertEquals(6, utxo.getConfirmations());
		Assert.assertEquals(Integer.valueOf(800_000), utxo.getBlockHeight());
		Assert.assertEquals(150_000_000L, utxo.getAmount());
		Assert.assertFalse(utxo.isSpent());

		Assert.assertEquals(1, result.getStats().getUtxosUpdated());
		Assert.assertEquals(0, result.getStats().getUtxosMarkedSpent());
	}

	@Test
	public void testNewlyConfirmedUtxo() throws DataException, SyncException {
		this.storeUtxo(1, 0, 20_000L, 0, null);
		this.nodeClient.addUtxo(WalletTestUtils.address(0), WalletTestUtils.txid(1), 0, HEIGHT, 20_000L);

		this.reconcile();

		UtxoData utxo = this.fetchUtxo(1);
		Assert.assertEquals(1, utxo.getConfirmations());
		Assert.assertEquals(Integer.valueOf(HEIGHT), utxo.getBlockHeight());
	}

	@Test
	public void testVanishedUtxoMarkedSpent() throws DataException, SyncException {
		this.storeUtxo(1, 0, 50_000L, 10, 799_996);
		this.storeUtxo(2, 1, 60_000L, 10, 799_996);
		this.nodeClient.addUtxo(WalletTestUtils.address(1), WalletTestUtils.txid(2), 0, 799_996, 60_000L);

		SyncResult result = this.reconcile();

		Assert.assertTrue(this.fetchUtxo(1).isSpent());
		Assert.assertFalse(this.fetchUtxo(2).isSpent());
		Assert.assertEquals(1, result.getStats().getUtxosMarkedSpent());
		Assert.assertTrue(this.logCollector.getMessages(Category.UTXO).contains("Marked 1 UTXO(s) as spent"));

		// Spent UTXOs stay spent and aren't counted again
		SyncResult again = this.reconcile();
		Assert.assertEquals(0, again.getStats().getUtxosMarkedSpent());
	}

	@Test
	public void testFailedAddressLeftUntouched() throws DataException, SyncException {
		this.storeUtxo(1, 0, 50_000L, 10, 799_996);
		this.storeUtxo(2, 1, 60_000L, 10, 799_996);

		// Neither UTXO is reported, but address 1 can't be queried
		this.nodeClient.failAddress(WalletTestUtils.address(1));

		SyncResult result = this.reconcile();

		Assert.assertTrue(this.fetchUtxo(1).isSpent());
		Assert.assertFalse(this.fetchUtxo(2).isSpent());
		Assert.assertEquals(1, result.getStats().getUtxosMarkedSpent());

		// Batch failed, then every address was queried on its own
		Assert.assertEquals(1, this.nodeClient.utxoBatchCalls.get());
		Assert.assertEquals(3, this.nodeClient.utxoSingleCalls.get());

		Assert.assertTrue(this.logCollector.getMessages(Category.UTXO)
				.contains("Unable to fetch UTXOs for 1 address(es), leaving their UTXOs untouched"));
	}

	@Test
	public void testAllQueriesFailing() throws DataException, SyncException {
		this.storeUtxo(1, 0, 50_000L, 10, 799_996);
		for (int i = 0; i < 3; ++i)
			this.nodeClient.failAddress(WalletTestUtils.address(i));

		SyncResult result = this.reconcile();

		Assert.assertFalse(this.fetchUtxo(1).isSpent());
		Assert.assertEquals(0, result.getStats().getUtxosMarkedSpent());
	}

	@Test
	public void testDraftInvalidatedWithLabel() throws DataException, SyncException {
		UtxoData spent = this.storeUtxo(1, 0, 50_000L, 10, 799_996);
		UtxoData unspent = this.storeUtxo(2, 1, 60_000L, 10, 799_996);
		this.nodeClient.addUtxo(WalletTestUtils.address(1), WalletTestUtils.txid(2), 0, 799_996, 60_000L);

		this.saveDraft("draft-rent", "Rent", spent);
		this.saveDraft("draft-other", "Savings", unspent);

		SyncResult result = this.reconcile();

		Assert.assertEquals(1, result.getStats().getDraftsInvalidated());
		Assert.assertEquals(Collections.singletonList("Invalidated 1 draft(s) due to spent UTXOs: Rent"), this.logCollector.getMessages(Category.DRAFT));

		try (final Repository repository = RepositoryManager.getRepository()) {
			Assert.assertNull(repository.getDraftRepository().fromDraftId("draft-rent"));
			Assert.assertNotNull(repository.getDraftRepository().fromDraftId("draft-other"));

			// Deleted draft's locks went with it
			Assert.assertEquals(Collections.singleton(unspent.getKey()), repository.getDraftRepository().getLockedUtxoKeys(WALLET_ID));
		}
	}

	@Test
	public void testDraftInvalidatedWithoutLabel() throws DataException, SyncException {
		UtxoData first = this.storeUtxo(1, 0, 50_000L, 10, 799_996);
		UtxoData second = this.storeUtxo(2, 0, 40_000L, 10, 799_996);

		this.saveDraft("draft-1", null, first);
		this.saveDraft("draft-2", "", second);

		SyncResult result = this.reconcile();

		Assert.assertEquals(2, result.getStats().getUtxosMarkedSpent());
		Assert.assertEquals(2, result.getStats().getDraftsInvalidated());
		Assert.assertEquals(Collections.singletonList("Invalidated 2 draft(s) due to spent UTXOs"), this.logCollector.getMessages(Category.DRAFT));

		try (final Repository repository = RepositoryManager.getRepository()) {
			Assert.assertTrue(repository.getDraftRepository().getDraftsByWallet(WALLET_ID).isEmpty());
		}
	}

	@Test
	public void testNoDraftMessageWithoutDrafts() throws DataException, SyncException {
		this.storeUtxo(1, 0, 50_000L, 10, 799_996);

		this.reconcile();

		Assert.assertTrue(this.logCollector.getMessages(Category.DRAFT).isEmpty());
	}

}
