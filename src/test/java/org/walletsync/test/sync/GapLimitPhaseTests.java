package org.walletsync.test.sync;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.address.AddressDeriver;
import org.walletsync.address.AddressDeriverFactory;
import org.walletsync.address.AddressDiscovery;
import org.walletsync.address.DescriptorAddressDeriver;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.data.wallet.WalletData;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.sync.SyncException;
import org.walletsync.sync.SyncPipeline;
import org.walletsync.sync.SyncResult;
import org.walletsync.sync.phases.GapLimitPhase;
import org.walletsync.test.common.Common;
import org.walletsync.test.common.FakeNodeClient;
import org.walletsync.test.common.WalletTestUtils;
import org.walletsync.test.common.WalletTestUtils.LogCollector;

import java.util.Collections;
import java.util.List;

public class GapLimitPhaseTests {

	private static final String WALLET_ID = "gaplimit";
	private static final int GAP_LIMIT = 20;

	/** Receive addresses follow {@link WalletTestUtils#address(int)}. */
	private static final AddressDeriverFactory TEST_DERIVER_FACTORY = wallet -> new AddressDeriver() {
		@Override
		public String deriveAddress(int chain, int index) {
			return chain == AddressData.RECEIVE_CHAIN ? WalletTestUtils.address(index) : String.format("bc1qtestchange%04d", index);
		}

		@Override
		public String derivationPath(int chain, int index) {
			return String.format("m/84'/0'/0'/%d/%d", chain, index);
		}
	};

	private final LogCollector logCollector = new LogCollector();
	private FakeNodeClient nodeClient;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
		Common.addListener(this.logCollector);

		this.nodeClient = new FakeNodeClient(800_005);
	}

	@After
	public void afterTest() throws DataException {
		Common.tearDown();
	}

	private void createWallet(int receiveAddresses) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID, WalletTestUtils.BIP84_DESCRIPTOR);
			WalletTestUtils.createAddresses(repository, WALLET_ID, receiveAddresses);
		}
	}

	private SyncResult runGapLimit() throws SyncException {
		return new SyncPipeline(this.nodeClient).run(WALLET_ID,
				Collections.singletonList(new GapLimitPhase(GAP_LIMIT, TEST_DERIVER_FACTORY)));
	}

	private static int countAddresses() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getAddressRepository().getAddressesByWallet(WALLET_ID).size();
		}
	}

	@Test
	public void testInactiveAddressesGenerated() throws DataException, SyncException {
		this.createWallet(5);

		SyncResult result = this.runGapLimit();

		// 15 more receive, 20 change
		Assert.assertEquals(35, result.getStats().getNewAddressesGenerated());
		Assert.assertFalse(result.isResyncRequired());
		Assert.assertEquals(40, countAddresses());

		Assert.assertEquals(Collections.singletonList("Scanning 35 newly generated addresses"),
				this.logCollector.getMessages(Category.BLOCKCHAIN));
		Assert.assertEquals(1, this.nodeClient.historyBatchCalls.get());
	}

	@Test
	public void testActivityRequiresResync() throws DataException, SyncException {
		this.createWallet(5);
		this.nodeClient.addHistory(WalletTestUtils.address(12), WalletTestUtils.txid(1), 800_000);

		SyncResult result = this.runGapLimit();

		Assert.assertTrue(result.isResyncRequired());
		Assert.assertEquals(Collections.singletonList("Found transactions on new addresses, re-syncing..."),
				this.logCollector.getMessages(Category.BLOCKCHAIN));
	}

	@Test
	public void testNothingToGenerate() throws DataException, SyncException {
		this.createWallet(5);
		this.runGapLimit();

		int batchCalls = this.nodeClient.historyBatchCalls.get();

		SyncResult result = this.runGapLimit();

		Assert.assertEquals(0, result.getStats().getNewAddressesGenerated());
		Assert.assertFalse(result.isResyncRequired());
		Assert.assertEquals(batchCalls, this.nodeClient.historyBatchCalls.get());
		Assert.assertEquals(40, countAddresses());
	}

	@Test
	public void testFailedProbeKeepsAddresses() throws DataException, SyncException {
		this.createWallet(5);
		this.nodeClient.failAddress(WalletTestUtils.address(10));

		SyncResult result = this.runGapLimit();

		Assert.assertEquals(35, result.getStats().getNewAddressesGenerated());
		Assert.assertFalse(result.isResyncRequired());
		Assert.assertEquals(40, countAddresses());

		List<String> messages = this.logCollector.getMessages(Category.BLOCKCHAIN);
		Assert.assertEquals(2, messages.size());
		Assert.assertEquals("Unable to scan 1 new addresses, will retry next sync", messages.get(0));
		Assert.assertEquals("Scanning 35 newly generated addresses", messages.get(1));
	}

	@Test
	public void testFullSyncExtendsDescriptorWallet() throws DataException, SyncException {
		final String firstReceive = "bc1qcr8te4kr609gcawutmrza0j4xv80jy8z306fyu";

		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletData wallet = WalletTestUtils.createWallet(repository, WALLET_ID, WalletTestUtils.BIP84_DESCRIPTOR);
			new AddressDiscovery(GAP_LIMIT, DescriptorAddressDeriver::forWallet).ensureGapLimit(repository, wallet);
			repository.saveChanges();
		}

		String txid = WalletTestUtils.txid(1);
		this.nodeClient.addTransaction(WalletTestUtils.incomingTransaction(txid, 800_000, firstReceive, 25_000L))
				.addHistory(firstReceive, txid, 800_000);

		SyncResult result = new SyncPipeline(this.nodeClient).run(WALLET_ID, SyncPipeline.defaultPhases());

		Assert.assertEquals(1, result.getStats().getNewAddressesGenerated());
		Assert.assertFalse(result.isResyncRequired());
		Assert.assertEquals(41, countAddresses());

		try (final Repository repository = RepositoryManager.getRepository()) {
			Assert.assertTrue(repository.getAddressRepository().fromAddress(WALLET_ID, firstReceive).isUsed());
		}

		Assert.assertTrue(this.logCollector.getMessages(Category.BLOCKCHAIN).contains("Scanning 1 newly generated addresses"));
	}

}
