package org.walletsync.test.sync;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncException;
import org.walletsync.sync.SyncOptions;
import org.walletsync.sync.SyncPipeline;
import org.walletsync.sync.SyncResult;
import org.walletsync.sync.phases.FetchHistoriesPhase;
import org.walletsync.test.common.Common;
import org.walletsync.test.common.FakeNodeClient;
import org.walletsync.test.common.WalletTestUtils;
import org.walletsync.test.common.WalletTestUtils.LogCollector;

import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

public class FetchHistoriesTests {

	private static final String WALLET_ID = "histories";

	private final LogCollector logCollector = new LogCollector();
	private FakeNodeClient nodeClient;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
		Common.addListener(this.logCollector);

		this.nodeClient = new FakeNodeClient(800_100);

		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);
			WalletTestUtils.createAddresses(repository, WALLET_ID, 120);
		}
	}

	@After
	public void afterTest() throws DataException {
		Common.tearDown();
	}

	/** Runs history fetch only, returning the final context. */
	private SyncContext fetchHistories(SyncPipeline syncPipeline) throws SyncException {
		AtomicReference<SyncContext> finalContext = new AtomicReference<>();

		syncPipeline.run(WALLET_ID, Collections.singletonList(new FetchHistoriesPhase()),
				SyncOptions.defaults().onPhaseComplete((phaseName, context) -> finalContext.set(context)));

		return finalContext.get();
	}

	@Test
	public void testHistoriesCollected() throws SyncException {
		this.nodeClient.addHistory(WalletTestUtils.address(3), WalletTestUtils.txid(1), 800_000)
				.addHistory(WalletTestUtils.address(3), WalletTestUtils.txid(2), 0)
				.addHistory(WalletTestUtils.address(77), WalletTestUtils.txid(2), 0);

		SyncContext context = this.fetchHistories(new SyncPipeline(this.nodeClient));

		Assert.assertEquals(120, context.getHistoryMap().size());
		Assert.assertEquals(2, context.getHistoryMap().get(WalletTestUtils.address(3)).size());
		Assert.assertTrue(context.getHistoryMap().get(WalletTestUtils.address(4)).isEmpty());
		Assert.assertEquals(2, context.getAllTxids().size());
		Assert.assertEquals(Integer.valueOf(800_000), context.getTxHeightMap().get(WalletTestUtils.txid(1)));
		Assert.assertEquals(Integer.valueOf(0), context.getTxHeightMap().get(WalletTestUtils.txid(2)));

		Assert.assertEquals(120, context.getStats().getHistoriesFetched());
		Assert.assertEquals(2, context.getStats().getAddressesWithActivity());
		Assert.assertEquals(3, this.nodeClient.historyBatchCalls.get());
	}

	@Test
	public void testConcurrentBatches() throws SyncException {
		this.nodeClient.addHistory(WalletTestUtils.address(110), WalletTestUtils.txid(1), 800_000);

		ExecutorService executor = Executors.newFixedThreadPool(3);
		try {
			SyncContext context = this.fetchHistories(new SyncPipeline(this.nodeClient, executor));

			Assert.assertEquals(120, context.getStats().getHistoriesFetched());
			Assert.assertEquals(1, context.getStats().getAddressesWithActivity());
			Assert.assertEquals(3, this.nodeClient.historyBatchCalls.get());
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void testBatchesUnsupported() throws SyncException {
		this.nodeClient.setFailAddressBatches(true);
		this.nodeClient.addHistory(WalletTestUtils.address(10), WalletTestUtils.txid(1), 800_000);

		SyncContext context = this.fetchHistories(new SyncPipeline(this.nodeClient));

		Assert.assertEquals(120, this.nodeClient.historySingleCalls.get());
		Assert.assertEquals(120, context.getStats().getHistoriesFetched());
		Assert.assertEquals(1, context.getStats().getAddressesWithActivity());
		Assert.assertTrue(this.logCollector.getMessages(Category.BLOCKCHAIN).isEmpty());
	}

	@Test
	public void testFailedAddressTreatedAsInactive() throws SyncException {
		this.nodeClient.addHistory(WalletTestUtils.address(5), WalletTestUtils.txid(1), 800_000)
				.failAddress(WalletTestUtils.address(5));

		SyncResult result = new SyncPipeline(this.nodeClient).run(WALLET_ID, Collections.singletonList(new FetchHistoriesPhase()));

		Assert.assertEquals(120, result.getStats().getHistoriesFetched());
		Assert.assertEquals(0, result.getStats().getAddressesWithActivity());

		// Only the batch holding the failing address fell back
		Assert.assertEquals(50, this.nodeClient.historySingleCalls.get());
		Assert.assertEquals(Collections.singletonList("Unable to fetch history for 1 address(es), treating them as inactive"),
				this.logCollector.getMessages(Category.BLOCKCHAIN));
	}

}
