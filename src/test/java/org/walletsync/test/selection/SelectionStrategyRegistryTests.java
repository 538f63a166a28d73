package org.walletsync.test.selection;

import org.junit.Assert;
import org.junit.Test;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.selection.AbstractSelectionStrategy;
import org.walletsync.selection.ScriptType;
import org.walletsync.selection.SelectionContext;
import org.walletsync.selection.SelectionResult;
import org.walletsync.selection.SelectionStrategy;
import org.walletsync.selection.SelectionStrategyRegistry;
import org.walletsync.selection.StrategyNotFoundException;
import org.walletsync.selection.strategies.EfficiencyStrategy;
import org.walletsync.selection.strategies.PrivacyStrategy;
import org.walletsync.test.common.WalletTestUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class SelectionStrategyRegistryTests {

	/** Spends UTXOs in txid order */
	private static class TxidOrderStrategy extends AbstractSelectionStrategy {
		TxidOrderStrategy() {
			super("txid_order", "Txid order", "Spends UTXOs in txid order", "custom");
		}

		@Override
		protected Comparator<UtxoData> getOrdering() {
			return Comparator.comparing(UtxoData::getTxid);
		}
	}

	private static SelectionContext sampleContext() {
		List<UtxoData> utxos = Arrays.asList(
				new UtxoData("wallet", WalletTestUtils.txid(2), 0, "a1", 50_000L, "", 1, null, false, false),
				new UtxoData("wallet", WalletTestUtils.txid(1), 0, "a2", 20_000L, "", 1, null, false, false));

		return new SelectionContext(utxos, 10_000L, 1.0, ScriptType.NATIVE_SEGWIT);
	}

	private static List<String> ids(List<SelectionStrategy> strategies) {
		return strategies.stream().map(SelectionStrategy::getId).collect(Collectors.toList());
	}

	@Test
	public void testDefaultStrategies() {
		SelectionStrategyRegistry registry = SelectionStrategyRegistry.createDefault();

		Assert.assertEquals(Arrays.asList("privacy", "efficiency", "oldest_first", "largest_first", "smallest_first"), ids(registry.getAll()));
		Assert.assertTrue(registry.has("smallest_first"));
		Assert.assertTrue(registry.get(PrivacyStrategy.ID).get() instanceof PrivacyStrategy);
		Assert.assertFalse(registry.get("knapsack").isPresent());
		Assert.assertFalse(registry.get(null).isPresent());
	}

	@Test
	public void testGetByTag() {
		SelectionStrategyRegistry registry = SelectionStrategyRegistry.createDefault();

		Assert.assertEquals(Arrays.asList("efficiency", "largest_first"), ids(registry.getByTag("fees")));
		Assert.assertEquals(Collections.singletonList("privacy"), ids(registry.getByTag("privacy")));
		Assert.assertTrue(registry.getByTag("no-such-tag").isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateRegistration() {
		SelectionStrategyRegistry registry = SelectionStrategyRegistry.createDefault();
		registry.register(new EfficiencyStrategy());
	}

	@Test
	public void testDuplicateRegistrationKeepsOriginal() {
		SelectionStrategyRegistry registry = new SelectionStrategyRegistry();
		SelectionStrategy original = new EfficiencyStrategy();
		registry.register(original);

		try {
			registry.register(new EfficiencyStrategy());
			Assert.fail("Duplicate registration should be rejected");
		} catch (IllegalArgumentException e) {
			// Expected
		}

		Assert.assertSame(original, registry.get(EfficiencyStrategy.ID).get());
		Assert.assertEquals(1, registry.getAll().size());
	}

	@Test
	public void testCustomStrategy() {
		SelectionStrategyRegistry registry = SelectionStrategyRegistry.createDefault();
		registry.register(new TxidOrderStrategy());

		SelectionResult result = registry.select("txid_order", sampleContext());

		Assert.assertEquals("txid_order", result.getStrategyId());
		Assert.assertEquals(1, result.getSelected().size());
		Assert.assertEquals(WalletTestUtils.txid(1), result.getSelected().get(0).getTxid());
		Assert.assertEquals(Collections.singletonList("txid_order"), ids(registry.getByTag("custom")));
	}

	@Test
	public void testUnknownStrategyFallsBack() {
		SelectionStrategyRegistry registry = SelectionStrategyRegistry.createDefault();

		SelectionResult result = registry.select("knapsack", sampleContext());

		Assert.assertEquals(EfficiencyStrategy.ID, result.getStrategyId());
		Assert.assertEquals(50_000L, result.getTotalSelected());
	}

	@Test(expected = StrategyNotFoundException.class)
	public void testNoFallback() {
		SelectionStrategyRegistry registry = new SelectionStrategyRegistry();
		registry.register(new PrivacyStrategy());

		registry.select("knapsack", sampleContext());
	}

}
