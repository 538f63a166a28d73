package org.walletsync.test.repository;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.data.wallet.DraftTransactionData;
import org.walletsync.data.wallet.TransactionData;
import org.walletsync.data.wallet.TransactionData.RbfStatus;
import org.walletsync.data.wallet.TransactionData.Type;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.data.wallet.WalletData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.test.common.Common;
import org.walletsync.test.common.WalletTestUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class RepositoryTests {

	private static final String WALLET_ID = "repo";

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
	}

	@After
	public void afterTest() throws DataException {
		Common.tearDown();
	}

	@Test
	public void testWallets() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			Assert.assertFalse(repository.getWalletRepository().exists(WALLET_ID));
			Assert.assertNull(repository.getWalletRepository().fromWalletId(WALLET_ID));

			WalletTestUtils.createWallet(repository, WALLET_ID, WalletTestUtils.BIP84_DESCRIPTOR);
			WalletTestUtils.createWallet(repository, "other");

			Assert.assertTrue(repository.getWalletRepository().exists(WALLET_ID));
			Assert.assertEquals(2, repository.getWalletRepository().getAllWallets().size());

			WalletData walletData = repository.getWalletRepository().fromWalletId(WALLET_ID);
			Assert.assertEquals("mainnet", walletData.getNetwork());
			Assert.assertEquals("native_segwit", walletData.getScriptType());
			Assert.assertEquals(WalletTestUtils.BIP84_DESCRIPTOR, walletData.getDescriptor());

			// Saving again updates in place
			repository.getWalletRepository().save(new WalletData(WALLET_ID, "Renamed", "mainnet", null, "native_segwit"));
			repository.saveChanges();

			Assert.assertEquals("Renamed", repository.getWalletRepository().fromWalletId(WALLET_ID).getName());
			Assert.assertEquals(2, repository.getWalletRepository().getAllWallets().size());
		}
	}

	@Test
	public void testAddresses() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);
			List<AddressData> addresses = WalletTestUtils.createAddresses(repository, WALLET_ID, 5);

			// Duplicates are skipped
			List<AddressData> again = new ArrayList<>(addresses.subList(3, 5));
			again.add(new AddressData(WALLET_ID, WalletTestUtils.address(5), null, AddressData.RECEIVE_CHAIN, 5, false));
			Assert.assertEquals(1, repository.getAddressRepository().saveAll(again));
			repository.saveChanges();

			List<AddressData> stored = repository.getAddressRepository().getAddressesByWallet(WALLET_ID);
			Assert.assertEquals(6, stored.size());
			for (int index = 0; index < stored.size(); ++index)
				Assert.assertEquals(index, stored.get(index).getIndex());

			List<String> toMark = Arrays.asList(WalletTestUtils.address(1), WalletTestUtils.address(2), "bc1qnotours");
			Assert.assertEquals(2, repository.getAddressRepository().markUsed(WALLET_ID, toMark));
			repository.saveChanges();

			// Already used
			Assert.assertEquals(0, repository.getAddressRepository().markUsed(WALLET_ID, toMark));

			Assert.assertTrue(repository.getAddressRepository().fromAddress(WALLET_ID, WalletTestUtils.address(1)).isUsed());
			Assert.assertFalse(repository.getAddressRepository().fromAddress(WALLET_ID, WalletTestUtils.address(0)).isUsed());
			Assert.assertNull(repository.getAddressRepository().fromAddress(WALLET_ID, "bc1qnotours"));
		}
	}

	@Test
	public void testUtxos() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);

			String txid = WalletTestUtils.txid(1);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, txid, 0, WalletTestUtils.address(0), 10_000L, 0, null);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, txid, 1, WalletTestUtils.address(1), 20_000L, 3, 800_000);

			Set<String> keys = repository.getUtxoRepository().getUtxoKeys(WALLET_ID);
			Assert.assertEquals(2, keys.size());
			Assert.assertTrue(keys.contains(txid + ":0"));
			Assert.assertTrue(keys.contains(txid + ":1"));

			UtxoData pending = repository.getUtxoRepository().fromKey(WALLET_ID, txid, 0);
			Assert.assertNull(pending.getBlockHeight());
			Assert.assertEquals(0, pending.getConfirmations());

			pending.setConfirmations(2);
			pending.setBlockHeight(800_001);
			repository.getUtxoRepository().updateConfirmations(Collections.singletonList(pending));

			Assert.assertEquals(1, repository.getUtxoRepository().setFrozen(WALLET_ID, txid, 1, true));
			repository.saveChanges();

			UtxoData confirmed = repository.getUtxoRepository().fromKey(WALLET_ID, txid, 0);
			Assert.assertEquals(2, confirmed.getConfirmations());
			Assert.assertEquals(Integer.valueOf(800_001), confirmed.getBlockHeight());
			Assert.assertTrue(repository.getUtxoRepository().fromKey(WALLET_ID, txid, 1).isFrozen());

			Assert.assertEquals(1, repository.getUtxoRepository().markSpent(WALLET_ID, Collections.singletonList(txid + ":0")));
			repository.saveChanges();

			// Already spent
			Assert.assertEquals(0, repository.getUtxoRepository().markSpent(WALLET_ID, Collections.singletonList(txid + ":0")));

			// Spent UTXOs are kept, but aren't unspent
			Assert.assertEquals(2, repository.getUtxoRepository().getUtxosByWallet(WALLET_ID).size());
			List<UtxoData> unspent = repository.getUtxoRepository().getUnspentUtxos(WALLET_ID);
			Assert.assertEquals(1, unspent.size());
			Assert.assertEquals(1, unspent.get(0).getVout());
			Assert.assertTrue(repository.getUtxoRepository().getUtxoKeys(WALLET_ID).contains(txid + ":0"));
		}
	}

	@Test(expected = DataException.class)
	public void testMalformedUtxoKey() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);

			repository.getUtxoRepository().markSpent(WALLET_ID, Collections.singletonList("not-a-key"));
		}
	}

	@Test
	public void testManyExistingTxids() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);

			List<TransactionData> transactions = new ArrayList<>();
			for (int i = 0; i < 1500; i += 2)
				transactions.add(new TransactionData(WALLET_ID, WalletTestUtils.txid(i), Type.RECEIVED, 1000L, null, 1, 800_000,
						1600000000L, WalletTestUtils.address(0), RbfStatus.CONFIRMED, null));

			Assert.assertEquals(750, repository.getTransactionRepository().saveAll(transactions));
			repository.saveChanges();

			// Duplicates are skipped
			Assert.assertEquals(0, repository.getTransactionRepository().saveAll(transactions.subList(0, 10)));

			List<String> queried = new ArrayList<>();
			for (int i = 0; i < 2500; ++i)
				queried.add(WalletTestUtils.txid(i));

			Set<String> existing = repository.getTransactionRepository().getExistingTxids(WALLET_ID, queried);
			Assert.assertEquals(750, existing.size());
			Assert.assertTrue(existing.contains(WalletTestUtils.txid(1498)));
			Assert.assertFalse(existing.contains(WalletTestUtils.txid(1499)));

			Assert.assertTrue(repository.getTransactionRepository().getExistingTxids(WALLET_ID, Collections.emptyList()).isEmpty());
			Assert.assertTrue(repository.getTransactionRepository().getExistingTxids("other", queried).isEmpty());
		}
	}

	@Test
	public void testDraftLocks() throws DataException {
		String txid = WalletTestUtils.txid(1);

		try (final Repository repository = RepositoryManager.getRepository()) {
			WalletTestUtils.createWallet(repository, WALLET_ID);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, txid, 0, WalletTestUtils.address(0), 10_000L, 1, 800_000);
			WalletTestUtils.storeUtxo(repository, WALLET_ID, txid, 1, WalletTestUtils.address(1), 20_000L, 1, 800_000);

			repository.getDraftRepository().save(new DraftTransactionData("draft-1", WALLET_ID, "Rent", "bc1qlandlord", 9_000L,
					5.0, 1600000000000L, Collections.singletonList(txid + ":0")));
			repository.saveChanges();

			Assert.assertEquals(Collections.singleton(txid + ":0"), repository.getDraftRepository().getLockedUtxoKeys(WALLET_ID));

			List<DraftTransactionData> locking = repository.getDraftRepository().getDraftsLockingUtxos(WALLET_ID,
					Arrays.asList(txid + ":0", txid + ":1"));
			Assert.assertEquals(1, locking.size());
			Assert.assertEquals("Rent", locking.get(0).getLabel());
			Assert.assertEquals(Collections.singletonList(txid + ":0"), locking.get(0).getLockedUtxoKeys());

			// A UTXO can only be reserved by one draft
			try {
				repository.getDraftRepository().save(new DraftTransactionData("draft-2", WALLET_ID, null, "bc1qsomeone", 5_000L,
						5.0, 1600000000000L, Collections.singletonList(txid + ":0")));
				Assert.fail("Second lock on same UTXO should fail");
			} catch (DataException e) {
				repository.discardChanges();
			}

			Assert.assertNull(repository.getDraftRepository().fromDraftId("draft-2"));

			// Re-saving a draft replaces its locks
			repository.getDraftRepository().save(new DraftTransactionData("draft-1", WALLET_ID, "Rent", "bc1qlandlord", 9_000L,
					5.0, 1600000000000L, Collections.singletonList(txid + ":1")));
			repository.saveChanges();
			Assert.assertEquals(Collections.singleton(txid + ":1"), repository.getDraftRepository().getLockedUtxoKeys(WALLET_ID));

			Assert.assertEquals(1, repository.getDraftRepository().delete(Arrays.asList("draft-1", "no-such-draft")));
			repository.saveChanges();

			Assert.assertTrue(repository.getDraftRepository().getLockedUtxoKeys(WALLET_ID).isEmpty());
			Assert.assertTrue(repository.getDraftRepository().getDraftsByWallet(WALLET_ID).isEmpty());
		}
	}

}
