package org.walletsync.address;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.data.wallet.WalletData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Gap-limit address discovery.
 * <p>
 * Keeps, on both receive and change chains, a tail of <tt>gapLimit</tt> unused addresses
 * beyond the last used one, deriving and storing new addresses as needed.
 */
public class AddressDiscovery {

	private static final Logger LOGGER = LogManager.getLogger(AddressDiscovery.class);

	private static final int[] CHAINS = { AddressData.RECEIVE_CHAIN, AddressData.CHANGE_CHAIN };

	private final int gapLimit;
	private final AddressDeriverFactory deriverFactory;

	public AddressDiscovery(int gapLimit, AddressDeriverFactory deriverFactory) {
		if (gapLimit <= 0)
			throw new IllegalArgumentException("Gap limit must be positive");

		this.gapLimit = gapLimit;
		this.deriverFactory = deriverFactory;
	}

	/**
	 * Returns number of consecutive unused addresses at the end of a chain.
	 *
	 * @param chainAddresses addresses of one chain, in any order
	 * @return unused tail length, 0 if there are no addresses
	 */
	public static int countUnusedTail(List<AddressData> chainAddresses) {
		List<AddressData> sorted = new ArrayList<>(chainAddresses);
		sorted.sort(Comparator.comparingInt(AddressData::getIndex).reversed());

		int gap = 0;
		for (AddressData address : sorted) {
			if (address.isUsed())
				break;

			++gap;
		}

		return gap;
	}

	/**
	 * Derives and stores addresses until each chain has an unused tail of the gap limit.
	 * <p>
	 * Wallets without descriptor are skipped. A descriptor that can't derive addresses is
	 * reported as a wallet warning and nothing is generated; this doesn't throw.
	 * <p>
	 * Caller is responsible for saving repository changes.
	 *
	 * @return newly generated addresses, possibly empty
	 */
	public List<AddressData> ensureGapLimit(Repository repository, WalletData wallet) throws DataException {
		String walletId = wallet.getWalletId();
		List<AddressData> generated = new ArrayList<>();

		if (wallet.getDescriptor() == null || wallet.getDescriptor().trim().isEmpty()) {
			LOGGER.debug("Wallet {} has no descriptor, skipping address generation", walletId);
			return generated;
		}

		AddressDeriver deriver;
		try {
			deriver = this.deriverFactory.forWallet(wallet);
		} catch (DescriptorException e) {
			WalletLog.warn(walletId, Category.ADDRESS, String.format("Unable to derive addresses from wallet descriptor: %s", e.getMessage()));
			return generated;
		}

		List<AddressData> existing = repository.getAddressRepository().getAddressesByWallet(walletId);

		for (int chain : CHAINS) {
			List<AddressData> chainAddresses = existing.stream()
					.filter(address -> address.getChain() == chain)
					.collect(Collectors.toList());

			int gap = countUnusedTail(chainAddresses);
			if (gap >= this.gapLimit)
				continue;

			int nextIndex = chainAddresses.stream().mapToInt(AddressData::getIndex).max().orElse(-1) + 1;
			int needed = this.gapLimit - gap;

			WalletLog.debug(walletId, Category.ADDRESS, String.format("Expanding %s addresses (gap: %d/%d)",
					chain == AddressData.RECEIVE_CHAIN ? "receive" : "change", gap, this.gapLimit));

			for (int index = nextIndex; index < nextIndex + needed; ++index) {
				try {
					String address = deriver.deriveAddress(chain, index);
					generated.add(new AddressData(walletId, address, deriver.derivationPath(chain, index), chain, index, false));
				} catch (DescriptorException e) {
					WalletLog.warn(walletId, Category.ADDRESS, String.format("Unable to derive address %d/%d: %s", chain, index, e.getMessage()));
					break;
				}
			}
		}

		if (generated.isEmpty())
			return generated;

		repository.getAddressRepository().saveAll(generated);

		WalletLog.info(walletId, Category.ADDRESS, String.format("Generated %d new addresses to maintain gap limit", generated.size()));

		return generated;
	}

}
