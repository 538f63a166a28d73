package org.walletsync.address;

import org.walletsync.data.wallet.WalletData;

@FunctionalInterface
public interface AddressDeriverFactory {

	/**
	 * Returns deriver for wallet's descriptor.
	 *
	 * @throws DescriptorException if the descriptor can't be used to derive addresses
	 */
	public AddressDeriver forWallet(WalletData wallet) throws DescriptorException;

}
