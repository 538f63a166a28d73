package org.walletsync.repository;

import org.walletsync.data.wallet.AddressData;

import java.util.Collection;
import java.util.List;

public interface AddressRepository {

	/** Returns wallet's addresses ordered by chain, then index. */
	public List<AddressData> getAddressesByWallet(String walletId) throws DataException;

	public AddressData fromAddress(String walletId, String address) throws DataException;

	/**
	 * Inserts addresses, silently skipping any already present.
	 *
	 * @return number of rows actually inserted
	 */
	public int saveAll(List<AddressData> addresses) throws DataException;

	/**
	 * Marks passed addresses as used, touching only those not already used.
	 *
	 * @return number of rows actually changed
	 */
	public int markUsed(String walletId, Collection<String> addresses) throws DataException;

}
