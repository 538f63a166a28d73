package org.walletsync.repository;

import org.walletsync.data.wallet.WalletData;

import java.util.List;

public interface WalletRepository {

	/** Returns wallet, or null if not found. */
	public WalletData fromWalletId(String walletId) throws DataException;

	public boolean exists(String walletId) throws DataException;

	public List<WalletData> getAllWallets() throws DataException;

	public void save(WalletData walletData) throws DataException;

}
