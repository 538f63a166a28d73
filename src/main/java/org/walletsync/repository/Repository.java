package org.walletsync.repository;

public interface Repository extends AutoCloseable {

	public WalletRepository getWalletRepository();

	public AddressRepository getAddressRepository();

	public UtxoRepository getUtxoRepository();

	public TransactionRepository getTransactionRepository();

	public DraftRepository getDraftRepository();

	/** Commits all pending changes as one atomic unit. */
	public void saveChanges() throws DataException;

	public void discardChanges() throws DataException;

	@Override
	public void close() throws DataException;

}
