package org.walletsync.sync;

@SuppressWarnings("serial")
public class WalletNotFoundException extends SyncException {

    private final String walletId;

    public WalletNotFoundException(String walletId) {
        super(String.format("Wallet %s not found", walletId));
        this.walletId = walletId;
    }

    public String getWalletId() {
        return this.walletId;
    }

}
