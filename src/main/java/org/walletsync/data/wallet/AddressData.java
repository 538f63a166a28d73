package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class AddressData {

	public static final int RECEIVE_CHAIN = 0;
	public static final int CHANGE_CHAIN = 1;

	// Properties

	private String walletId;
	private String address;
	private String derivationPath;
	/** 0 = receive, 1 = change */
	private int chain;
	private int index;
	private boolean used;

	// Constructors

	// For JAXB
	protected AddressData() {
	}

	public AddressData(String walletId, String address, String derivationPath, int chain, int index, boolean used) {
		this.walletId = walletId;
		this.address = address;
		this.derivationPath = derivationPath;
		this.chain = chain;
		this.index = index;
		this.used = used;
	}

	// Getters / setters

	public String getWalletId() {
		return this.walletId;
	}

	public String getAddress() {
		return this.address;
	}

	public String getDerivationPath() {
		return this.derivationPath;
	}

	public int getChain() {
		return this.chain;
	}

	public boolean isChange() {
		return this.chain == CHANGE_CHAIN;
	}

	public int getIndex() {
		return this.index;
	}

	public boolean isUsed() {
		return this.used;
	}

	public void setUsed(boolean used) {
		this.used = used;
	}

	@Override
	public String toString() {
		return String.format("%s (%s)", this.address, this.derivationPath);
	}

}
