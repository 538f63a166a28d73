package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class WalletData {

	// Properties

	private String walletId;
	private String name;
	/** mainnet, testnet or regtest */
	private String network;
	/** Output descriptor used to derive addresses, or null for watch-only address lists. */
	private String descriptor;
	/** Script type of the wallet's inputs, e.g. native_segwit. */
	private String scriptType;

	// Constructors

	// For JAXB
	protected WalletData() {
	}

	public WalletData(String walletId, String name, String network, String descriptor, String scriptType) {
		this.walletId = walletId;
		this.name = name;
		this.network = network;
		this.descriptor = descriptor;
		this.scriptType = scriptType;
	}

	// Getters / setters

	public String getWalletId() {
		return this.walletId;
	}

	public String getName() {
		return this.name;
	}

	public String getNetwork() {
		return this.network;
	}

	public String getDescriptor() {
		return this.descriptor;
	}

	public String getScriptType() {
		return this.scriptType;
	}

}
