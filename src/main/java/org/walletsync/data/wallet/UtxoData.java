package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class UtxoData {

	// Properties

	private String walletId;
	private String txid;
	private int vout;
	private String address;
	/** Amount in satoshis */
	private long amount;
	/** Hex-encoded output script */
	private String scriptPubKey;
	private int confirmations;
	/** Null when unconfirmed */
	private Integer blockHeight;
	private boolean spent;
	/** Excluded from coin selection by user choice */
	private boolean frozen;

	// Constructors

	// For JAXB
	protected UtxoData() {
	}

	public UtxoData(String walletId, String txid, int vout, String address, long amount, String scriptPubKey,
			int confirmations, Integer blockHeight, boolean spent, boolean frozen) {
		this.walletId = walletId;
		this.txid = txid;
		this.vout = vout;
		this.address = address;
		this.amount = amount;
		this.scriptPubKey = scriptPubKey;
		this.confirmations = confirmations;
		this.blockHeight = blockHeight;
		this.spent = spent;
		this.frozen = frozen;
	}

	public static String buildKey(String txid, int vout) {
		return txid + ":" + vout;
	}

	// Getters / setters

	/** Returns "txid:vout" key identifying this output. */
	public String getKey() {
		return buildKey(this.txid, this.vout);
	}

	public String getWalletId() {
		return this.walletId;
	}

	public String getTxid() {
		return this.txid;
	}

	public int getVout() {
		return this.vout;
	}

	public String getAddress() {
		return this.address;
	}

	public long getAmount() {
		return this.amount;
	}

	public String getScriptPubKey() {
		return this.scriptPubKey;
	}

	public int getConfirmations() {
		return this.confirmations;
	}

	public void setConfirmations(int confirmations) {
		this.confirmations = confirmations;
	}

	public Integer getBlockHeight() {
		return this.blockHeight;
	}

	public void setBlockHeight(Integer blockHeight) {
		this.blockHeight = blockHeight;
	}

	public boolean isSpent() {
		return this.spent;
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	@Override
	public String toString() {
		return String.format("%s (%d sats, %d conf%s)", this.getKey(), this.amount, this.confirmations, this.spent ? ", spent" : "");
	}

}
