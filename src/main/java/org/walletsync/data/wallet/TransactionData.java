package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/**
 * A wallet's view of one on-chain transaction.
 * <p>
 * A transaction is stored once per {@link Type}, keyed by wallet, txid and type.
 */
// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class TransactionData {

	public enum Type {
		RECEIVED("received"),
		SENT("sent"),
		CONSOLIDATION("consolidation");

		public final String value;

		Type(String value) {
			this.value = value;
		}

		public static Type fromValue(String value) {
			for (Type type : values())
				if (type.value.equals(value))
					return type;

			throw new IllegalArgumentException("Unknown transaction type: " + value);
		}
	}

	public enum RbfStatus {
		ACTIVE("active"),
		CONFIRMED("confirmed"),
		REPLACED("replaced");

		public final String value;

		RbfStatus(String value) {
			this.value = value;
		}

		public static RbfStatus fromValue(String value) {
			for (RbfStatus status : values())
				if (status.value.equals(value))
					return status;

			throw new IllegalArgumentException("Unknown RBF status: " + value);
		}
	}

	// Properties

	private String walletId;
	private String txid;
	private Type type;
	/** Signed amount in satoshis: positive when received, negative when sent */
	private long amount;
	/** Null when not all input values are known */
	private Long fee;
	private int confirmations;
	private Integer blockHeight;
	/** Block timestamp, seconds since epoch, or null if unconfirmed */
	private Long blockTime;
	private String address;
	private RbfStatus rbfStatus;
	private String replacedByTxid;

	// Constructors

	// For JAXB
	protected TransactionData() {
	}

	public TransactionData(String walletId, String txid, Type type, long amount, Long fee, int confirmations,
			Integer blockHeight, Long blockTime, String address, RbfStatus rbfStatus, String replacedByTxid) {
		this.walletId = walletId;
		this.txid = txid;
		this.type = type;
		this.amount = amount;
		this.fee = fee;
		this.confirmations = confirmations;
		this.blockHeight = blockHeight;
		this.blockTime = blockTime;
		this.address = address;
		this.rbfStatus = rbfStatus;
		this.replacedByTxid = replacedByTxid;
	}

	// Getters / setters

	public String getWalletId() {
		return this.walletId;
	}

	public String getTxid() {
		return this.txid;
	}

	public Type getType() {
		return this.type;
	}

	public long getAmount() {
		return this.amount;
	}

	public Long getFee() {
		return this.fee;
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

	public Long getBlockTime() {
		return this.blockTime;
	}

	public String getAddress() {
		return this.address;
	}

	public RbfStatus getRbfStatus() {
		return this.rbfStatus;
	}

	public void setRbfStatus(RbfStatus rbfStatus) {
		this.rbfStatus = rbfStatus;
	}

	public String getReplacedByTxid() {
		return this.replacedByTxid;
	}

	@Override
	public String toString() {
		return String.format("%s %s %d sats (%d conf, %s)", this.type.value, this.txid, this.amount, this.confirmations, this.rbfStatus.value);
	}

}
