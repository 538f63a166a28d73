package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class TransactionOutputData {

	public enum OutputType {
		RECIPIENT("recipient"),
		CHANGE("change"),
		CONSOLIDATION("consolidation"),
		UNKNOWN("unknown");

		public final String value;

		OutputType(String value) {
			this.value = value;
		}

		public static OutputType fromValue(String value) {
			for (OutputType outputType : values())
				if (outputType.value.equals(value))
					return outputType;

			return UNKNOWN;
		}
	}

	private String walletId;
	private String txid;
	private int outputIndex;
	private String address;
	private long amount;
	private String scriptPubKey;
	private boolean mine;
	private OutputType outputType;

	// For JAXB
	protected TransactionOutputData() {
	}

	public TransactionOutputData(String walletId, String txid, int outputIndex, String address, long amount,
			String scriptPubKey, boolean mine, OutputType outputType) {
		this.walletId = walletId;
		this.txid = txid;
		this.outputIndex = outputIndex;
		this.address = address;
		this.amount = amount;
		this.scriptPubKey = scriptPubKey;
		this.mine = mine;
		this.outputType = outputType;
	}

	public String getWalletId() {
		return this.walletId;
	}

	public String getTxid() {
		return this.txid;
	}

	public int getOutputIndex() {
		return this.outputIndex;
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

	public boolean isMine() {
		return this.mine;
	}

	public OutputType getOutputType() {
		return this.outputType;
	}

}
