package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class TransactionInputData {

	private String walletId;
	private String txid;
	private int inputIndex;
	private String prevTxid;
	private int prevVout;
	/** Null if the spent output's address couldn't be resolved */
	private String address;
	/** Null if the spent output's value couldn't be resolved */
	private Long amount;

	// For JAXB
	protected TransactionInputData() {
	}

	public TransactionInputData(String walletId, String txid, int inputIndex, String prevTxid, int prevVout, String address, Long amount) {
		this.walletId = walletId;
		this.txid = txid;
		this.inputIndex = inputIndex;
		this.prevTxid = prevTxid;
		this.prevVout = prevVout;
		this.address = address;
		this.amount = amount;
	}

	public String getWalletId() {
		return this.walletId;
	}

	public String getTxid() {
		return this.txid;
	}

	public int getInputIndex() {
		return this.inputIndex;
	}

	public String getPrevTxid() {
		return this.prevTxid;
	}

	public int getPrevVout() {
		return this.prevVout;
	}

	/** Returns "txid:vout" key of the output this input spends. */
	public String getOutpoint() {
		return UtxoData.buildKey(this.prevTxid, this.prevVout);
	}

	public String getAddress() {
		return this.address;
	}

	public Long getAmount() {
		return this.amount;
	}

}
