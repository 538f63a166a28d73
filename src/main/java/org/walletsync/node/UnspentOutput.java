package org.walletsync.node;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/** Unspent output, as reported by the node for an address. */
@XmlAccessorType(XmlAccessType.FIELD)
public class UnspentOutput {

	private String txid;
	private int vout;
	/** Block height, or 0 if unconfirmed */
	private int height;
	/** Value in satoshis */
	private long value;

	protected UnspentOutput() {
	}

	public UnspentOutput(String txid, int vout, int height, long value) {
		this.txid = txid;
		this.vout = vout;
		this.height = height;
		this.value = value;
	}

	public String getTxid() {
		return this.txid;
	}

	public int getVout() {
		return this.vout;
	}

	public int getHeight() {
		return this.height;
	}

	public long getValue() {
		return this.value;
	}

	/** Returns "txid:vout" key identifying this output. */
	public String getKey() {
		return this.txid + ":" + this.vout;
	}

}
