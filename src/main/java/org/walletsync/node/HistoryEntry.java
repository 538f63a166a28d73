package org.walletsync.node;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/** One transaction touching an address, as reported by the node. */
@XmlAccessorType(XmlAccessType.FIELD)
public class HistoryEntry {

	private String txHash;
	/** Block height, or 0 if unconfirmed */
	private int height;

	protected HistoryEntry() {
	}

	public HistoryEntry(String txHash, int height) {
		this.txHash = txHash;
		this.height = height;
	}

	public String getTxHash() {
		return this.txHash;
	}

	public int getHeight() {
		return this.height;
	}

	public boolean isConfirmed() {
		return this.height > 0;
	}

	@Override
	public String toString() {
		return String.format("%s@%d", this.txHash, this.height);
	}

}
