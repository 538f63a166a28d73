package org.walletsync.data.wallet;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import java.util.ArrayList;
import java.util.List;

/**
 * Unsigned spend proposal, reserving the UTXOs it would consume.
 */
// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class DraftTransactionData {

	// Properties

	private String draftId;
	private String walletId;
	private String label;
	private String recipient;
	private long amount;
	private double feeRate;
	private long created;
	/** "txid:vout" keys of locked UTXOs */
	private List<String> lockedUtxoKeys = new ArrayList<>();

	// Constructors

	// For JAXB
	protected DraftTransactionData() {
	}

	public DraftTransactionData(String draftId, String walletId, String label, String recipient, long amount,
			double feeRate, long created, List<String> lockedUtxoKeys) {
		this.draftId = draftId;
		this.walletId = walletId;
		this.label = label;
		this.recipient = recipient;
		this.amount = amount;
		this.feeRate = feeRate;
		this.created = created;
		this.lockedUtxoKeys = lockedUtxoKeys;
	}

	// Getters / setters

	public String getDraftId() {
		return this.draftId;
	}

	public String getWalletId() {
		return this.walletId;
	}

	public String getLabel() {
		return this.label;
	}

	public String getRecipient() {
		return this.recipient;
	}

	public long getAmount() {
		return this.amount;
	}

	public double getFeeRate() {
		return this.feeRate;
	}

	public long getCreated() {
		return this.created;
	}

	public List<String> getLockedUtxoKeys() {
		return this.lockedUtxoKeys;
	}

	public void setLockedUtxoKeys(List<String> lockedUtxoKeys) {
		this.lockedUtxoKeys = lockedUtxoKeys;
	}

}
