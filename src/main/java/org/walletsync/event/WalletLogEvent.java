package org.walletsync.event;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/**
 * Structured, per-wallet log entry destined for real-time subscribers.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class WalletLogEvent implements Event {

	public enum Level {
		DEBUG, INFO, WARN, ERROR
	}

	public enum Category {
		SYNC, BLOCKCHAIN, TX, RBF, UTXO, DRAFT, ADDRESS
	}

	private String walletId;
	private Level level;
	private Category category;
	private String message;
	private long timestamp;

	// For JAXB
	protected WalletLogEvent() {
	}

	public WalletLogEvent(String walletId, Level level, Category category, String message, long timestamp) {
		this.walletId = walletId;
		this.level = level;
		this.category = category;
		this.message = message;
		this.timestamp = timestamp;
	}

	public String getWalletId() {
		return this.walletId;
	}

	public Level getLevel() {
		return this.level;
	}

	public Category getCategory() {
		return this.category;
	}

	public String getMessage() {
		return this.message;
	}

	public long getTimestamp() {
		return this.timestamp;
	}

	@Override
	public String toString() {
		return String.format("[%s] %s %s: %s", this.walletId, this.level, this.category, this.message);
	}
}
