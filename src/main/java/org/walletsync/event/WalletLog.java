package org.walletsync.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.event.WalletLogEvent.Level;

/**
 * Publishes wallet log entries to the {@link EventBus} and mirrors them to the application log.
 */
public abstract class WalletLog {

	private static final Logger LOGGER = LogManager.getLogger(WalletLog.class);

	public static void log(String walletId, Level level, Category category, String message) {
		switch (level) {
			case DEBUG:
				LOGGER.debug("[{}] [{}] {}", walletId, category, message);
				break;

			case INFO:
				LOGGER.info("[{}] [{}] {}", walletId, category, message);
				break;

			case WARN:
				LOGGER.warn("[{}] [{}] {}", walletId, category, message);
				break;

			case ERROR:
				LOGGER.error("[{}] [{}] {}", walletId, category, message);
				break;
		}

		EventBus.INSTANCE.notify(new WalletLogEvent(walletId, level, category, message, System.currentTimeMillis()));
	}

	public static void debug(String walletId, Category category, String message) {
		log(walletId, Level.DEBUG, category, message);
	}

	public static void info(String walletId, Category category, String message) {
		log(walletId, Level.INFO, category, message);
	}

	public static void warn(String walletId, Category category, String message) {
		log(walletId, Level.WARN, category, message);
	}

	public static void error(String walletId, Category category, String message) {
		log(walletId, Level.ERROR, category, message);
	}

}
