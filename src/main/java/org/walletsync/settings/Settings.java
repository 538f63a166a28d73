package org.walletsync.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);
	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	// Settings, and other config files
	private String userPath;

	// Repository related
	/** Repository storage path. */
	private String repositoryPath = "db";
	/** Repository connection pool size. Needs to be a bit bigger than maximum simultaneous wallet syncs. */
	private int repositoryConnectionPoolSize = 10;

	// Address discovery
	/** Number of consecutive unused addresses kept beyond the last used one, per chain. */
	private int gapLimit = 20;

	// Sync
	/** Number of addresses per batched history / UTXO query. */
	private int syncBatchSize = 50;
	/** Number of transactions per batched transaction-detail query. */
	private int transactionBatchSize = 25;
	/** Maximum number of wallets synced at the same time. */
	private int syncThreadCount = 4;
	/** Number of threads issuing batched node queries within one sync phase. */
	private int fetchThreadCount = 4;
	/** Stored transactions with fewer confirmations than this are refreshed on every sync. */
	private int deepConfirmationThreshold = 6;
	/** Maximum number of transactions held in a sync run's transaction cache. */
	private int transactionCacheLimit = 1000;

	// Coin selection
	/** Fee rate (sat/vB) used when a caller doesn't supply one. */
	private double defaultFeeRate = 10.0;

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * Throws <tt>IllegalStateException</tt> if the settings can't be parsed
	 * or don't pass validation. A missing file yields default settings.
	 */
	public static synchronized void fileInstance(String filename) {
		instance = loadSettings(filename);
	}

	/** Reset settings to defaults, e.g. for tests. */
	public static synchronized void defaultInstance() {
		instance = new Settings();
	}

	private static Settings loadSettings(String filename) {
		JAXBContext jc;
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of Settings
			jc = JAXBContextFactory.createContext(new Class[] { Settings.class }, null);

			// Create unmarshaller
			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to process settings file";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		}

		File file = new File(filename);
		Settings settings;

		try (Reader reader = new FileReader(file)) {
			LOGGER.info("Using settings file: {}", file.getPath());

			// Attempt to unmarshal JSON stream to Settings
			settings = unmarshaller.unmarshal(new StreamSource(reader), Settings.class).getValue();
		} catch (FileNotFoundException e) {
			LOGGER.info("Settings file {} not found, using defaults", file.getPath());
			settings = new Settings();
		} catch (UnmarshalException e) {
			Throwable linkedException = e.getLinkedException();
			if (linkedException instanceof XMLMarshalException) {
				String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
				LOGGER.error(message);
				throw new IllegalStateException(message, e);
			}

			String message = "Failed to parse settings file";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		} catch (JAXBException e) {
			String message = "Unexpected JAXB issue while processing settings file";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		} catch (IOException e) {
			String message = "Unexpected I/O issue while processing settings file";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		}

		if (settings.userPath == null)
			settings.userPath = file.getAbsoluteFile().getParent();

		settings.validate();

		return settings;
	}

	private void validate() {
		if (this.gapLimit <= 0)
			throwValidationError("gapLimit must be positive");

		if (this.syncBatchSize <= 0)
			throwValidationError("syncBatchSize must be positive");

		if (this.transactionBatchSize <= 0)
			throwValidationError("transactionBatchSize must be positive");

		if (this.syncThreadCount <= 0 || this.fetchThreadCount <= 0)
			throwValidationError("thread counts must be positive");

		if (this.repositoryConnectionPoolSize <= 0)
			throwValidationError("repositoryConnectionPoolSize must be positive");

		if (this.deepConfirmationThreshold <= 0)
			throwValidationError("deepConfirmationThreshold must be positive");

		if (this.defaultFeeRate <= 0)
			throwValidationError("defaultFeeRate must be positive");
	}

	private static void throwValidationError(String message) {
		LOGGER.error("Settings validation failed: {}", message);
		throw new IllegalStateException(message);
	}

	// Getters / setters

	public String getUserPath() {
		return this.userPath;
	}

	public String getRepositoryPath() {
		return this.repositoryPath;
	}

	public int getRepositoryConnectionPoolSize() {
		return this.repositoryConnectionPoolSize;
	}

	public int getGapLimit() {
		return this.gapLimit;
	}

	public int getSyncBatchSize() {
		return this.syncBatchSize;
	}

	public int getTransactionBatchSize() {
		return this.transactionBatchSize;
	}

	public int getSyncThreadCount() {
		return this.syncThreadCount;
	}

	public int getFetchThreadCount() {
		return this.fetchThreadCount;
	}

	public int getDeepConfirmationThreshold() {
		return this.deepConfirmationThreshold;
	}

	public int getTransactionCacheLimit() {
		return this.transactionCacheLimit;
	}

	public double getDefaultFeeRate() {
		return this.defaultFeeRate;
	}

}
