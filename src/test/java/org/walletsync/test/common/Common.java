package org.walletsync.test.common;

import org.walletsync.event.EventBus;
import org.walletsync.event.Listener;
import org.walletsync.repository.DataException;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.repository.hsqldb.HSQLDBRepositoryFactory;
import org.walletsync.settings.Settings;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class Common {

	public static final String testSettingsFilename = "test-settings.json";

	private static final List<Listener> registeredListeners = new ArrayList<>();

	/** Returns path of test resource, e.g. a settings file. */
	public static String getResourcePath(String resourceName) {
		URL url = Common.class.getClassLoader().getResource(resourceName);
		if (url == null)
			throw new IllegalStateException("Missing test resource " + resourceName);

		try {
			return new File(url.toURI()).getPath();
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Bad test resource URL " + url, e);
		}
	}

	public static void useSettings(String settingsFilename) {
		Settings.fileInstance(getResourcePath(settingsFilename));
	}

	/** Installs test settings and a fresh, empty in-memory repository. */
	public static void useDefaultSettings() throws DataException {
		useSettings(testSettingsFilename);
		resetRepository();
	}

	public static void resetRepository() throws DataException {
		RepositoryManager.closeRepositoryFactory();
		RepositoryManager.setRepositoryFactory(new HSQLDBRepositoryFactory("jdbc:hsqldb:mem:walletsync-" + UUID.randomUUID()));
	}

	/** Adds event listener that's removed again by {@link #tearDown()}. */
	public static void addListener(Listener listener) {
		registeredListeners.add(listener);
		EventBus.INSTANCE.addListener(listener);
	}

	public static void tearDown() throws DataException {
		for (Listener listener : registeredListeners)
			EventBus.INSTANCE.removeListener(listener);
		registeredListeners.clear();

		RepositoryManager.closeRepositoryFactory();
	}

}
