package org.walletsync.test.settings;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.walletsync.settings.Settings;
import org.walletsync.test.common.Common;

import java.io.File;

public class SettingsTests {

	@After
	public void afterTest() {
		Settings.defaultInstance();
	}

	@Test
	public void testSettingsFile() {
		Common.useSettings(Common.testSettingsFilename);

		Settings settings = Settings.getInstance();
		Assert.assertEquals(5, settings.getRepositoryConnectionPoolSize());
		Assert.assertEquals(20, settings.getGapLimit());
		Assert.assertEquals(50, settings.getSyncBatchSize());
		Assert.assertEquals(25, settings.getTransactionBatchSize());
		Assert.assertEquals(2, settings.getSyncThreadCount());
		Assert.assertEquals(2, settings.getFetchThreadCount());
		Assert.assertEquals(6, settings.getDeepConfirmationThreshold());
		Assert.assertEquals(1000, settings.getTransactionCacheLimit());
		Assert.assertEquals(10.0, settings.getDefaultFeeRate(), 0.0);

		// Unset path defaults to settings file's directory
		String settingsDir = new File(Common.getResourcePath(Common.testSettingsFilename)).getAbsoluteFile().getParent();
		Assert.assertEquals(settingsDir, settings.getUserPath());
		Assert.assertEquals("db", settings.getRepositoryPath());
	}

	@Test
	public void testMissingSettingsFile() {
		Settings.fileInstance("no-such-settings-file.json");

		Settings settings = Settings.getInstance();
		Assert.assertEquals(20, settings.getGapLimit());
		Assert.assertEquals(4, settings.getSyncThreadCount());
		Assert.assertEquals(4, settings.getFetchThreadCount());
		Assert.assertEquals(10, settings.getRepositoryConnectionPoolSize());
	}

	@Test(expected = IllegalStateException.class)
	public void testInvalidSettings() {
		Common.useSettings("test-settings-invalid.json");
	}

}
