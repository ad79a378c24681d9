/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;

import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.bigtangle.dkg.auth.ECDSAAuthScheme;
import net.bigtangle.dkg.utils.IOUtils;

public class ProtocolSettingsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void defaultsApplyToMissingKeys() {
		ProtocolSettings settings = ProtocolSettings.fromJSON(new JSONObject());

		assertEquals(ProtocolSettings.DEFAULT_PHASE_PERIOD, settings.getPhasePeriodMillis());
		assertTrue(settings.createAuthScheme() instanceof ECDSAAuthScheme);
	}

	@Test
	public void readsSettingsFile() throws IOException {
		File file = folder.newFile("settings.json");
		IOUtils.writeToFile(file.getPath(), new JSONObject().put(ProtocolSettings.PHASE_PERIOD, 250)
				.put(ProtocolSettings.AUTH_SCHEME, ProtocolSettings.SCHEME_NONE));

		ProtocolSettings settings = ProtocolSettings.readSettings(file.getPath());

		assertEquals(250, settings.getPhasePeriodMillis());
		assertNull(settings.createAuthScheme());
		assertNotNull(settings.createPhaser());
	}

	@Test(expected = IOException.class)
	public void unknownSchemeIsRejected() throws IOException {
		File file = folder.newFile("settings.json");
		IOUtils.writeToFile(file.getPath(), new JSONObject().put(ProtocolSettings.AUTH_SCHEME, "rot13"));

		ProtocolSettings.readSettings(file.getPath());
	}

	@Test(expected = IOException.class)
	public void malformedFileIsRejected() throws IOException {
		File file = folder.newFile("settings.json");
		IOUtils.writeToFile(file.getPath(), "{ not json");

		ProtocolSettings.readSettings(file.getPath());
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativePeriodIsRejected() {
		new ProtocolSettings(-1, ProtocolSettings.SCHEME_ECDSA);
	}
}
