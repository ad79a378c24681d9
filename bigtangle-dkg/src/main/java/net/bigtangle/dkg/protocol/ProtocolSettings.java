/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.bigtangle.dkg.auth.AuthScheme;
import net.bigtangle.dkg.auth.ECDSAAuthScheme;
import net.bigtangle.dkg.utils.IOUtils;

/**
 * Deployment settings of a run, read from a JSON document:
 * 
 * <pre>
 * { "phasePeriodMillis": 10000, "authScheme": "ecdsa" }
 * </pre>
 * 
 * Both keys are optional. authScheme is either "ecdsa" or "none".
 * 
 */
public class ProtocolSettings {

	private static final Logger logger = LoggerFactory.getLogger(ProtocolSettings.class);

	public static final String PHASE_PERIOD = "phasePeriodMillis";

	public static final String AUTH_SCHEME = "authScheme";

	public static final long DEFAULT_PHASE_PERIOD = 10000;

	public static final String SCHEME_ECDSA = "ecdsa";

	public static final String SCHEME_NONE = "none";

	private final long phasePeriodMillis;

	private final String authScheme;

	public ProtocolSettings(long phasePeriodMillis, String authScheme) {
		if (phasePeriodMillis < 0) {
			throw new IllegalArgumentException("Phase period cannot be negative");
		}
		if (!SCHEME_ECDSA.equals(authScheme) && !SCHEME_NONE.equals(authScheme)) {
			throw new IllegalArgumentException("Unknown authentication scheme: " + authScheme);
		}
		this.phasePeriodMillis = phasePeriodMillis;
		this.authScheme = authScheme;
	}

	public static ProtocolSettings fromJSON(JSONObject settings) {
		return new ProtocolSettings(settings.optLong(PHASE_PERIOD, DEFAULT_PHASE_PERIOD),
				settings.optString(AUTH_SCHEME, SCHEME_ECDSA));
	}

	public static ProtocolSettings readSettings(String file) throws IOException {
		try {
			ProtocolSettings settings = fromJSON(IOUtils.readJSONObjectFromFile(file));
			logger.info("Loaded settings from {}: period {}ms, auth {}", file, settings.phasePeriodMillis,
					settings.authScheme);
			return settings;
		} catch (JSONException | IllegalArgumentException e) {
			throw new IOException("Invalid settings file " + file, e);
		}
	}

	public long getPhasePeriodMillis() {
		return phasePeriodMillis;
	}

	public String getAuthScheme() {
		return authScheme;
	}

	/**
	 * @return a new TimePhaser with the configured period
	 */
	public TimePhaser createPhaser() {
		return new TimePhaser(phasePeriodMillis, TimeUnit.MILLISECONDS);
	}

	/**
	 * @return the configured AuthScheme, or null when authentication is off
	 */
	public AuthScheme createAuthScheme() {
		if (SCHEME_NONE.equals(authScheme)) {
			return null;
		}
		return new ECDSAAuthScheme();
	}
}
