/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import static com.google.common.base.Preconditions.checkNotNull;

import net.bigtangle.dkg.auth.AuthScheme;
import net.bigtangle.dkg.engine.DkgConfig;

/**
 * Configuration of a protocol run: the engine configuration and the scheme
 * used to authenticate bundles on the board. Without a scheme nothing is
 * signed and every received bundle is accepted, which is only suitable for
 * trusted transports.
 * 
 */
public class ProtocolConfig {

	private final DkgConfig dkgConfig;

	private final AuthScheme auth;

	public ProtocolConfig(DkgConfig dkgConfig) {
		this(dkgConfig, null);
	}

	public ProtocolConfig(DkgConfig dkgConfig, AuthScheme auth) {
		this.dkgConfig = checkNotNull(dkgConfig, "engine configuration is required");
		this.auth = auth;
	}

	public DkgConfig getDkgConfig() {
		return dkgConfig;
	}

	/**
	 * @return AuthScheme, or null if authentication is disabled
	 */
	public AuthScheme getAuth() {
		return auth;
	}
}
