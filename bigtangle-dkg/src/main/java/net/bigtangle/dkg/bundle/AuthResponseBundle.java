/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.engine.Roster;

/**
 * Signed ResponseBundle, the sender is identified by its share index in the new roster.
 * 
 */
public final class AuthResponseBundle extends AuthBundle<ResponseBundle> {

	public AuthResponseBundle(ResponseBundle bundle, byte[] signature) {
		super(bundle, signature);
	}

	@Override
	public Roster selectRoster(DkgConfig config) {
		return config.getNewNodes();
	}

	@Override
	public String getKind() {
		return "response";
	}
}
