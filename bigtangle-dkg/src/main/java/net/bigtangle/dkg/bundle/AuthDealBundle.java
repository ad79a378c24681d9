/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.engine.Roster;

/**
 * Signed DealBundle, the sender is identified by its dealer index in the old roster.
 * 
 */
public final class AuthDealBundle extends AuthBundle<DealBundle> {

	public AuthDealBundle(DealBundle bundle, byte[] signature) {
		super(bundle, signature);
	}

	@Override
	public Roster selectRoster(DkgConfig config) {
		return config.getOldNodes();
	}

	@Override
	public String getKind() {
		return "deal";
	}
}
