/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import java.security.PublicKey;

import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.bundle.Bundle;
import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.exceptions.BundleVerificationException;
import net.bigtangle.dkg.exceptions.SigningException;

/**
 * Authenticator backed by an {@link AuthScheme}. Senders are resolved in the
 * roster the envelope selects: the old roster for deals and justifications,
 * the new roster for responses.
 * 
 */
public class SchemeAuthenticator extends Authenticator {

	private final AuthScheme scheme;

	private final DkgConfig config;

	public SchemeAuthenticator(AuthScheme scheme, DkgConfig config) {
		this.scheme = checkNotNull(scheme);
		this.config = checkNotNull(config);
	}

	@Override
	public void verify(AuthBundle<?> envelope) throws BundleVerificationException {
		byte[] hash = envelope.getBundle().hash();
		PublicKey pub = envelope.selectRoster(config).getPublicKey(envelope.getSenderIndex());
		if (pub == null) {
			throw new BundleVerificationException("No node with index " + envelope.getSenderIndex());
		}
		scheme.verify(pub, hash, envelope.getSignature());
	}

	@Override
	protected byte[] sign(Bundle bundle) throws SigningException {
		return scheme.sign(config.getLongterm(), bundle.hash());
	}
}
