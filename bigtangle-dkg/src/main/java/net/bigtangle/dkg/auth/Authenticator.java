/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.auth;

import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;
import net.bigtangle.dkg.bundle.Bundle;
import net.bigtangle.dkg.bundle.DealBundle;
import net.bigtangle.dkg.bundle.JustificationBundle;
import net.bigtangle.dkg.bundle.ResponseBundle;
import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.exceptions.BundleVerificationException;
import net.bigtangle.dkg.exceptions.SigningException;

/**
 * Gate every bundle passes on its way to and from the board. Outbound bundles
 * are sealed into envelopes, inbound envelopes are verified before the
 * protocol buffers them.
 * 
 * Use {@link #create(AuthScheme, DkgConfig)} to get the implementation that
 * matches the configuration: without a scheme every envelope is accepted and
 * sealed with an empty signature.
 * 
 */
public abstract class Authenticator {

	/**
	 * Creates the authenticator for a run
	 * 
	 * @param scheme
	 *            AuthScheme to use, or null to disable authentication
	 * @param config
	 *            DkgConfig holding the rosters and the long-term key
	 * @return Authenticator
	 */
	public static Authenticator create(AuthScheme scheme, DkgConfig config) {
		if (scheme == null) {
			return NoAuthenticator.INSTANCE;
		}
		return new SchemeAuthenticator(scheme, config);
	}

	/**
	 * Checks that the envelope was signed by the participant it claims to come
	 * from
	 * 
	 * @param envelope
	 *            AuthBundle received from the board
	 * @throws BundleVerificationException
	 *             if the sender is unknown or the signature is invalid
	 */
	public abstract void verify(AuthBundle<?> envelope) throws BundleVerificationException;

	/**
	 * Computes the detached signature for an outbound bundle
	 * 
	 * @param bundle
	 *            Bundle to sign
	 * @return byte array of the signature
	 * @throws SigningException
	 */
	protected abstract byte[] sign(Bundle bundle) throws SigningException;

	public AuthDealBundle seal(DealBundle bundle) throws SigningException {
		return new AuthDealBundle(bundle, sign(bundle));
	}

	public AuthResponseBundle seal(ResponseBundle bundle) throws SigningException {
		return new AuthResponseBundle(bundle, sign(bundle));
	}

	public AuthJustifBundle seal(JustificationBundle bundle) throws SigningException {
		return new AuthJustifBundle(bundle, sign(bundle));
	}
}
