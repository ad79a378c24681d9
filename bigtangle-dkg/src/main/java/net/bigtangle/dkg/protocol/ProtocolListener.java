/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.exceptions.BundleVerificationException;

/**
 * Observer of a run, for monitoring and diagnostics. Callbacks run on the
 * protocol thread and must be quick; exceptions they throw are logged and
 * otherwise ignored.
 * 
 */
public interface ProtocolListener {

	public default void phaseStarted(Phase phase) {
	}

	public default void bundleSent(AuthBundle<?> envelope) {
	}

	public default void bundleAccepted(AuthBundle<?> envelope) {
	}

	public default void bundleDropped(AuthBundle<?> envelope, BundleVerificationException reason) {
	}

	public default void finished(OptionResult outcome) {
	}
}
