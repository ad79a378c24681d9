/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.engine.Roster;

/**
 * A bundle together with the detached signature of its sender. This is the
 * unit that is pushed to and received from the board.
 * 
 * The set of envelopes is closed: {@link AuthDealBundle},
 * {@link AuthResponseBundle} and {@link AuthJustifBundle}. Each one knows which
 * roster identifies its sender, so verification never has to inspect the
 * runtime type of the envelope.
 * 
 * @param <B>
 *            type of the wrapped bundle
 */
public abstract class AuthBundle<B extends Bundle> {

	private static final byte[] NO_SIGNATURE = new byte[0];

	private final B bundle;

	private final byte[] signature;

	AuthBundle(B bundle, byte[] signature) {
		if (bundle == null) {
			throw new IllegalArgumentException("Cannot create an envelope without a bundle");
		}
		this.bundle = bundle;
		this.signature = signature == null ? NO_SIGNATURE : signature.clone();
	}

	public B getBundle() {
		return bundle;
	}

	/**
	 * Gets the detached signature over {@link Bundle#hash()}. Empty when the
	 * sender runs without an authentication scheme.
	 * 
	 * @return byte array of the signature, never null
	 */
	public byte[] getSignature() {
		return signature.clone();
	}

	public boolean isSigned() {
		return signature.length > 0;
	}

	public int getSenderIndex() {
		return bundle.getSenderIndex();
	}

	/**
	 * Selects the roster that holds the public key of the sender of this
	 * envelope
	 * 
	 * @param config
	 *            DkgConfig of the current run
	 * @return Roster to resolve {@link #getSenderIndex()} against
	 */
	public abstract Roster selectRoster(DkgConfig config);

	/**
	 * Short name of the envelope kind, used in logs and events
	 * 
	 * @return String kind
	 */
	public abstract String getKind();

	@Override
	public String toString() {
		return getKind() + " [sender=" + getSenderIndex() + ", signed=" + isSigned() + "]";
	}
}
