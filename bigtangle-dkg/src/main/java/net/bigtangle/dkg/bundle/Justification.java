/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;

/**
 * A share revealed in the clear by a dealer, answering a complaint raised by
 * the participant at shareIndex.
 * 
 */
public class Justification {

	private final int shareIndex;

	private final BigInteger share;

	public Justification(int shareIndex, BigInteger share) {
		this.shareIndex = shareIndex;
		this.share = checkNotNull(share, "revealed share is required");
	}

	public int getShareIndex() {
		return shareIndex;
	}

	public BigInteger getShare() {
		return share;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Justification)) {
			return false;
		}
		Justification other = (Justification) o;
		return shareIndex == other.shareIndex && share.equals(other.share);
	}

	@Override
	public int hashCode() {
		return 31 * shareIndex + share.hashCode();
	}

	@Override
	public String toString() {
		return "Justification [shareIndex=" + shareIndex + "]";
	}
}
