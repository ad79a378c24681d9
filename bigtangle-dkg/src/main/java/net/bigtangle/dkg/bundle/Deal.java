/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import java.util.Arrays;

/**
 * A single share of a dealer's secret, encrypted for the participant at
 * shareIndex.
 * 
 */
public class Deal {

	private final int shareIndex;

	private final byte[] encryptedShare;

	public Deal(int shareIndex, byte[] encryptedShare) {
		this.shareIndex = shareIndex;
		this.encryptedShare = encryptedShare.clone();
	}

	public int getShareIndex() {
		return shareIndex;
	}

	public byte[] getEncryptedShare() {
		return encryptedShare.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Deal)) {
			return false;
		}
		Deal other = (Deal) o;
		return shareIndex == other.shareIndex && Arrays.equals(encryptedShare, other.encryptedShare);
	}

	@Override
	public int hashCode() {
		return 31 * shareIndex + Arrays.hashCode(encryptedShare);
	}

	@Override
	public String toString() {
		return "Deal [shareIndex=" + shareIndex + "]";
	}
}
