/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The local output of a successful run: the commitments to the shared
 * polynomial and this participant's share of the distributed secret.
 * 
 */
public class DistKeyShare {

	private final List<byte[]> commits;

	private final int shareIndex;

	private final BigInteger share;

	public DistKeyShare(List<byte[]> commits, int shareIndex, BigInteger share) {
		if (commits.isEmpty()) {
			throw new IllegalArgumentException("A distributed key share needs at least one commitment");
		}
		this.commits = Collections.unmodifiableList(new ArrayList<byte[]>(commits));
		this.shareIndex = shareIndex;
		this.share = share;
	}

	/**
	 * Gets the distributed public key, which is the commitment to the constant
	 * term of the shared polynomial
	 * 
	 * @return byte array of the encoded public key
	 */
	public byte[] getPublicKey() {
		return commits.get(0).clone();
	}

	public List<byte[]> getCommits() {
		return commits;
	}

	public int getShareIndex() {
		return shareIndex;
	}

	public BigInteger getShare() {
		return share;
	}

	@Override
	public String toString() {
		return "DistKeyShare [shareIndex=" + shareIndex + ", commits=" + commits.size() + "]";
	}
}
