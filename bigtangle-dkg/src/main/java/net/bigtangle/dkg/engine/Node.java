/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import java.security.PublicKey;

/**
 * A participant: its index in a roster and its long-term public key.
 * 
 */
public class Node {

	private final int index;

	private final PublicKey publicKey;

	public Node(int index, PublicKey publicKey) {
		if (index < 0) {
			throw new IllegalArgumentException("Node index cannot be negative: " + index);
		}
		if (publicKey == null) {
			throw new IllegalArgumentException("Node " + index + " has no public key");
		}
		this.index = index;
		this.publicKey = publicKey;
	}

	public int getIndex() {
		return index;
	}

	public PublicKey getPublicKey() {
		return publicKey;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Node)) {
			return false;
		}
		Node other = (Node) o;
		return index == other.index && publicKey.equals(other.publicKey);
	}

	@Override
	public int hashCode() {
		return 31 * index + publicKey.hashCode();
	}

	@Override
	public String toString() {
		return "Node [index=" + index + "]";
	}
}
