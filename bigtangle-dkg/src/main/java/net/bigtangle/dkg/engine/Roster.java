/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ordered mapping from participant index to long-term public key. A run uses
 * two of them: the old roster, whose members deal, and the new roster, whose
 * members receive shares. For a fresh key generation both are the same.
 * 
 */
public class Roster {

	private final SortedMap<Integer, Node> nodes = new TreeMap<Integer, Node>();

	/**
	 * Creates a roster from the given nodes
	 * 
	 * @param members
	 *            List of Nodes, indexes must be unique
	 * @throws IllegalArgumentException
	 *             if two nodes share an index
	 */
	public Roster(List<Node> members) {
		for (Node node : members) {
			if (nodes.put(node.getIndex(), node) != null) {
				throw new IllegalArgumentException("Duplicate node index in roster: " + node.getIndex());
			}
		}
	}

	/**
	 * Resolves an index to the public key registered for it
	 * 
	 * @param index
	 *            int participant index
	 * @return PublicKey or null if the index is not in this roster
	 */
	public PublicKey getPublicKey(int index) {
		Node node = nodes.get(index);
		return node == null ? null : node.getPublicKey();
	}

	/**
	 * Finds the index registered for a public key
	 * 
	 * @param publicKey
	 *            PublicKey to look for
	 * @return index or -1 if the key is not in this roster
	 */
	public int indexOf(PublicKey publicKey) {
		for (Node node : nodes.values()) {
			if (node.getPublicKey().equals(publicKey)) {
				return node.getIndex();
			}
		}
		return -1;
	}

	public boolean contains(int index) {
		return nodes.containsKey(index);
	}

	public List<Node> getNodes() {
		return Collections.unmodifiableList(new ArrayList<Node>(nodes.values()));
	}

	public int size() {
		return nodes.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Roster)) {
			return false;
		}
		return nodes.equals(((Roster) o).nodes);
	}

	@Override
	public int hashCode() {
		return nodes.hashCode();
	}

	@Override
	public String toString() {
		return "Roster " + nodes.keySet();
	}
}
