/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

/**
 * Payload produced and consumed by the key-generation engine. The protocol
 * treats bundles as opaque apart from the content digest, which is what gets
 * signed, and the index of the participant that sent it.
 * 
 */
public interface Bundle {

	/**
	 * Computes the digest of the bundle contents. Must be deterministic: two
	 * bundles with the same contents always return the same bytes.
	 * 
	 * @return byte array containing the SHA-256 digest
	 */
	public byte[] hash();

	/**
	 * Gets the index of the sender, the dealer index for deals and
	 * justifications and the share index for responses
	 * 
	 * @return int sender index
	 */
	public int getSenderIndex();

	/**
	 * Gets the session id this bundle belongs to
	 * 
	 * @return byte array of the session id
	 */
	public byte[] getSessionId();
}
