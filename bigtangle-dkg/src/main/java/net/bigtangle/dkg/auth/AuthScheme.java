/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.auth;

import java.security.PrivateKey;
import java.security.PublicKey;

import net.bigtangle.dkg.exceptions.BundleVerificationException;
import net.bigtangle.dkg.exceptions.SigningException;

/**
 * Signature scheme used to authenticate bundles on the board.
 * 
 */
public interface AuthScheme {

	/**
	 * Signs a message with a long-term private key
	 * 
	 * @param privateKey
	 *            PrivateKey to sign with
	 * @param message
	 *            byte array to sign
	 * @return byte array containing the signature
	 * @throws SigningException
	 */
	public byte[] sign(PrivateKey privateKey, byte[] message) throws SigningException;

	/**
	 * Verifies a signature, returning normally if it is valid
	 * 
	 * @param publicKey
	 *            PublicKey of the claimed signer
	 * @param message
	 *            byte array that was signed
	 * @param signature
	 *            byte array of the signature
	 * @throws BundleVerificationException
	 *             if the signature is not valid
	 */
	public void verify(PublicKey publicKey, byte[] message, byte[] signature) throws BundleVerificationException;
}
