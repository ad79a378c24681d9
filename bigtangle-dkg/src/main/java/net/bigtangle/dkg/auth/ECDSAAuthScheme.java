/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.auth;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import net.bigtangle.dkg.exceptions.BundleVerificationException;
import net.bigtangle.dkg.exceptions.SigningException;

/**
 * ECDSA over secp256k1 with SHA-256, backed by the BouncyCastle provider.
 * 
 */
public class ECDSAAuthScheme implements AuthScheme {

	public static final String CURVE = "secp256k1";

	public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

	static {
		if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
			Security.addProvider(new BouncyCastleProvider());
		}
	}

	@Override
	public byte[] sign(PrivateKey privateKey, byte[] message) throws SigningException {
		try {
			Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
			signer.initSign(privateKey);
			signer.update(message);
			return signer.sign();
		} catch (GeneralSecurityException | IllegalArgumentException e) {
			throw new SigningException("Exception signing message", e);
		}
	}

	@Override
	public void verify(PublicKey publicKey, byte[] message, byte[] signature) throws BundleVerificationException {
		boolean valid;
		try {
			Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
			verifier.initVerify(publicKey);
			verifier.update(message);
			valid = verifier.verify(signature);
		} catch (GeneralSecurityException | IllegalArgumentException e) {
			// malformed DER or a key of the wrong type
			throw new BundleVerificationException("Signature could not be checked", e);
		}
		if (!valid) {
			throw new BundleVerificationException("Signature does not match");
		}
	}

	/**
	 * Generates a new long-term key pair on {@link #CURVE}
	 * 
	 * @param rand
	 *            SecureRandom to use
	 * @return KeyPair
	 * @throws GeneralSecurityException
	 */
	public static KeyPair generateKeyPair(SecureRandom rand) throws GeneralSecurityException {
		KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
		generator.initialize(new ECGenParameterSpec(CURVE), rand);
		return generator.generateKeyPair();
	}

	/**
	 * Decodes a public key from its X.509 encoding, as produced by
	 * {@link PublicKey#getEncoded()}
	 * 
	 * @param encoded
	 *            byte array of the encoded key
	 * @return PublicKey
	 * @throws GeneralSecurityException
	 */
	public static PublicKey decodePublicKey(byte[] encoded) throws GeneralSecurityException {
		KeyFactory factory = KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
		return factory.generatePublic(new X509EncodedKeySpec(encoded));
	}
}
