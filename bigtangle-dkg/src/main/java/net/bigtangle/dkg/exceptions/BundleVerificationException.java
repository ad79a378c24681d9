/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.exceptions;

/**
 * Thrown when an inbound bundle fails authentication, either because its
 * sender index is not in the roster or because the signature does not match
 * 
 */
public class BundleVerificationException extends DKGException {

	private static final long serialVersionUID = 6120447120964271658L;

	public BundleVerificationException(String message) {
		super(message);
	}

	public BundleVerificationException(String message, Throwable cause) {
		super(message, cause);
	}
}
