/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.exceptions;

/**
 * Thrown when an outbound bundle cannot be signed with the local long-term key.
 * Fatal to the run that tried to send it
 * 
 */
public class SigningException extends DKGException {

	private static final long serialVersionUID = -2207718450184219733L;

	public SigningException(String message) {
		super(message);
	}

	/**
	 * @param message
	 *            what could not be signed
	 * @param cause
	 *            provider error, for example an invalid key
	 */
	public SigningException(String message, Throwable cause) {
		super(message, cause);
	}
}
