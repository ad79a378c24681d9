/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.exceptions;

/**
 * Base exception for failures of a distributed key generation run, thrown by
 * the key-generation engine and by the protocol around it
 * 
 */
public class DKGException extends Exception {

	private static final long serialVersionUID = 4471023958266013410L;

	public DKGException() {
	}

	public DKGException(String message) {
		super(message);
	}

	/**
	 * Wraps a failure of a collaborator, such as the JCA provider
	 * 
	 * @param cause
	 *            the underlying failure
	 */
	public DKGException(Throwable cause) {
		super(cause);
	}

	public DKGException(String message, Throwable cause) {
		super(message, cause);
	}
}
