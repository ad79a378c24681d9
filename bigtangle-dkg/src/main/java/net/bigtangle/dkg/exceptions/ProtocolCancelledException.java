/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.exceptions;

/**
 * Outcome error of a run that was cancelled or interrupted before it
 * finished
 * 
 */
public class ProtocolCancelledException extends DKGException {

	private static final long serialVersionUID = 891643201457733087L;

	public ProtocolCancelledException(String message) {
		super(message);
	}

	public ProtocolCancelledException(String message, Throwable cause) {
		super(message, cause);
	}
}
