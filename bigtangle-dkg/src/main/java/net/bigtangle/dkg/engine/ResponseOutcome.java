/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import net.bigtangle.dkg.bundle.JustificationBundle;

/**
 * What the engine returns after processing the responses: either the final
 * result, when no complaint needs answering, or the justifications this node
 * has to publish. Both may be absent, in which case there is nothing to send
 * and the run waits for the finish phase.
 * 
 */
public class ResponseOutcome {

	private static final ResponseOutcome NOTHING = new ResponseOutcome(null, null);

	private final Result result;

	private final JustificationBundle justification;

	private ResponseOutcome(Result result, JustificationBundle justification) {
		this.result = result;
		this.justification = justification;
	}

	public static ResponseOutcome finished(Result result) {
		if (result == null) {
			throw new IllegalArgumentException("A finished outcome needs a result");
		}
		return new ResponseOutcome(result, null);
	}

	public static ResponseOutcome justify(JustificationBundle justification) {
		if (justification == null) {
			return NOTHING;
		}
		return new ResponseOutcome(null, justification);
	}

	public static ResponseOutcome nothing() {
		return NOTHING;
	}

	public Result getResult() {
		return result;
	}

	public JustificationBundle getJustification() {
		return justification;
	}

	public boolean isFinished() {
		return result != null;
	}
}
