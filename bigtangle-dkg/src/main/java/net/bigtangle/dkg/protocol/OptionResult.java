/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import net.bigtangle.dkg.engine.Result;

/**
 * Outcome of a run. Exactly one of {@link #getResult()} and
 * {@link #getError()} is set.
 * 
 */
public class OptionResult {

	private final Result result;

	private final Exception error;

	private OptionResult(Result result, Exception error) {
		this.result = result;
		this.error = error;
	}

	public static OptionResult success(Result result) {
		if (result == null) {
			throw new IllegalArgumentException("A successful outcome needs a result");
		}
		return new OptionResult(result, null);
	}

	public static OptionResult failure(Exception error) {
		if (error == null) {
			throw new IllegalArgumentException("A failed outcome needs an error");
		}
		return new OptionResult(null, error);
	}

	public Result getResult() {
		return result;
	}

	public Exception getError() {
		return error;
	}

	public boolean isSuccess() {
		return result != null;
	}

	@Override
	public String toString() {
		return isSuccess() ? "OptionResult [result=" + result + "]" : "OptionResult [error=" + error + "]";
	}
}
