/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A participant's verdict on the deal it received from one dealer.
 * 
 */
public class Response {

	public enum Status {
		SUCCESS, COMPLAINT
	}

	private final int dealerIndex;

	private final Status status;

	public Response(int dealerIndex, Status status) {
		this.dealerIndex = dealerIndex;
		this.status = checkNotNull(status, "response status is required");
	}

	public int getDealerIndex() {
		return dealerIndex;
	}

	public Status getStatus() {
		return status;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Response)) {
			return false;
		}
		Response other = (Response) o;
		return dealerIndex == other.dealerIndex && status == other.status;
	}

	@Override
	public int hashCode() {
		return 31 * dealerIndex + status.hashCode();
	}

	@Override
	public String toString() {
		return "Response [dealerIndex=" + dealerIndex + ", status=" + status + "]";
	}
}
