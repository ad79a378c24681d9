/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The responses of one share holder to every deal it processed.
 * 
 */
public class ResponseBundle implements Bundle {

	private final int shareIndex;

	private final List<Response> responses;

	private final byte[] sessionId;

	public ResponseBundle(int shareIndex, List<Response> responses, byte[] sessionId) {
		this.shareIndex = shareIndex;
		this.responses = Collections.unmodifiableList(new ArrayList<Response>(responses));
		this.sessionId = sessionId.clone();
	}

	public int getShareIndex() {
		return shareIndex;
	}

	public List<Response> getResponses() {
		return responses;
	}

	@Override
	public byte[] getSessionId() {
		return sessionId.clone();
	}

	@Override
	public int getSenderIndex() {
		return shareIndex;
	}

	@Override
	public byte[] hash() {
		BundleHasher hasher = new BundleHasher();
		hasher.update(shareIndex);
		hasher.update(responses.size());
		for (Response response : responses) {
			hasher.update(response.getDealerIndex());
			hasher.update(response.getStatus().ordinal());
		}
		hasher.update(sessionId);
		return hasher.digest();
	}

	@Override
	public String toString() {
		return "ResponseBundle [shareIndex=" + shareIndex + ", responses=" + responses + "]";
	}
}
