/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dealer's answers to the complaints raised against its deal.
 * 
 */
public class JustificationBundle implements Bundle {

	private final int dealerIndex;

	private final List<Justification> justifications;

	private final List<byte[]> publicCoefficients;

	private final byte[] sessionId;

	public JustificationBundle(int dealerIndex, List<Justification> justifications, List<byte[]> publicCoefficients,
			byte[] sessionId) {
		this.dealerIndex = dealerIndex;
		this.justifications = Collections.unmodifiableList(new ArrayList<Justification>(justifications));
		this.publicCoefficients = Collections.unmodifiableList(new ArrayList<byte[]>(publicCoefficients));
		this.sessionId = sessionId.clone();
	}

	public int getDealerIndex() {
		return dealerIndex;
	}

	public List<Justification> getJustifications() {
		return justifications;
	}

	public List<byte[]> getPublicCoefficients() {
		return publicCoefficients;
	}

	@Override
	public byte[] getSessionId() {
		return sessionId.clone();
	}

	@Override
	public int getSenderIndex() {
		return dealerIndex;
	}

	@Override
	public byte[] hash() {
		BundleHasher hasher = new BundleHasher();
		hasher.update(dealerIndex);
		hasher.update(publicCoefficients);
		hasher.update(justifications.size());
		for (Justification justification : justifications) {
			hasher.update(justification.getShareIndex());
			hasher.update(justification.getShare());
		}
		hasher.update(sessionId);
		return hasher.digest();
	}

	@Override
	public String toString() {
		return "JustificationBundle [dealerIndex=" + dealerIndex + ", justifications=" + justifications.size() + "]";
	}
}
