/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All deals a dealer sends in one run, one per share holder, together with the
 * public commitments to the dealer's polynomial.
 * 
 */
public class DealBundle implements Bundle {

	private final int dealerIndex;

	private final List<Deal> deals;

	/**
	 * Commitments to the coefficients of the dealer's secret polynomial, lowest
	 * degree first
	 */
	private final List<byte[]> publicCoefficients;

	private final byte[] sessionId;

	public DealBundle(int dealerIndex, List<Deal> deals, List<byte[]> publicCoefficients, byte[] sessionId) {
		this.dealerIndex = dealerIndex;
		this.deals = Collections.unmodifiableList(new ArrayList<Deal>(deals));
		this.publicCoefficients = Collections.unmodifiableList(new ArrayList<byte[]>(publicCoefficients));
		this.sessionId = sessionId.clone();
	}

	public int getDealerIndex() {
		return dealerIndex;
	}

	public List<Deal> getDeals() {
		return deals;
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
		hasher.update(deals.size());
		for (Deal deal : deals) {
			hasher.update(deal.getShareIndex());
			hasher.update(deal.getEncryptedShare());
		}
		hasher.update(sessionId);
		return hasher.digest();
	}

	@Override
	public String toString() {
		return "DealBundle [dealerIndex=" + dealerIndex + ", deals=" + deals.size() + "]";
	}
}
