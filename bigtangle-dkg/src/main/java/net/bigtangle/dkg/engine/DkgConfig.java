/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of one key generation run as seen by the engine: who takes
 * part, the local long-term key and the thresholds.
 * 
 * A fresh key generation uses the same roster as old and new nodes. A
 * resharing run moves an existing distributed key from the old roster to the
 * new one; dealers then also need their previous share, and share holders that
 * were not part of the old group need the public commitments of the old key.
 * 
 */
public class DkgConfig {

	private final PrivateKey longterm;

	private final Roster oldNodes;

	private final Roster newNodes;

	private final int threshold;

	private final int oldThreshold;

	private final byte[] nonce;

	private final DistKeyShare share;

	private final List<byte[]> publicCoeffs;

	private DkgConfig(Builder builder) {
		this.longterm = checkNotNull(builder.longterm, "long-term private key is required");
		this.newNodes = checkNotNull(builder.newNodes, "new roster is required");
		checkArgument(newNodes.size() > 0, "new roster cannot be empty");
		this.oldNodes = builder.oldNodes == null ? newNodes : builder.oldNodes;
		checkArgument(oldNodes.size() > 0, "old roster cannot be empty");
		this.threshold = builder.threshold == 0 ? minimumThreshold(newNodes.size()) : builder.threshold;
		checkArgument(threshold > 0 && threshold <= newNodes.size(), "threshold %s out of range for %s nodes",
				threshold, newNodes.size());
		this.oldThreshold = builder.oldThreshold == 0 ? minimumThreshold(oldNodes.size()) : builder.oldThreshold;
		checkArgument(oldThreshold > 0 && oldThreshold <= oldNodes.size(),
				"old threshold %s out of range for %s nodes", oldThreshold, oldNodes.size());
		this.nonce = builder.nonce == null ? new byte[0] : builder.nonce.clone();
		this.share = builder.share;
		this.publicCoeffs = builder.publicCoeffs == null ? null
				: Collections.unmodifiableList(new ArrayList<byte[]>(builder.publicCoeffs));
	}

	/**
	 * Smallest threshold that still prevents a minority from reconstructing
	 * the secret
	 * 
	 * @param n
	 *            int number of participants
	 * @return int threshold
	 */
	public static int minimumThreshold(int n) {
		return (n >> 1) + 1;
	}

	public static Builder builder() {
		return new Builder();
	}

	public PrivateKey getLongterm() {
		return longterm;
	}

	public Roster getOldNodes() {
		return oldNodes;
	}

	public Roster getNewNodes() {
		return newNodes;
	}

	public int getThreshold() {
		return threshold;
	}

	public int getOldThreshold() {
		return oldThreshold;
	}

	public byte[] getNonce() {
		return nonce.clone();
	}

	/**
	 * @return previous DistKeyShare of this node when resharing, or null
	 */
	public DistKeyShare getShare() {
		return share;
	}

	/**
	 * @return commitments of the key being reshared, or null
	 */
	public List<byte[]> getPublicCoeffs() {
		return publicCoeffs;
	}

	public boolean isResharing() {
		return share != null || publicCoeffs != null;
	}

	public static class Builder {
		private PrivateKey longterm;
		private Roster oldNodes;
		private Roster newNodes;
		private int threshold;
		private int oldThreshold;
		private byte[] nonce;
		private DistKeyShare share;
		private List<byte[]> publicCoeffs;

		private Builder() {
		}

		public Builder longterm(PrivateKey longterm) {
			this.longterm = longterm;
			return this;
		}

		public Builder oldNodes(Roster oldNodes) {
			this.oldNodes = oldNodes;
			return this;
		}

		public Builder newNodes(Roster newNodes) {
			this.newNodes = newNodes;
			return this;
		}

		public Builder threshold(int threshold) {
			this.threshold = threshold;
			return this;
		}

		public Builder oldThreshold(int oldThreshold) {
			this.oldThreshold = oldThreshold;
			return this;
		}

		public Builder nonce(byte[] nonce) {
			this.nonce = nonce;
			return this;
		}

		public Builder share(DistKeyShare share) {
			this.share = share;
			return this;
		}

		public Builder publicCoeffs(List<byte[]> publicCoeffs) {
			this.publicCoeffs = publicCoeffs;
			return this;
		}

		public DkgConfig build() {
			return new DkgConfig(this);
		}
	}
}
