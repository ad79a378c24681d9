/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.bundle;

import java.math.BigInteger;
import java.util.List;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.Pack;

/**
 * Accumulates bundle fields into a SHA-256 digest. Integers are written big
 * endian, byte arrays are written with a length prefix so that adjacent fields
 * cannot be confused.
 * 
 */
public class BundleHasher {

	private final SHA256Digest digest = new SHA256Digest();

	public BundleHasher update(int value) {
		byte[] buf = Pack.intToBigEndian(value);
		digest.update(buf, 0, buf.length);
		return this;
	}

	public BundleHasher update(byte[] value) {
		update(value.length);
		digest.update(value, 0, value.length);
		return this;
	}

	public BundleHasher update(BigInteger value) {
		return update(value.toByteArray());
	}

	public BundleHasher update(List<byte[]> values) {
		update(values.size());
		for (byte[] value : values) {
			update(value);
		}
		return this;
	}

	public byte[] digest() {
		byte[] out = new byte[digest.getDigestSize()];
		digest.doFinal(out, 0);
		return out;
	}
}
