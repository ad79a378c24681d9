/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final output of a successful run: the local key share and the qualified set
 * of dealers whose contributions make up the distributed key.
 * 
 */
public class Result {

	private final DistKeyShare key;

	private final List<Node> qual;

	public Result(DistKeyShare key, List<Node> qual) {
		if (key == null) {
			throw new IllegalArgumentException("Result requires a key share");
		}
		this.key = key;
		this.qual = Collections.unmodifiableList(new ArrayList<Node>(qual));
	}

	public DistKeyShare getKey() {
		return key;
	}

	public List<Node> getQual() {
		return qual;
	}

	@Override
	public String toString() {
		return "Result [key=" + key + ", qual=" + qual + "]";
	}
}
