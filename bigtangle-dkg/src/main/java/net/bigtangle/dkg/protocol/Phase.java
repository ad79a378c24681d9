/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

/**
 * Phases of a run, in the order a {@link Phaser} emits them.
 * 
 */
public enum Phase {
	DEAL, RESPONSE, JUSTIFICATION, FINISH;

	/**
	 * @return the phase following this one, or null after FINISH
	 */
	public Phase next() {
		Phase[] phases = values();
		return ordinal() + 1 < phases.length ? phases[ordinal() + 1] : null;
	}
}
