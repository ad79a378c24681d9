/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

/**
 * Source of the phase schedule. Whatever policy decides when to move on (a
 * timer, an external consensus, the fill level of the buffers), a Phaser emits
 * {@link Phase#DEAL}, {@link Phase#RESPONSE}, {@link Phase#JUSTIFICATION} and
 * {@link Phase#FINISH} exactly once each and in that order, and never blocks
 * on its listeners, even after they have stopped running.
 * 
 */
public interface Phaser {

	public void addPhaseListener(PhaseListener listener);

	public void removePhaseListener(PhaseListener listener);
}
