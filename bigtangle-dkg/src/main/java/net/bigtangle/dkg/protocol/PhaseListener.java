/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

/**
 * Notified by a {@link Phaser} each time a new phase starts. Must not block.
 * 
 */
public interface PhaseListener {

	public void phaseReached(Phase phase);
}
