/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

/**
 * Broadcast channel connecting all participants of a run. A Board gives no
 * guarantee on ordering or exactly-once delivery, and a participant may receive
 * its own broadcasts.
 * 
 * Receiving is done by registering a {@link BoardListener}. Pushing and
 * delivering must not block on the receiver.
 * 
 */
public interface Board {

	public void pushDeals(AuthDealBundle bundle);

	public void pushResponses(AuthResponseBundle bundle);

	public void pushJustification(AuthJustifBundle bundle);

	/**
	 * Registers a listener for incoming envelopes. Registering the same
	 * listener twice has no effect.
	 * 
	 * @param listener
	 *            BoardListener to notify
	 */
	public void addBoardListener(BoardListener listener);

	/**
	 * Removes a listener, safe to call for listeners that are not registered
	 * 
	 * @param listener
	 *            BoardListener to remove
	 */
	public void removeBoardListener(BoardListener listener);
}
