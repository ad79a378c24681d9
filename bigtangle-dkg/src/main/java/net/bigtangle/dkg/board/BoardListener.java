/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

/**
 * Receives the envelopes delivered by a {@link Board}, one callback per kind.
 * Implementations must return quickly and must not block.
 * 
 */
public interface BoardListener {

	public void dealReceived(AuthDealBundle bundle);

	public void responseReceived(AuthResponseBundle bundle);

	public void justificationReceived(AuthJustifBundle bundle);
}
