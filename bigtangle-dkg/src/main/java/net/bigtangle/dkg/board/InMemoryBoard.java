/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

/**
 * Board of one participant on an {@link InMemoryNetwork}. Pushing broadcasts to
 * every board on the network.
 * 
 */
public class InMemoryBoard extends AbstractBoard {

	private final InMemoryNetwork network;

	/**
	 * Created through {@link InMemoryNetwork#createBoard()}
	 * 
	 * @param network
	 *            InMemoryNetwork the board is connected to
	 */
	InMemoryBoard(InMemoryNetwork network) {
		this.network = network;
	}

	@Override
	public void pushDeals(AuthDealBundle bundle) {
		network.broadcast(bundle);
	}

	@Override
	public void pushResponses(AuthResponseBundle bundle) {
		network.broadcast(bundle);
	}

	@Override
	public void pushJustification(AuthJustifBundle bundle) {
		network.broadcast(bundle);
	}
}
