/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import java.util.concurrent.CopyOnWriteArrayList;

import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

/**
 * Connects the {@link InMemoryBoard}s of several participants running in the
 * same process. Useful for simulations and tests where all nodes live on a
 * single machine. Every push is delivered synchronously to every connected
 * board, the sender's own board included.
 * 
 */
public class InMemoryNetwork {

	private final CopyOnWriteArrayList<InMemoryBoard> boards = new CopyOnWriteArrayList<InMemoryBoard>();

	/**
	 * Creates a new board connected to this network
	 * 
	 * @return InMemoryBoard
	 */
	public InMemoryBoard createBoard() {
		InMemoryBoard board = new InMemoryBoard(this);
		boards.add(board);
		return board;
	}

	/**
	 * Disconnects a board, it will no longer receive envelopes. Envelopes it
	 * pushes are still delivered to the others.
	 * 
	 * @param board
	 *            InMemoryBoard to disconnect
	 */
	public void disconnect(InMemoryBoard board) {
		boards.remove(board);
	}

	public int getBoardCount() {
		return boards.size();
	}

	void broadcast(AuthDealBundle bundle) {
		for (InMemoryBoard board : boards) {
			board.dealReceived(bundle);
		}
	}

	void broadcast(AuthResponseBundle bundle) {
		for (InMemoryBoard board : boards) {
			board.responseReceived(bundle);
		}
	}

	void broadcast(AuthJustifBundle bundle) {
		for (InMemoryBoard board : boards) {
			board.justificationReceived(bundle);
		}
	}
}
