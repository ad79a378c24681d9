/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

/**
 * Base class for boards, holding the registered listeners and notifying them
 * of received envelopes. A board implementation only has to provide the push
 * side and call the matching received method when an envelope arrives.
 * 
 */
public abstract class AbstractBoard implements Board {

	private static final Logger logger = LoggerFactory.getLogger(AbstractBoard.class);

	/**
	 * Concurrent list of registered listeners
	 */
	private final CopyOnWriteArrayList<BoardListener> listeners = new CopyOnWriteArrayList<BoardListener>();

	@Override
	public void addBoardListener(BoardListener listener) {
		listeners.addIfAbsent(listener);
	}

	@Override
	public void removeBoardListener(BoardListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Notifies all listeners of a received deal
	 * 
	 * @param bundle
	 *            AuthDealBundle that has been received
	 */
	public void dealReceived(AuthDealBundle bundle) {
		logger.debug("Received {}", bundle);
		for (BoardListener listener : listeners) {
			listener.dealReceived(bundle);
		}
	}

	/**
	 * Notifies all listeners of a received response
	 * 
	 * @param bundle
	 *            AuthResponseBundle that has been received
	 */
	public void responseReceived(AuthResponseBundle bundle) {
		logger.debug("Received {}", bundle);
		for (BoardListener listener : listeners) {
			listener.responseReceived(bundle);
		}
	}

	/**
	 * Notifies all listeners of a received justification
	 * 
	 * @param bundle
	 *            AuthJustifBundle that has been received
	 */
	public void justificationReceived(AuthJustifBundle bundle) {
		logger.debug("Received {}", bundle);
		for (BoardListener listener : listeners) {
			listener.justificationReceived(bundle);
		}
	}

	public int getListenerCount() {
		return listeners.size();
	}
}
