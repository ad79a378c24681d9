/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.board;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.bigtangle.dkg.TestKeys;
import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;

public class InMemoryBoardTest {

	private static class Recorder implements BoardListener {
		final List<AuthBundle<?>> received = new ArrayList<AuthBundle<?>>();

		@Override
		public void dealReceived(AuthDealBundle bundle) {
			received.add(bundle);
		}

		@Override
		public void responseReceived(AuthResponseBundle bundle) {
			received.add(bundle);
		}

		@Override
		public void justificationReceived(AuthJustifBundle bundle) {
			received.add(bundle);
		}
	}

	private InMemoryNetwork network;

	private InMemoryBoard first;

	private InMemoryBoard second;

	private Recorder firstRecorder;

	private Recorder secondRecorder;

	@Before
	public void setUp() {
		network = new InMemoryNetwork();
		first = network.createBoard();
		second = network.createBoard();
		firstRecorder = new Recorder();
		secondRecorder = new Recorder();
		first.addBoardListener(firstRecorder);
		second.addBoardListener(secondRecorder);
	}

	@Test
	public void pushReachesEveryBoardIncludingTheSender() {
		AuthDealBundle deal = new AuthDealBundle(TestKeys.deal(0), null);
		AuthResponseBundle resp = new AuthResponseBundle(TestKeys.response(1), null);
		AuthJustifBundle just = new AuthJustifBundle(TestKeys.justification(0), null);

		first.pushDeals(deal);
		second.pushResponses(resp);
		first.pushJustification(just);

		assertEquals(3, firstRecorder.received.size());
		assertEquals(3, secondRecorder.received.size());
		assertSame(deal, secondRecorder.received.get(0));
		assertSame(resp, firstRecorder.received.get(1));
		assertSame(just, secondRecorder.received.get(2));
	}

	@Test
	public void disconnectedBoardStopsReceiving() {
		network.disconnect(second);
		assertEquals(1, network.getBoardCount());

		second.pushDeals(new AuthDealBundle(TestKeys.deal(1), null));

		assertEquals(1, firstRecorder.received.size());
		assertEquals(0, secondRecorder.received.size());
	}

	@Test
	public void listenerIsRegisteredOnce() {
		first.addBoardListener(firstRecorder);
		assertEquals(1, first.getListenerCount());

		first.pushDeals(new AuthDealBundle(TestKeys.deal(0), null));
		assertEquals(1, firstRecorder.received.size());

		first.removeBoardListener(firstRecorder);
		first.pushDeals(new AuthDealBundle(TestKeys.deal(0), null));
		assertEquals(1, firstRecorder.received.size());
		assertEquals(2, secondRecorder.received.size());
	}
}
