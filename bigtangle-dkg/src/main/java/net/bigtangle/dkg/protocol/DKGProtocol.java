/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Functions;

import net.bigtangle.dkg.auth.Authenticator;
import net.bigtangle.dkg.board.Board;
import net.bigtangle.dkg.board.BoardListener;
import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;
import net.bigtangle.dkg.bundle.Bundle;
import net.bigtangle.dkg.bundle.DealBundle;
import net.bigtangle.dkg.bundle.JustificationBundle;
import net.bigtangle.dkg.bundle.ResponseBundle;
import net.bigtangle.dkg.engine.KeyGenerationEngine;
import net.bigtangle.dkg.engine.KeyGenerationEngineFactory;
import net.bigtangle.dkg.engine.ResponseOutcome;
import net.bigtangle.dkg.engine.Result;
import net.bigtangle.dkg.exceptions.BundleVerificationException;
import net.bigtangle.dkg.exceptions.DKGException;
import net.bigtangle.dkg.exceptions.ProtocolCancelledException;

/**
 * Runs one distributed key generation between the participants of a
 * {@link Board}, following the schedule of a {@link Phaser}.
 * 
 * The protocol is a single consumer event loop. Phase signals, the three kinds
 * of received envelopes and cancellation requests are all queued as events in
 * arrival order, and the thread inside {@link #call()} handles them one at a
 * time. Received envelopes are authenticated and buffered; at each phase
 * boundary the buffer of the previous phase is handed to the
 * {@link KeyGenerationEngine}, whatever it contains at that point. Phases never
 * wait for missing participants.
 * 
 * <ul>
 * <li>DEAL: if this node is a dealer, sign and push its deal bundle</li>
 * <li>RESPONSE: process the buffered deals, sign and push the response if there
 * is one</li>
 * <li>JUSTIFICATION: process the buffered responses. Either the run is finished
 * right away, or the justification, if any, is signed and pushed</li>
 * <li>FINISH: process the buffered justifications, which ends the run</li>
 * </ul>
 * 
 * Any engine or signing failure ends the run with an error. Envelopes that fail
 * authentication are dropped and the run carries on. Exactly one
 * {@link OptionResult} is produced per run, returned by {@link #call()} and
 * available through {@link #waitEnd()}.
 * 
 */
public class DKGProtocol implements Callable<OptionResult>, BoardListener, PhaseListener {

	/**
	 * Logger
	 */
	private static final Logger logger = LoggerFactory.getLogger(DKGProtocol.class);

	/**
	 * Something for the protocol thread to do. Returns false once the run has
	 * ended.
	 */
	private interface Event {
		boolean process();
	}

	private final Board board;

	private final Phaser phaser;

	private final KeyGenerationEngine dkg;

	private final ProtocolConfig conf;

	private final Authenticator auth;

	/**
	 * Whether this node deals, fixed at construction
	 */
	private final boolean canIssue;

	/**
	 * Events from all sources, in arrival order
	 */
	private final LinkedBlockingDeque<Event> events = new LinkedBlockingDeque<Event>();

	/**
	 * Single slot for the outcome of the run
	 */
	private final CompletableFuture<OptionResult> res = new CompletableFuture<OptionResult>();

	private final CopyOnWriteArrayList<ProtocolListener> listeners = new CopyOnWriteArrayList<ProtocolListener>();

	private final AtomicBoolean started = new AtomicBoolean(false);

	/**
	 * Guarded by events. Once set nothing more is queued.
	 */
	private volatile boolean finished = false;

	/**
	 * The outcome written by the protocol thread
	 */
	private volatile OptionResult outcome = null;

	// Only touched by the protocol thread
	private final List<DealBundle> deals = new ArrayList<DealBundle>();
	private final List<ResponseBundle> resps = new ArrayList<ResponseBundle>();
	private final List<JustificationBundle> justifs = new ArrayList<JustificationBundle>();
	private Phase currentPhase = null;

	/**
	 * Creates the protocol and its engine, and subscribes to the board and the
	 * phaser. Envelopes and phases arriving before {@link #call()} are queued.
	 * 
	 * @param conf
	 *            ProtocolConfig of the run
	 * @param board
	 *            Board connecting the participants
	 * @param phaser
	 *            Phaser providing the schedule, not yet started
	 * @param engineFactory
	 *            KeyGenerationEngineFactory creating the engine for this run
	 * @throws DKGException
	 *             if the engine cannot be created
	 */
	public DKGProtocol(ProtocolConfig conf, Board board, Phaser phaser, KeyGenerationEngineFactory engineFactory)
			throws DKGException {
		this.conf = checkNotNull(conf);
		this.board = checkNotNull(board);
		this.phaser = checkNotNull(phaser);
		this.dkg = engineFactory.create(conf.getDkgConfig());
		if (this.dkg == null) {
			throw new DKGException("Engine factory did not create an engine");
		}
		this.canIssue = dkg.canIssue();
		this.auth = Authenticator.create(conf.getAuth(), conf.getDkgConfig());
		board.addBoardListener(this);
		phaser.addPhaseListener(this);
	}

	public void addProtocolListener(ProtocolListener listener) {
		listeners.addIfAbsent(listener);
	}

	public void removeProtocolListener(ProtocolListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Runs the event loop in the calling thread until the run ends
	 * 
	 * @return OptionResult of the run
	 * @throws IllegalStateException
	 *             if the protocol has already been started
	 */
	@Override
	public OptionResult call() {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("Protocol has already been started");
		}
		logger.info("Starting protocol, dealer:{}, authenticated:{}", canIssue, conf.getAuth() != null);
		try {
			boolean running = true;
			while (running) {
				running = events.take().process();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			complete(OptionResult.failure(new ProtocolCancelledException("Protocol was interrupted", e)));
		} catch (RuntimeException e) {
			logger.error("Protocol loop failed in phase:{}", currentPhase, e);
			complete(OptionResult.failure(new DKGException("Protocol loop failed", e)));
		} finally {
			if (outcome == null) {
				complete(OptionResult.failure(new DKGException("Protocol stopped without an outcome")));
			}
			synchronized (events) {
				finished = true;
			}
			board.removeBoardListener(this);
			phaser.removePhaseListener(this);
			synchronized (events) {
				events.clear();
			}
		}
		return outcome;
	}

	/**
	 * Gets the future outcome of the run. It completes exactly once, when the
	 * run ends. Each call returns a new view, cancelling or completing it has
	 * no effect on the run.
	 * 
	 * @return Future of the OptionResult
	 */
	public Future<OptionResult> waitEnd() {
		return res.thenApply(Functions.<OptionResult> identity());
	}

	/**
	 * Requests the run to stop. The request is queued behind events that have
	 * already arrived; when handled the run ends with a
	 * {@link ProtocolCancelledException}. No effect on a finished run.
	 */
	public void cancel() {
		enqueue(new Event() {
			@Override
			public boolean process() {
				logger.warn("Protocol cancelled in phase:{}", currentPhase);
				return fail(new ProtocolCancelledException("Protocol was cancelled"));
			}
		});
	}

	public boolean isCanIssue() {
		return canIssue;
	}

	@Override
	public void phaseReached(final Phase phase) {
		enqueue(new Event() {
			@Override
			public boolean process() {
				return onPhase(phase);
			}
		});
	}

	@Override
	public void dealReceived(final AuthDealBundle bundle) {
		enqueue(new Event() {
			@Override
			public boolean process() {
				buffer(bundle, deals);
				return true;
			}
		});
	}

	@Override
	public void responseReceived(final AuthResponseBundle bundle) {
		enqueue(new Event() {
			@Override
			public boolean process() {
				buffer(bundle, resps);
				return true;
			}
		});
	}

	@Override
	public void justificationReceived(final AuthJustifBundle bundle) {
		enqueue(new Event() {
			@Override
			public boolean process() {
				buffer(bundle, justifs);
				return true;
			}
		});
	}

	private void enqueue(Event event) {
		synchronized (events) {
			if (!finished) {
				events.add(event);
			}
		}
	}

	private boolean onPhase(Phase phase) {
		if (currentPhase != null && phase.compareTo(currentPhase) <= 0) {
			logger.warn("Ignoring phase:{}, already in phase:{}", phase, currentPhase);
			return true;
		}
		currentPhase = phase;
		logger.info("Protocol entering phase:{}", phase);
		for (ProtocolListener listener : listeners) {
			try {
				listener.phaseStarted(phase);
			} catch (RuntimeException e) {
				logger.warn("Protocol listener failed", e);
			}
		}
		switch (phase) {
		case DEAL:
			return sendDeals();
		case RESPONSE:
			return sendResponses();
		case JUSTIFICATION:
			return sendJustifications();
		case FINISH:
			return finish();
		default:
			throw new IllegalStateException("Unknown phase " + phase);
		}
	}

	private <B extends Bundle> void buffer(AuthBundle<B> envelope, List<B> buffer) {
		BundleVerificationException failure = null;
		try {
			auth.verify(envelope);
		} catch (BundleVerificationException e) {
			failure = e;
		} catch (RuntimeException e) {
			failure = new BundleVerificationException("Malformed envelope", e);
		}
		if (failure != null) {
			logger.warn("Dropping {}: {}", envelope, failure.getMessage());
			for (ProtocolListener listener : listeners) {
				try {
					listener.bundleDropped(envelope, failure);
				} catch (RuntimeException le) {
					logger.warn("Protocol listener failed", le);
				}
			}
			return;
		}
		buffer.add(envelope.getBundle());
		logger.debug("Accepted {}", envelope);
		for (ProtocolListener listener : listeners) {
			try {
				listener.bundleAccepted(envelope);
			} catch (RuntimeException e) {
				logger.warn("Protocol listener failed", e);
			}
		}
	}

	private boolean sendDeals() {
		if (!canIssue) {
			logger.info("Not a dealer, no deal to send");
			return true;
		}
		try {
			DealBundle bundle = dkg.deals();
			if (bundle == null) {
				throw new DKGException("Engine produced no deal bundle");
			}
			AuthDealBundle envelope = auth.seal(bundle);
			board.pushDeals(envelope);
			sent(envelope);
			return true;
		} catch (DKGException | RuntimeException e) {
			return fail(e);
		}
	}

	private boolean sendResponses() {
		try {
			ResponseBundle resp = dkg.processDeals(snapshot(deals));
			if (resp != null) {
				AuthResponseBundle envelope = auth.seal(resp);
				board.pushResponses(envelope);
				sent(envelope);
			} else {
				logger.info("No response to send");
			}
			return true;
		} catch (DKGException | RuntimeException e) {
			return fail(e);
		}
	}

	private boolean sendJustifications() {
		try {
			ResponseOutcome outcome = dkg.processResponses(snapshot(resps));
			if (outcome == null) {
				outcome = ResponseOutcome.nothing();
			}
			if (outcome.isFinished()) {
				logger.info("Protocol finished without justifications");
				complete(OptionResult.success(outcome.getResult()));
				return false;
			}
			JustificationBundle just = outcome.getJustification();
			if (just != null) {
				AuthJustifBundle envelope = auth.seal(just);
				board.pushJustification(envelope);
				sent(envelope);
			} else {
				logger.info("No justification to send");
			}
			return true;
		} catch (DKGException | RuntimeException e) {
			return fail(e);
		}
	}

	private boolean finish() {
		try {
			Result result = dkg.processJustifications(snapshot(justifs));
			if (result == null) {
				throw new DKGException("Engine finished without a result");
			}
			complete(OptionResult.success(result));
		} catch (DKGException | RuntimeException e) {
			fail(e);
		}
		return false;
	}

	private <B> List<B> snapshot(List<B> buffer) {
		return Collections.unmodifiableList(new ArrayList<B>(buffer));
	}

	private void sent(AuthBundle<?> envelope) {
		logger.info("Sent {}", envelope);
		for (ProtocolListener listener : listeners) {
			try {
				listener.bundleSent(envelope);
			} catch (RuntimeException e) {
				logger.warn("Protocol listener failed", e);
			}
		}
	}

	private boolean fail(Exception e) {
		logger.error("Protocol failed in phase:{}", currentPhase, e);
		complete(OptionResult.failure(e));
		return false;
	}

	private void complete(OptionResult outcome) {
		if (this.outcome != null) {
			logger.warn("Outcome already written, ignoring {}", outcome);
			return;
		}
		this.outcome = outcome;
		res.complete(outcome);
		finished = true;
		logger.info("Protocol done: {}", outcome);
		for (ProtocolListener listener : listeners) {
			try {
				listener.finished(outcome);
			} catch (RuntimeException e) {
				logger.warn("Protocol listener failed", e);
			}
		}
	}
}
