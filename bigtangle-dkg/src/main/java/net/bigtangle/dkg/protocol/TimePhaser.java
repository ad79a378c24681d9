/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phaser that moves to the next phase after a fixed delay: emit DEAL, sleep,
 * emit RESPONSE, sleep, emit JUSTIFICATION, sleep, emit FINISH.
 * 
 * The delay is a {@link Sleeper} so that tests and simulations can replace
 * wall clock time. The schedule can only be run once.
 * 
 */
public class TimePhaser implements Phaser, Runnable {

	private static final Logger logger = LoggerFactory.getLogger(TimePhaser.class);

	/**
	 * Waits between two phases
	 */
	public interface Sleeper {
		public void sleep() throws InterruptedException;
	}

	private final CopyOnWriteArrayList<PhaseListener> listeners = new CopyOnWriteArrayList<PhaseListener>();

	private final Sleeper sleeper;

	private final AtomicBoolean started = new AtomicBoolean(false);

	/**
	 * Creates a TimePhaser waiting the given period between phases
	 * 
	 * @param period
	 *            long delay between phases, zero for no delay
	 * @param unit
	 *            TimeUnit of period
	 */
	public TimePhaser(final long period, final TimeUnit unit) {
		this(new Sleeper() {
			@Override
			public void sleep() throws InterruptedException {
				unit.sleep(period);
			}
		});
	}

	public TimePhaser(Sleeper sleeper) {
		if (sleeper == null) {
			throw new IllegalArgumentException("Sleeper cannot be null");
		}
		this.sleeper = sleeper;
	}

	@Override
	public void addPhaseListener(PhaseListener listener) {
		listeners.addIfAbsent(listener);
	}

	@Override
	public void removePhaseListener(PhaseListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Runs the schedule in the calling thread. If the thread is interrupted
	 * while sleeping no further phase is emitted.
	 */
	@Override
	public void run() {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("Phase schedule has already been run");
		}
		Phase phase = Phase.DEAL;
		while (phase != null) {
			emit(phase);
			phase = phase.next();
			if (phase != null) {
				try {
					sleeper.sleep();
				} catch (InterruptedException e) {
					logger.warn("Phase schedule interrupted before {}", phase);
					Thread.currentThread().interrupt();
					return;
				}
			}
		}
	}

	/**
	 * Runs the schedule on a new daemon thread
	 * 
	 * @return Thread running the schedule
	 */
	public Thread start() {
		Thread thread = new Thread(this, "TimePhaser");
		thread.setDaemon(true);
		thread.start();
		return thread;
	}

	private void emit(Phase phase) {
		logger.info("Moving to phase:{}", phase);
		for (PhaseListener listener : listeners) {
			try {
				listener.phaseReached(phase);
			} catch (RuntimeException e) {
				logger.warn("Phase listener failed on phase:{}", phase, e);
			}
		}
	}
}
