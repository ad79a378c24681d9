/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class TimePhaserTest {

	private static class Recorder implements PhaseListener {
		final List<Phase> phases = Collections.synchronizedList(new ArrayList<Phase>());

		@Override
		public void phaseReached(Phase phase) {
			phases.add(phase);
		}
	}

	@Test
	public void emitsEveryPhaseOnceInOrder() {
		final AtomicInteger sleeps = new AtomicInteger();
		TimePhaser phaser = new TimePhaser(new TimePhaser.Sleeper() {
			@Override
			public void sleep() {
				sleeps.incrementAndGet();
			}
		});
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);

		phaser.run();

		assertEquals(Arrays.asList(Phase.DEAL, Phase.RESPONSE, Phase.JUSTIFICATION, Phase.FINISH), recorder.phases);
		assertEquals(3, sleeps.get());
	}

	@Test
	public void failingListenerDoesNotStopTheSchedule() {
		TimePhaser phaser = new TimePhaser(0, TimeUnit.MILLISECONDS);
		phaser.addPhaseListener(new PhaseListener() {
			@Override
			public void phaseReached(Phase phase) {
				throw new IllegalStateException("listener bug");
			}
		});
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);

		phaser.run();

		assertEquals(Arrays.asList(Phase.values()), recorder.phases);
	}

	@Test
	public void scheduleRunsOnlyOnce() {
		TimePhaser phaser = new TimePhaser(0, TimeUnit.MILLISECONDS);
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);
		phaser.run();
		try {
			phaser.run();
			fail("Expected IllegalStateException");
		} catch (IllegalStateException e) {
			// expected
		}
		assertEquals(4, recorder.phases.size());
	}

	@Test
	public void interruptedSleepStopsTheSchedule() {
		TimePhaser phaser = new TimePhaser(new TimePhaser.Sleeper() {
			@Override
			public void sleep() throws InterruptedException {
				throw new InterruptedException();
			}
		});
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);

		phaser.run();

		assertEquals(Collections.singletonList(Phase.DEAL), recorder.phases);
		// run restores the interrupt flag, clear it for the next test
		assertTrue(Thread.interrupted());
	}

	@Test
	public void startRunsOnItsOwnThread() throws Exception {
		TimePhaser phaser = new TimePhaser(1, TimeUnit.MILLISECONDS);
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);

		Thread thread = phaser.start();
		thread.join(5000);

		assertEquals(Arrays.asList(Phase.values()), recorder.phases);
	}

	@Test
	public void removedListenerIsNotNotified() {
		TimePhaser phaser = new TimePhaser(0, TimeUnit.MILLISECONDS);
		Recorder recorder = new Recorder();
		phaser.addPhaseListener(recorder);
		phaser.addPhaseListener(recorder);
		phaser.removePhaseListener(recorder);

		phaser.run();

		assertTrue(recorder.phases.isEmpty());
	}
}
