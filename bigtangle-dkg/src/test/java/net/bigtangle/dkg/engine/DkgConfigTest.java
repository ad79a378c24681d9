/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import net.bigtangle.dkg.TestKeys;

public class DkgConfigTest {

	private TestKeys keys;

	@Before
	public void setUp() throws Exception {
		keys = new TestKeys(5);
	}

	@Test
	public void freshRunDefaults() {
		Roster roster = keys.roster();
		DkgConfig config = DkgConfig.builder().longterm(keys.get(0).getPrivate()).newNodes(roster).build();

		assertSame(roster, config.getOldNodes());
		assertEquals(3, config.getThreshold());
		assertEquals(3, config.getOldThreshold());
		assertEquals(0, config.getNonce().length);
		assertNull(config.getShare());
		assertFalse(config.isResharing());
	}

	@Test
	public void resharingKeepsBothRosters() {
		DkgConfig config = DkgConfig.builder().longterm(keys.get(2).getPrivate()).oldNodes(keys.roster(0, 3))
				.newNodes(keys.roster(2, 5)).threshold(3).oldThreshold(2)
				.publicCoeffs(Collections.singletonList(new byte[] { 1 })).build();

		assertEquals(3, config.getOldNodes().size());
		assertTrue(config.getNewNodes().contains(4));
		assertEquals(2, config.getOldThreshold());
		assertTrue(config.isResharing());
	}

	@Test
	public void minimumThresholdIsAMajority() {
		assertEquals(1, DkgConfig.minimumThreshold(1));
		assertEquals(2, DkgConfig.minimumThreshold(2));
		assertEquals(2, DkgConfig.minimumThreshold(3));
		assertEquals(3, DkgConfig.minimumThreshold(4));
	}

	@Test(expected = IllegalArgumentException.class)
	public void thresholdAboveRosterSizeIsRejected() {
		DkgConfig.builder().longterm(keys.get(0).getPrivate()).newNodes(keys.roster()).threshold(6).build();
	}

	@Test(expected = NullPointerException.class)
	public void longtermKeyIsRequired() {
		DkgConfig.builder().newNodes(keys.roster()).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyRosterIsRejected() {
		DkgConfig.builder().longterm(keys.get(0).getPrivate()).newNodes(new Roster(Collections.<Node> emptyList()))
				.build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void rosterRejectsDuplicateIndex() {
		new Roster(Arrays.asList(new Node(1, keys.get(0).getPublic()), new Node(1, keys.get(1).getPublic())));
	}

	@Test
	public void rosterLookup() {
		Roster roster = keys.roster(1, 3);

		assertEquals(keys.get(2).getPublic(), roster.getPublicKey(2));
		assertNull(roster.getPublicKey(0));
		assertEquals(1, roster.indexOf(keys.get(1).getPublic()));
	}
}
