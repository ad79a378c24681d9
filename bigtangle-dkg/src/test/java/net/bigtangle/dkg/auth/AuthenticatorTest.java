/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.auth;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import net.bigtangle.dkg.TestKeys;
import net.bigtangle.dkg.bundle.AuthBundle;
import net.bigtangle.dkg.bundle.AuthDealBundle;
import net.bigtangle.dkg.bundle.AuthJustifBundle;
import net.bigtangle.dkg.bundle.AuthResponseBundle;
import net.bigtangle.dkg.bundle.ResponseBundle;
import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.exceptions.BundleVerificationException;

public class AuthenticatorTest {

	private TestKeys keys;

	private DkgConfig config;

	@Before
	public void setUp() throws Exception {
		keys = new TestKeys(3);
		// dealers {0, 1}, share holders {1, 2}
		config = DkgConfig.builder().longterm(keys.get(1).getPrivate()).oldNodes(keys.roster(0, 2))
				.newNodes(keys.roster(1, 3)).build();
	}

	private void assertRejected(Authenticator auth, AuthBundle<?> envelope) {
		try {
			auth.verify(envelope);
			fail("Expected " + envelope + " to be rejected");
		} catch (BundleVerificationException e) {
			// expected
		}
	}

	@Test
	public void withoutSchemeEveryEnvelopeIsAccepted() throws Exception {
		Authenticator auth = Authenticator.create(null, config);
		assertSame(NoAuthenticator.INSTANCE, auth);

		auth.verify(new AuthDealBundle(TestKeys.deal(42), new byte[] { 1 }));
		auth.verify(new AuthResponseBundle(TestKeys.response(-3), null));
		auth.verify(new AuthJustifBundle(TestKeys.justification(0), new byte[64]));
	}

	@Test
	public void withoutSchemeBundlesAreSealedUnsigned() throws Exception {
		Authenticator auth = Authenticator.create(null, config);

		assertFalse(auth.seal(TestKeys.deal(1)).isSigned());
		assertEquals(0, auth.seal(TestKeys.response(1)).getSignature().length);
		assertFalse(auth.seal(TestKeys.justification(1)).isSigned());
	}

	@Test
	public void sealedBundlesVerifyUnderTheSendersKey() throws Exception {
		Authenticator local = Authenticator.create(new ECDSAAuthScheme(), config);

		AuthDealBundle deal = local.seal(TestKeys.deal(1));
		AuthResponseBundle resp = local.seal(TestKeys.response(1));
		AuthJustifBundle just = local.seal(TestKeys.justification(1));

		assertTrue(deal.isSigned());
		local.verify(deal);
		local.verify(resp);
		local.verify(just);
	}

	@Test
	public void dealerMissingFromOldRosterIsRejected() throws Exception {
		DkgConfig nodeTwo = DkgConfig.builder().longterm(keys.get(2).getPrivate()).oldNodes(keys.roster(0, 2))
				.newNodes(keys.roster(1, 3)).build();
		Authenticator auth = Authenticator.create(new ECDSAAuthScheme(), nodeTwo);

		// node 2 signs correctly but is not a dealer
		assertRejected(auth, auth.seal(TestKeys.deal(2)));
		assertRejected(auth, auth.seal(TestKeys.justification(2)));
		auth.verify(auth.seal(TestKeys.response(2)));
	}

	@Test
	public void shareHolderMissingFromNewRosterIsRejected() throws Exception {
		ECDSAAuthScheme ecdsa = new ECDSAAuthScheme();
		Authenticator auth = Authenticator.create(ecdsa, config);
		ResponseBundle resp = TestKeys.response(0);

		assertRejected(auth, new AuthResponseBundle(resp, ecdsa.sign(keys.get(0).getPrivate(), resp.hash())));
	}

	@Test
	public void wrongSignatureIsRejected() throws Exception {
		Authenticator auth = Authenticator.create(new ECDSAAuthScheme(), config);
		AuthDealBundle genuine = auth.seal(TestKeys.deal(1));

		// signature of node 1 on another bundle
		assertRejected(auth, new AuthDealBundle(TestKeys.deal(0), genuine.getSignature()));
		// no signature at all
		assertRejected(auth, new AuthDealBundle(TestKeys.deal(1), null));
		// garbage
		assertRejected(auth, new AuthDealBundle(TestKeys.deal(1), new byte[] { 0x30, 0x01, 0x00 }));
	}
}
