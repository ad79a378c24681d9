/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.protocol;

import java.util.ArrayList;
import java.util.List;

import net.bigtangle.dkg.bundle.DealBundle;
import net.bigtangle.dkg.bundle.JustificationBundle;
import net.bigtangle.dkg.bundle.ResponseBundle;
import net.bigtangle.dkg.engine.DkgConfig;
import net.bigtangle.dkg.engine.KeyGenerationEngine;
import net.bigtangle.dkg.engine.KeyGenerationEngineFactory;
import net.bigtangle.dkg.engine.ResponseOutcome;
import net.bigtangle.dkg.engine.Result;
import net.bigtangle.dkg.exceptions.DKGException;

/**
 * Engine returning whatever the test configured, recording every call and the
 * batches it was given.
 * 
 */
public class ScriptedEngine implements KeyGenerationEngine, KeyGenerationEngineFactory {

	public boolean canIssue = true;

	public DealBundle deal;
	public ResponseBundle response;
	public ResponseOutcome responseOutcome = ResponseOutcome.nothing();
	public Result result;

	public DKGException dealError;
	public DKGException dealsError;
	public DKGException responsesError;
	public DKGException justificationsError;
	public RuntimeException dealsCrash;

	public DkgConfig config;

	public final List<String> calls = new ArrayList<String>();
	public List<DealBundle> receivedDeals;
	public List<ResponseBundle> receivedResponses;
	public List<JustificationBundle> receivedJustifications;

	@Override
	public KeyGenerationEngine create(DkgConfig config) throws DKGException {
		this.config = config;
		return this;
	}

	@Override
	public boolean canIssue() {
		return canIssue;
	}

	@Override
	public DealBundle deals() throws DKGException {
		calls.add("deals");
		if (dealError != null) {
			throw dealError;
		}
		return deal;
	}

	@Override
	public ResponseBundle processDeals(List<DealBundle> deals) throws DKGException {
		calls.add("processDeals");
		receivedDeals = deals;
		if (dealsError != null) {
			throw dealsError;
		}
		if (dealsCrash != null) {
			throw dealsCrash;
		}
		return response;
	}

	@Override
	public ResponseOutcome processResponses(List<ResponseBundle> responses) throws DKGException {
		calls.add("processResponses");
		receivedResponses = responses;
		if (responsesError != null) {
			throw responsesError;
		}
		return responseOutcome;
	}

	@Override
	public Result processJustifications(List<JustificationBundle> justifications) throws DKGException {
		calls.add("processJustifications");
		receivedJustifications = justifications;
		if (justificationsError != null) {
			throw justificationsError;
		}
		return result;
	}
}
