/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import java.util.List;

import net.bigtangle.dkg.bundle.DealBundle;
import net.bigtangle.dkg.bundle.JustificationBundle;
import net.bigtangle.dkg.bundle.ResponseBundle;
import net.bigtangle.dkg.exceptions.DKGException;

/**
 * Stateful cryptographic core of a distributed key generation. The protocol
 * drives it phase by phase, handing over whatever bundles were received so
 * far. Batches may be incomplete, contain duplicates or contain bundles the
 * engine itself produced; the engine is expected to tolerate all of these.
 * 
 * Any exception thrown by these methods is fatal to the run.
 * 
 */
public interface KeyGenerationEngine {

	/**
	 * Whether this participant deals, i.e. is a member of the old roster. Fixed
	 * for the lifetime of the engine.
	 * 
	 * @return true if this node produces a deal bundle
	 */
	public boolean canIssue();

	/**
	 * Produces this node's deal bundle. Called at most once, and only when
	 * {@link #canIssue()} is true.
	 * 
	 * @return DealBundle to broadcast
	 * @throws DKGException
	 */
	public DealBundle deals() throws DKGException;

	/**
	 * Processes the deals received during the deal phase
	 * 
	 * @param deals
	 *            List of received DealBundles, possibly empty
	 * @return ResponseBundle to broadcast, or null if there is nothing to send
	 * @throws DKGException
	 */
	public ResponseBundle processDeals(List<DealBundle> deals) throws DKGException;

	/**
	 * Processes the responses received during the response phase
	 * 
	 * @param responses
	 *            List of received ResponseBundles, possibly empty
	 * @return ResponseOutcome holding the final result or justifications to
	 *         send
	 * @throws DKGException
	 */
	public ResponseOutcome processResponses(List<ResponseBundle> responses) throws DKGException;

	/**
	 * Processes the justifications and finishes the run
	 * 
	 * @param justifications
	 *            List of received JustificationBundles, possibly empty
	 * @return Result of the run
	 * @throws DKGException
	 *             if the run cannot complete
	 */
	public Result processJustifications(List<JustificationBundle> justifications) throws DKGException;
}
