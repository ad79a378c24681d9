/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.engine;

import net.bigtangle.dkg.exceptions.DKGException;

/**
 * Creates the engine for a run.
 * 
 */
public interface KeyGenerationEngineFactory {

	/**
	 * @param config
	 *            DkgConfig of the run
	 * @return a fresh KeyGenerationEngine
	 * @throws DKGException
	 *             if the configuration is not usable by the engine
	 */
	public KeyGenerationEngine create(DkgConfig config) throws DKGException;
}
