/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.utils;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.bigtangle.dkg.auth.ECDSAAuthScheme;
import net.bigtangle.dkg.engine.Node;
import net.bigtangle.dkg.engine.Roster;
import net.bigtangle.dkg.utils.IOUtils.EncodingType;

/**
 * Converts rosters to and from JSON. A roster file is an array of nodes:
 * 
 * <pre>
 * [ { "index": 0, "publicKey": "3056301006..." }, ... ]
 * </pre>
 * 
 * where publicKey is the hex encoded X.509 form of an EC public key.
 * 
 */
public class RosterIO {

	private static final Logger logger = LoggerFactory.getLogger(RosterIO.class);

	public static final String INDEX = "index";

	public static final String PUBLIC_KEY = "publicKey";

	private RosterIO() {
	}

	public static Roster fromJSON(JSONArray nodes) throws IOException {
		List<Node> members = new ArrayList<Node>();
		for (int i = 0; i < nodes.length(); i++) {
			try {
				JSONObject node = nodes.getJSONObject(i);
				byte[] encoded = IOUtils.decodeData(EncodingType.HEX, node.getString(PUBLIC_KEY));
				members.add(new Node(node.getInt(INDEX), ECDSAAuthScheme.decodePublicKey(encoded)));
			} catch (JSONException | IllegalArgumentException | GeneralSecurityException e) {
				throw new IOException("Invalid roster entry " + i, e);
			}
		}
		try {
			return new Roster(members);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid roster", e);
		}
	}

	public static JSONArray toJSON(Roster roster) {
		JSONArray nodes = new JSONArray();
		for (Node node : roster.getNodes()) {
			JSONObject obj = new JSONObject();
			obj.put(INDEX, node.getIndex());
			obj.put(PUBLIC_KEY, IOUtils.encodeData(EncodingType.HEX, node.getPublicKey().getEncoded()));
			nodes.put(obj);
		}
		return nodes;
	}

	public static Roster readRoster(String file) throws IOException {
		Roster roster = fromJSON(IOUtils.readJSONArrayFromFile(file));
		logger.info("Loaded roster of {} nodes from {}", roster.size(), file);
		return roster;
	}

	public static void writeRoster(String file, Roster roster) throws IOException {
		IOUtils.writeToFile(file, toJSON(roster));
	}
}
