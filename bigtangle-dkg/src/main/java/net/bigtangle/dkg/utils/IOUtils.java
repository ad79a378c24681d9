/*******************************************************************************
 *  Copyright   2018  Inasset GmbH. 
 *  
 *******************************************************************************/
package net.bigtangle.dkg.utils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.Hex;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Reading and writing of JSON configuration files, and the text encodings used
 * for keys inside them.
 * 
 */
public class IOUtils {

	public enum EncodingType {
		BASE64, HEX
	}

	private IOUtils() {
	}

	/**
	 * Decodes a string into bytes
	 * 
	 * @param encType
	 *            EncodingType of data
	 * @param data
	 *            String to decode
	 * @return byte array of decoded data
	 * @throws IllegalArgumentException
	 *             if data is not valid for the encoding
	 */
	public static byte[] decodeData(EncodingType encType, String data) {
		switch (encType) {
		case BASE64:
			if (!Base64.isBase64(data)) {
				throw new IllegalArgumentException("Not a Base64 string");
			}
			return Base64.decodeBase64(data);
		case HEX:
			try {
				return Hex.decodeHex(data.toCharArray());
			} catch (DecoderException e) {
				throw new IllegalArgumentException("Not a hex string", e);
			}
		default:
			throw new IllegalArgumentException("Unknown encoding " + encType);
		}
	}

	public static String encodeData(EncodingType encType, byte[] data) {
		switch (encType) {
		case BASE64:
			return Base64.encodeBase64String(data);
		case HEX:
			return Hex.encodeHexString(data);
		default:
			throw new IllegalArgumentException("Unknown encoding " + encType);
		}
	}

	public static JSONObject readJSONObjectFromFile(String file) throws IOException {
		return new JSONObject(readStringFromFile(file));
	}

	public static JSONArray readJSONArrayFromFile(String file) throws IOException {
		return new JSONArray(readStringFromFile(file));
	}

	public static String readStringFromFile(String file) throws IOException {
		try (BufferedReader br = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
			StringBuilder sb = new StringBuilder();
			String line;
			while ((line = br.readLine()) != null) {
				sb.append(line);
			}
			return sb.toString();
		}
	}

	public static void writeToFile(String file, String data) throws IOException {
		try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(file), StandardCharsets.UTF_8)) {
			bw.write(data);
		}
	}

	public static void writeToFile(String file, JSONObject obj) throws IOException {
		writeToFile(file, obj.toString(2));
	}

	public static void writeToFile(String file, JSONArray obj) throws IOException {
		writeToFile(file, obj.toString(2));
	}
}
