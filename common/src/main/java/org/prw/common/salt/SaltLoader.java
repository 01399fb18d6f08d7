package org.prw.common.salt;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the secret salt mixed into every pseudonymous id.
 * <p>
 * The salt file lives next to the identity store and is readable only by the pipeline
 * account. Its value is never logged.
 */
public class SaltLoader {

	/**
	 * Salt used by the warehouse since its first load. Ids minted before the salt file was
	 * introduced can only be reproduced with this value.
	 */
	public static final String DEFAULT_SALT = "560f80d9-b01f-4bda-84fd-1b39c56c5be5";

	private static final Logger LOGGER = LoggerFactory.getLogger(SaltLoader.class);

	private SaltLoader() {
	}

	/**
	 * Reads the salt from the given file. Surrounding whitespace is trimmed.
	 *
	 * @param filePath path of the salt file
	 * @return the salt
	 * @throws IOException if the file cannot be read
	 * @throws IllegalStateException if the file is empty
	 */
	public static String loadSalt(String filePath) throws IOException {
		String salt;
		try (InputStream in = new FileInputStream(filePath)) {
			salt = IOUtils.toString(in, StandardCharsets.UTF_8).trim();
		}
		if (salt.isEmpty()) {
			throw new IllegalStateException("Salt file is empty: " + filePath);
		}
		LOGGER.info("****LOADED ID SALT****");
		return salt;
	}

	/**
	 * Reads the salt from the given file, or falls back to {@link #DEFAULT_SALT} when no
	 * file is configured.
	 */
	public static String loadSaltOrDefault(String filePath) throws IOException {
		if (filePath == null || filePath.isBlank()) {
			LOGGER.warn("No salt file configured, using the built-in default salt");
			return DEFAULT_SALT;
		}
		return loadSalt(filePath);
	}
}
