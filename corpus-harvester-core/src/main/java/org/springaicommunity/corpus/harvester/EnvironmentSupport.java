package org.springaicommunity.corpus.harvester;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves secrets such as {@code GITHUB_TOKEN} by checking a {@code .env} file first,
 * then falling back to the system environment. The {@code .env} files are loaded once
 * and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String STACKEXCHANGE_API_KEY = "STACKEXCHANGE_API_KEY";

	public static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		// Dotenv.get falls back to System.getenv for keys missing from the file
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

	/**
	 * Get a required environment variable value.
	 * @param name the variable name
	 * @return the value
	 * @throws IllegalStateException if the variable is not set
	 */
	public static String require(String name) {
		String value = get(name);
		if (value == null) {
			throw new IllegalStateException(
					name + " environment variable is required (set it in .env or the environment)");
		}
		return value;
	}

}
