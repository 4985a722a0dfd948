package net.quantuminvestor.fetch.ops;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from a system property, falling back to an environment variable.
 */
public final class ConfigResolver {

	private ConfigResolver() {
		// Utility class
	}

	/**
	 * Resolves a required value.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value
	 * @throws IllegalStateException if neither is set
	 */
	public static String resolveConfig(String sysProp, String envVar) {
		return resolveOptional(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	/**
	 * Resolves a value that may be absent.
	 */
	public static Optional<String> resolveOptional(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	public static int resolveInt(String sysProp, String envVar, int defaultValue) {
		return resolveOptional(sysProp, envVar)
				.map(v -> parse(sysProp, v, Integer::parseInt))
				.orElse(defaultValue);
	}

	public static double resolveDouble(String sysProp, String envVar, double defaultValue) {
		return resolveOptional(sysProp, envVar)
				.map(v -> parse(sysProp, v, Double::parseDouble))
				.orElse(defaultValue);
	}

	/**
	 * Resolves a duration given in (possibly fractional) seconds.
	 */
	public static Duration resolveSeconds(String sysProp, String envVar, Duration defaultValue) {
		return resolveOptional(sysProp, envVar)
				.map(v -> seconds(parse(sysProp, v, Double::parseDouble)))
				.orElse(defaultValue);
	}

	/**
	 * Converts fractional seconds to a Duration with millisecond resolution.
	 */
	public static Duration seconds(double seconds) {
		return Duration.ofMillis(Math.round(seconds * 1000.0));
	}

	private static <T> T parse(String name, String value, Function<String, T> parser) {
		try {
			return parser.apply(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid value for '" + name + "': " + value, e);
		}
	}
}
