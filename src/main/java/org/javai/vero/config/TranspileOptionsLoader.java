package org.javai.vero.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.javai.vero.codegen.TranspileOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link TranspileOptions} from a {@code vero.yml} file:
 * <pre>
 * baseUrl: https://staging.example.com
 * indent: 2            # spaces, or a literal string such as "\t"
 * maxWhileIterations: 50
 * testModule: "@playwright/test"
 * pageImportPath: ./pages   # where generated tests import page objects from
 * </pre>
 * Missing keys, and keys left without a value, keep their defaults. Unknown keys are logged and ignored.
 */
public class TranspileOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(TranspileOptionsLoader.class);

	private static final Set<String> KNOWN_KEYS = Set.of(
			"baseUrl", "indent", "maxWhileIterations", "testModule", "pageImportPath");

	private final Yaml yaml = new Yaml();

	public TranspileOptions load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read options from path: " + path, e);
		}
	}

	public TranspileOptions load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return build(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read options from input stream", e);
		}
	}

	public TranspileOptions load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return build(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read options from reader", e);
		}
	}

	public TranspileOptions loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return build(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read options from string", e);
		}
	}

	private TranspileOptions build(Map<String, Object> data) {
		TranspileOptions defaults = TranspileOptions.defaults();
		if (data == null) {
			return defaults;
		}
		for (String key : data.keySet()) {
			if (!KNOWN_KEYS.contains(key)) {
				logger.warn("Ignoring unknown option '{}'", key);
			}
		}

		String baseUrl = text(data.get("baseUrl"), defaults.baseUrl());
		String indent = indent(data.get("indent"), defaults.indent());
		int maxWhileIterations = positiveInt(data.get("maxWhileIterations"), defaults.maxWhileIterations());
		String testModule = text(data.get("testModule"), defaults.testModule());
		String pageImportPath = text(data.get("pageImportPath"), defaults.pageImportPath());
		return new TranspileOptions(baseUrl, indent, maxWhileIterations, testModule, pageImportPath);
	}

	/**
	 * A key written without a value ({@code baseUrl:}) loads as {@code null} and keeps the default.
	 */
	private String text(Object value, String fallback) {
		return value != null ? String.valueOf(value) : fallback;
	}

	private String indent(Object value, String fallback) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Integer spaces) {
			if (spaces < 0) {
				throw new VeroConfigException("'indent' must not be negative but was " + spaces);
			}
			return " ".repeat(spaces);
		}
		return String.valueOf(value);
	}

	private int positiveInt(Object value, int fallback) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Integer number && number > 0) {
			return number;
		}
		throw new VeroConfigException("'maxWhileIterations' must be a positive integer but was " + value);
	}
}
