package org.javai.eg.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link EgSettings} from YAML.
 *
 * <p>Expected layout (every key optional):</p>
 * <pre>
 * parser:
 *   max-nesting-depth: 256
 *   capitalize-constant-labels: true
 * translator:
 *   variable-prefix: "?v"
 * </pre>
 */
public class EgSettingsLoader {

	public static final String DEFAULT_RESOURCE = "eg-settings.yaml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to
	 * {@link EgSettings#defaults()} when the resource is absent.
	 */
	public EgSettings loadDefault() {
		InputStream in = EgSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			return EgSettings.defaults();
		}
		try (in) {
			return parse(in);
		} catch (SettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsException("Failed to read settings resource " + DEFAULT_RESOURCE, e);
		}
	}

	public EgSettings parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (SettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsException("Failed to parse settings from path: " + path, e);
		}
	}

	public EgSettings parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (SettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsException("Failed to parse settings from input stream", e);
		}
	}

	public EgSettings parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (SettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsException("Failed to parse settings from reader", e);
		}
	}

	public EgSettings parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (SettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new SettingsException("Failed to parse settings from string", e);
		}
	}

	private EgSettings build(Object data) {
		EgSettings defaults = EgSettings.defaults();
		if (data == null) {
			return defaults;
		}
		if (!(data instanceof Map<?, ?> root)) {
			throw new SettingsException("Settings must be a YAML mapping");
		}
		Map<?, ?> parser = section(root, "parser");
		Map<?, ?> translator = section(root, "translator");

		String prefix = stringValue(translator, "variable-prefix", defaults.variablePrefix());
		int depth = intValue(parser, "max-nesting-depth", defaults.maxNestingDepth());
		boolean capitalize = booleanValue(parser, "capitalize-constant-labels", defaults.capitalizeConstantLabels());
		try {
			return new EgSettings(prefix, depth, capitalize);
		} catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private Map<?, ?> section(Map<?, ?> root, String name) {
		Object value = root.get(name);
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map<?, ?> map) {
			return map;
		}
		throw new SettingsException("Settings section '" + name + "' must be a mapping");
	}

	private String stringValue(Map<?, ?> section, String key, String fallback) {
		Object value = section.get(key);
		return value != null ? String.valueOf(value) : fallback;
	}

	private int intValue(Map<?, ?> section, String key, int fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new SettingsException("Setting '" + key + "' must be an integer, found: " + value, e);
		}
	}

	private boolean booleanValue(Map<?, ?> section, String key, boolean fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean flag) {
			return flag;
		}
		return Boolean.parseBoolean(String.valueOf(value).trim());
	}
}
