package org.javai.paradox.script.schema;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.paradox.script.ScriptParseException;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for schema YAML files.
 *
 * <pre>
 * schema:
 *   id: province_history
 *   description: Province history files
 * allow_unknown_keys: false
 * keys:
 *   owner:
 *     type: string
 *     required: true
 *   base_tax:
 *     type: int
 * </pre>
 */
public class ScriptSchemaParser {

	private final Yaml yaml = new Yaml();

	public ScriptSchema parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (ScriptParseException e) {
			throw e;
		} catch (Exception e) {
			throw new ScriptParseException("Failed to parse schema from path: " + path, e);
		}
	}

	public ScriptSchema parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildSchema(data);
		} catch (ScriptParseException e) {
			throw e;
		} catch (Exception e) {
			throw new ScriptParseException("Failed to parse schema from input stream", e);
		}
	}

	public ScriptSchema parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildSchema(data);
		} catch (ScriptParseException e) {
			throw e;
		} catch (Exception e) {
			throw new ScriptParseException("Failed to parse schema from reader", e);
		}
	}

	public ScriptSchema parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildSchema(data);
		} catch (ScriptParseException e) {
			throw e;
		} catch (Exception e) {
			throw new ScriptParseException("Failed to parse schema from string", e);
		}
	}

	/**
	 * Loads a schema bundled on the classpath, e.g. {@code schemas/province_history.yml}.
	 */
	public ScriptSchema parseResource(String resource) {
		InputStream in = ScriptSchemaParser.class.getClassLoader().getResourceAsStream(resource);
		if (in == null) {
			throw new ScriptParseException("Schema resource not found: " + resource);
		}
		try (in) {
			return parse(in);
		} catch (IOException e) {
			throw new ScriptParseException("Failed to close schema resource: " + resource, e);
		}
	}

	@SuppressWarnings("unchecked")
	private ScriptSchema buildSchema(Map<String, Object> data) {
		if (data == null) {
			throw new ScriptParseException("Schema document is empty");
		}
		Map<String, Object> header = (Map<String, Object>) data.get("schema");
		if (header == null) {
			throw new ScriptParseException("Missing required 'schema' section");
		}
		String id = toString(header.get("id"));
		String description = header.get("description") != null ? toString(header.get("description")) : "";

		Boolean allowUnknown = (Boolean) data.get("allow_unknown_keys");

		Map<String, Object> keysMap = (Map<String, Object>) data.get("keys");
		Map<String, KeyRule> keys = new LinkedHashMap<>();
		if (keysMap != null) {
			for (Map.Entry<String, Object> entry : keysMap.entrySet()) {
				keys.put(entry.getKey(), buildKeyRule(entry.getKey(), (Map<String, Object>) entry.getValue()));
			}
		}

		return new ScriptSchema(id, description, allowUnknown != null && allowUnknown, keys);
	}

	private KeyRule buildKeyRule(String name, Map<String, Object> ruleData) {
		if (ruleData == null) {
			return new KeyRule(name, ValueType.ANY, false, null);
		}
		String typeStr = (String) ruleData.get("type");
		ValueType type;
		try {
			type = typeStr != null ? ValueType.fromYaml(typeStr) : ValueType.ANY;
		} catch (IllegalArgumentException e) {
			throw new ScriptParseException("Invalid type '" + typeStr + "' for key '" + name + "'", e);
		}

		Boolean required = (Boolean) ruleData.get("required");
		String description = (String) ruleData.get("description");
		return new KeyRule(name, type, required != null && required, description);
	}

	private String toString(Object obj) {
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}
}
