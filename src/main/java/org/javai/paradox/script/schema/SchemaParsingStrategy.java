package org.javai.paradox.script.schema;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.javai.paradox.script.GenericParsingStrategy;
import org.javai.paradox.script.ParseLog;
import org.javai.paradox.script.ParserOptions;
import org.javai.paradox.script.ParsingStrategy;
import org.javai.paradox.script.ScriptToken;
import org.javai.paradox.script.node.ContainerNode;
import org.javai.paradox.script.node.ListNode;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.ScalarNode;
import org.javai.paradox.script.node.ScriptNode;

/**
 * Schema-aware parsing strategy: builds the generic tree, then checks it against a
 * {@link ScriptSchema}.
 * <ul>
 *   <li>a required key missing at the top level is an error</li>
 *   <li>an undeclared key is a warning, with suggestions when it is close to a declared key</li>
 *   <li>date keys are always allowed; the entries of a date block are checked like top-level
 *   entries, without the required-key check</li>
 *   <li>a value of the wrong type is a warning</li>
 * </ul>
 * The tree is returned unchanged whatever the findings.
 */
public class SchemaParsingStrategy implements ParsingStrategy {

	private final ScriptSchema schema;
	private final ParsingStrategy delegate;

	public SchemaParsingStrategy(ScriptSchema schema) {
		this(schema, ParserOptions.defaults());
	}

	public SchemaParsingStrategy(ScriptSchema schema, ParserOptions options) {
		if (schema == null) {
			throw new IllegalArgumentException("Schema cannot be null");
		}
		this.schema = schema;
		this.delegate = new GenericParsingStrategy(options);
	}

	@Override
	public ObjectNode parse(List<ScriptToken> tokens, ParseLog log) {
		ObjectNode root = delegate.parse(tokens, log);
		validateEntries(root, log);
		for (String required : schema.requiredKeys()) {
			if (!root.hasChild(required)) {
				log.error("Missing required key: '" + required + "' (schema " + schema.id() + ")");
			}
		}
		return root;
	}

	private void validateEntries(ContainerNode container, ParseLog log) {
		for (Map.Entry<String, ScriptNode> entry : container.children().entrySet()) {
			String key = entry.getKey();
			ScriptNode node = entry.getValue();

			if (ParadoxDate.tryParse(key).isPresent()) {
				validateDateEntry(node, log);
				continue;
			}

			KeyRule rule = schema.keys().get(key);
			if (rule == null) {
				reportUnknownKey(key, log);
			} else {
				checkType(rule, node, log);
			}
		}
	}

	private void validateDateEntry(ScriptNode node, ParseLog log) {
		if (node instanceof ContainerNode block) {
			validateEntries(block, log);
		} else if (node instanceof ListNode list) {
			for (ScriptNode item : list.items()) {
				validateDateEntry(item, log);
			}
		}
	}

	private void reportUnknownKey(String key, ParseLog log) {
		List<String> suggestions = KeySuggestions.similarTo(key, schema.keys().keySet());
		if (!suggestions.isEmpty()) {
			log.warning("Unknown key '" + key + "'. Did you mean: " + String.join(", ", suggestions) + "?");
		} else if (!schema.allowUnknownKeys()) {
			log.warning("Unknown key '" + key + "' (schema " + schema.id() + ")");
		}
	}

	private void checkType(KeyRule rule, ScriptNode node, ParseLog log) {
		// repeated keys are collected into a list; check each occurrence
		if (node instanceof ListNode list && rule.type() != ValueType.LIST && rule.type() != ValueType.ANY) {
			for (ScriptNode item : list.items()) {
				checkType(rule, item, log);
			}
			return;
		}
		if (!rule.type().matches(node)) {
			log.warning("Key '" + rule.name() + "' expects " + rule.type().yamlName() + " but found " + describe(node));
		}
	}

	private static String describe(ScriptNode node) {
		if (node instanceof ScalarNode scalar) {
			return scalar.value().getClass().getSimpleName().toLowerCase(Locale.ROOT) + " '" + scalar.value() + "'";
		}
		return node.kind().name().toLowerCase(Locale.ROOT);
	}
}
