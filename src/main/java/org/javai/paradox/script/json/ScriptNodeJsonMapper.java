package org.javai.paradox.script.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Locale;
import java.util.Map;
import org.javai.paradox.script.ScriptParseException;
import org.javai.paradox.script.node.ContainerNode;
import org.javai.paradox.script.node.DateNode;
import org.javai.paradox.script.node.ListNode;
import org.javai.paradox.script.node.NodeVisitor;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.RgbColor;
import org.javai.paradox.script.node.ScalarNode;
import org.javai.paradox.script.node.ScriptNode;

/**
 * Utility to convert a parsed tree into JSON for export or diagnostics.
 * <p>
 * Objects become JSON objects, lists become arrays, dates are written as ISO {@code yyyy-MM-dd}
 * text and colors as {@code [r, g, b]}. A date block becomes an object whose first field,
 * {@value #DATE_FIELD}, holds its date.
 */
public final class ScriptNodeJsonMapper {

	public static final String DATE_FIELD = "_date";

	private static final ObjectMapper mapper = new ObjectMapper();

	private ScriptNodeJsonMapper() {
	}

	public static JsonNode toJson(ScriptNode node) {
		return node.accept(new JsonBuilder());
	}

	public static String toJsonString(ScriptNode node, boolean pretty) {
		try {
			JsonNode json = toJson(node);
			return pretty
					? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
					: mapper.writeValueAsString(json);
		} catch (JsonProcessingException e) {
			throw new ScriptParseException("Failed to serialize node '" + node.key() + "'", e);
		}
	}

	static String isoDate(ParadoxDate date) {
		return String.format(Locale.ROOT, "%04d-%02d-%02d", date.year(), date.month(), date.day());
	}

	private static final class JsonBuilder implements NodeVisitor<JsonNode> {

		@Override
		public JsonNode visitScalar(ScalarNode node) {
			Object value = node.value();
			if (value instanceof String text) {
				return mapper.getNodeFactory().textNode(text);
			}
			if (value instanceof Integer number) {
				return mapper.getNodeFactory().numberNode(number);
			}
			if (value instanceof Long number) {
				return mapper.getNodeFactory().numberNode(number);
			}
			if (value instanceof Double number) {
				return mapper.getNodeFactory().numberNode(number);
			}
			if (value instanceof Boolean flag) {
				return mapper.getNodeFactory().booleanNode(flag);
			}
			if (value instanceof ParadoxDate date) {
				return mapper.getNodeFactory().textNode(isoDate(date));
			}
			RgbColor color = (RgbColor) value;
			ArrayNode rgb = mapper.createArrayNode();
			rgb.add(color.red());
			rgb.add(color.green());
			rgb.add(color.blue());
			return rgb;
		}

		@Override
		public JsonNode visitList(ListNode node) {
			ArrayNode array = mapper.createArrayNode();
			for (ScriptNode item : node.items()) {
				array.add(item.accept(this));
			}
			return array;
		}

		@Override
		public JsonNode visitObject(ObjectNode node) {
			return fields(node, mapper.createObjectNode());
		}

		@Override
		public JsonNode visitDate(DateNode node) {
			com.fasterxml.jackson.databind.node.ObjectNode json = mapper.createObjectNode();
			json.put(DATE_FIELD, isoDate(node.date()));
			return fields(node, json);
		}

		private JsonNode fields(ContainerNode node, com.fasterxml.jackson.databind.node.ObjectNode json) {
			for (Map.Entry<String, ScriptNode> child : node.children().entrySet()) {
				json.set(child.getKey(), child.getValue().accept(this));
			}
			return json;
		}
	}
}
