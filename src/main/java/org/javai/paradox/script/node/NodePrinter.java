package org.javai.paradox.script.node;

/**
 * Renders a tree as an indented dump for debugging.
 *
 * <pre>
 * root = {
 *   owner = FRA
 *   1444.11.11 = { # date 1444.11.11
 *     add_core = FRA
 *   }
 *   discovered_by = [
 *     western
 *     eastern
 *   ]
 * }
 * </pre>
 */
public final class NodePrinter {

	private static final String INDENT = "  ";

	private NodePrinter() {
	}

	public static String print(ScriptNode node) {
		StringBuilder sb = new StringBuilder();
		print(node, 0, sb);
		return sb.toString();
	}

	private static void print(ScriptNode node, int depth, StringBuilder sb) {
		String indent = INDENT.repeat(depth);
		String prefix = node.key().isEmpty() ? indent : indent + node.key() + " = ";
		switch (node.kind()) {
			case SCALAR -> sb.append(prefix).append(((ScalarNode) node).value()).append('\n');
			case OBJECT -> {
				sb.append(prefix).append("{\n");
				printChildren((ContainerNode) node, depth, sb);
				sb.append(indent).append("}\n");
			}
			case DATE -> {
				sb.append(prefix).append("{ # date ").append(((DateNode) node).date()).append('\n');
				printChildren((ContainerNode) node, depth, sb);
				sb.append(indent).append("}\n");
			}
			case LIST -> {
				sb.append(prefix).append("[\n");
				for (ScriptNode item : ((ListNode) node).items()) {
					print(item, depth + 1, sb);
				}
				sb.append(indent).append("]\n");
			}
		}
	}

	private static void printChildren(ContainerNode node, int depth, StringBuilder sb) {
		for (ScriptNode child : node.children().values()) {
			print(child, depth + 1, sb);
		}
	}
}
