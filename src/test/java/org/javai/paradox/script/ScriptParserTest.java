package org.javai.paradox.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.javai.paradox.script.ParserOptions.RepeatedKeyPolicy;
import org.javai.paradox.script.node.DateNode;
import org.javai.paradox.script.node.ListNode;
import org.javai.paradox.script.node.NodeKind;
import org.javai.paradox.script.node.ObjectNode;
import org.javai.paradox.script.node.ParadoxDate;
import org.javai.paradox.script.node.RgbColor;
import org.javai.paradox.script.node.ScalarNode;
import org.javai.paradox.script.node.ScriptNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScriptParserTest {

	private ScriptParser parser;

	@BeforeEach
	void setUp() {
		parser = new ScriptParser();
	}

	@Nested
	@DisplayName("Basic statements")
	class BasicStatements {

		@Test
		void emptyInputYieldsEmptyRoot() {
			ObjectNode root = parser.parse("");

			assertThat(root.key()).isEqualTo(ScriptNode.ROOT_KEY);
			assertThat(root.isEmpty()).isTrue();
			assertThat(parser.errors()).isEmpty();
			assertThat(parser.warnings()).isEmpty();
		}

		@Test
		void nullAndCommentOnlyInputYieldEmptyRoot() {
			assertThat(parser.parse(null).isEmpty()).isTrue();
			assertThat(parser.parse("# nothing here\n   # at all").isEmpty()).isTrue();
			assertThat(parser.errors()).isEmpty();
		}

		@Test
		void scalarValuesAreTyped() {
			ObjectNode root = parser.parse("""
					name = "Ile de France"
					tax = 42
					population = 3000000000
					ratio = 0.25
					delta = -7
					tag = FRA
					""");

			assertThat(root.getString("name")).isEqualTo("Ile de France");
			assertThat(scalar(root, "tax").value()).isEqualTo(42);
			assertThat(scalar(root, "population").value()).isEqualTo(3_000_000_000L);
			assertThat(scalar(root, "ratio").value()).isEqualTo(0.25);
			assertThat(scalar(root, "delta").value()).isEqualTo(-7);
			assertThat(scalar(root, "tag").value()).isEqualTo("FRA");
			assertThat(parser.errors()).isEmpty();
		}

		@Test
		void booleanKeywordsAndWordsAreCoerced() {
			ObjectNode root = parser.parse("a = yes\nb = no\nc = true\nd = FALSE\ne = Yes");

			assertThat(scalar(root, "a").value()).isEqualTo(Boolean.TRUE);
			assertThat(scalar(root, "b").value()).isEqualTo(Boolean.FALSE);
			assertThat(scalar(root, "c").value()).isEqualTo(Boolean.TRUE);
			assertThat(scalar(root, "d").value()).isEqualTo(Boolean.FALSE);
			assertThat(root.getBoolean("e", false)).isTrue();
		}

		@Test
		void dateValueIsParsed() {
			ObjectNode root = parser.parse("start = 1444.11.11");

			assertThat(scalar(root, "start").value()).isEqualTo(new ParadoxDate(1444, 11, 11));
			assertThat(root.getDate("start")).contains(new ParadoxDate(1444, 11, 11));
		}

		@Test
		void duplicateKeysOverwriteByDefault() {
			ObjectNode root = parser.parse("a = 1\na = 2");

			assertThat(root.size()).isEqualTo(1);
			assertThat(root.getInt("a", 0)).isEqualTo(2);
		}

		@Test
		void lastOfRepeatedOwnersWins() {
			ObjectNode root = parser.parse("owner = FRA\nowner = ENG\nowner = CAS");

			assertThat(root.getChildren("owner")).hasSize(1);
			assertThat(root.getString("owner")).isEqualTo("CAS");
		}

		@Test
		void commentsAreIgnoredEverywhere() {
			ObjectNode root = parser.parse("""
					# header
					a = 1 # trailing
					b = { # inside
						c = 2
						# before close
					}
					list = { # first
						x # between
						y
					}
					""");

			assertThat(root.getInt("a", 0)).isEqualTo(1);
			assertThat(root.getChild("b").orElseThrow().getInt("c", 0)).isEqualTo(2);
			assertThat(root.getValues("list", String.class)).containsExactly("x", "y");
			assertThat(parser.errors()).isEmpty();
			assertThat(parser.warnings()).isEmpty();
		}
	}

	@Nested
	@DisplayName("Blocks")
	class Blocks {

		@Test
		void nestedObjects() {
			ObjectNode root = parser.parse("country = { government = { type = monarchy rank = 2 } }");

			ScriptNode government = root.getChild("country").orElseThrow().getChild("government").orElseThrow();
			assertThat(government.kind()).isEqualTo(NodeKind.OBJECT);
			assertThat(government.getString("type")).isEqualTo("monarchy");
			assertThat(government.getInt("rank", 0)).isEqualTo(2);
		}

		@Test
		void deepValueIsReachableThroughChildLookups() {
			ObjectNode root = parser.parse("a = { b = { c = 1 } }");

			ScriptNode b = root.getChild("a").flatMap(a -> a.getChild("b")).orElseThrow();
			assertThat(b.getChild("c")).map(c -> ((ScalarNode) c).value()).contains(1);
		}

		@Test
		void fourNumbersAreAListNotAColor() {
			ObjectNode root = parser.parse("list = { 10 20 30 40 }");

			assertThat(root.getChild("list").orElseThrow()).isInstanceOf(ListNode.class);
			assertThat(root.getValues("list", Integer.class)).containsExactly(10, 20, 30, 40);
		}

		@Test
		void emptyBlockIsAnEmptyObject() {
			ObjectNode root = parser.parse("modifiers = { }");

			ScriptNode modifiers = root.getChild("modifiers").orElseThrow();
			assertThat(modifiers).isInstanceOf(ObjectNode.class);
			assertThat(((ObjectNode) modifiers).isEmpty()).isTrue();
		}

		@Test
		void dateKeyedBlockBecomesDateNode() {
			ObjectNode root = parser.parse("1444.11.11 = { owner = FRA controller = FRA }");

			ScriptNode node = root.getChild("1444.11.11").orElseThrow();
			assertThat(node).isInstanceOf(DateNode.class);
			assertThat(((DateNode) node).date()).isEqualTo(new ParadoxDate(1444, 11, 11));
			assertThat(node.getString("owner")).isEqualTo("FRA");
			assertThat(root.getDate("1444.11.11")).contains(new ParadoxDate(1444, 11, 11));
		}

		@Test
		void dateKeyedScalarIsKeyedByDateText() {
			ObjectNode root = parser.parse("1444.11.11 = FRA");

			assertThat(root.getChild("1444.11.11").orElseThrow()).isInstanceOf(ScalarNode.class);
			assertThat(root.getString("1444.11.11")).isEqualTo("FRA");
		}

		@Test
		void colorLiteralVersusBlock() {
			ObjectNode root = parser.parse("""
					color = { 10 20 30 }
					bright = { 300 0 0 }
					""");

			assertThat(scalar(root, "color").value()).isEqualTo(new RgbColor(10, 20, 30));
			ScriptNode bright = root.getChild("bright").orElseThrow();
			assertThat(bright).isInstanceOf(ListNode.class);
			assertThat(root.getValues("bright", Integer.class)).containsExactly(300, 0, 0);
		}

		@Test
		void valueListsBecomeListNodes() {
			ObjectNode root = parser.parse("""
					add_core = { FRA ENG }
					weights = { 10 20 -5 0.5 }
					""");

			ListNode cores = (ListNode) root.getChild("add_core").orElseThrow();
			assertThat(cores.size()).isEqualTo(2);
			assertThat(cores.items()).allMatch(item -> item.key().isEmpty());
			assertThat(root.getValues("add_core", String.class)).containsExactly("FRA", "ENG");
			assertThat(root.getValues("weights", Double.class)).containsExactly(10.0, 20.0, -5.0, 0.5);
		}

		@Test
		void listOfAnonymousBlocks() {
			ObjectNode root = parser.parse("units = { { type = infantry } { type = cavalry } }");

			List<ScriptNode> units = root.getChildren("units");
			assertThat(units).hasSize(2);
			assertThat(units.get(0).getString("type")).isEqualTo("infantry");
			assertThat(units.get(1).getString("type")).isEqualTo("cavalry");
		}

		@Test
		void nonValueTokenInListIsWarnedAndSkipped() {
			ObjectNode root = parser.parse("tags = { FRA 10 = 20 }");

			ListNode tags = (ListNode) root.getChild("tags").orElseThrow();
			assertThat(tags.size()).isEqualTo(3);
			assertThat(parser.warnings()).hasSize(1);
			assertThat(parser.errors()).isEmpty();
		}

		@Test
		void blockWithAnyKeyedEntryIsAnObject() {
			ObjectNode root = parser.parse("tags = { FRA ENG = SWE }");

			ScriptNode tags = root.getChild("tags").orElseThrow();
			assertThat(tags).isInstanceOf(ObjectNode.class);
			assertThat(tags.getString("ENG")).isEqualTo("SWE");
			assertThat(tags.hasChild("FRA")).isFalse();
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).contains("'FRA'");
		}
	}

	@Nested
	@DisplayName("Error recovery")
	class ErrorRecovery {

		@Test
		void keyWithoutEqualsIsSkipped() {
			ObjectNode root = parser.parse("owner = FRA\ncontroller\nreligion = catholic");

			assertThat(root.getString("owner")).isEqualTo("FRA");
			assertThat(root.getString("religion")).isEqualTo("catholic");
			assertThat(root.hasChild("controller")).isFalse();
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).contains("controller").contains("line 3");
			assertThat(parser.diagnostics().get(0).line()).isEqualTo(3);
		}

		@Test
		void recoverySkipsBalancedBraceGroups() {
			ObjectNode root = parser.parse("""
					country = {
						good = yes
						bad { x = 1 nested = { y = 2 } }
						tag = FRA
					}
					after = 1
					""");

			ScriptNode country = root.getChild("country").orElseThrow();
			assertThat(country.getBoolean("good", false)).isTrue();
			assertThat(country.getString("tag")).isEqualTo("FRA");
			assertThat(country.hasChild("x")).isFalse();
			assertThat(country.hasChild("bad")).isFalse();
			assertThat(root.getInt("after", 0)).isEqualTo(1);
			assertThat(parser.errors()).hasSize(1);
		}

		@Test
		void malformedFirstStatementInBlockKeepsTheRest() {
			ObjectNode root = parser.parse("x = 1\ncountry = {\n\tbad\n\ttag = FRA\n\tcapital = 183\n}\ny = 2");

			ScriptNode country = root.getChild("country").orElseThrow();
			assertThat(country.kind()).isEqualTo(NodeKind.OBJECT);
			assertThat(country.getString("tag")).isEqualTo("FRA");
			assertThat(country.getInt("capital", 0)).isEqualTo(183);
			assertThat(root.getInt("x", 0)).isEqualTo(1);
			assertThat(root.getInt("y", 0)).isEqualTo(2);
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).contains("'bad'").contains("line 4");
			assertThat(parser.warnings()).isEmpty();
		}

		@Test
		void malformedFirstStatementWithBraceGroupInBlockKeepsTheRest() {
			ObjectNode root = parser.parse("country = { bad { x = 1 } tag = FRA }");

			ScriptNode country = root.getChild("country").orElseThrow();
			assertThat(country.kind()).isEqualTo(NodeKind.OBJECT);
			assertThat(country.getString("tag")).isEqualTo("FRA");
			assertThat(country.hasChild("x")).isFalse();
			assertThat(parser.errors()).hasSize(1);
		}

		@Test
		void blocksBeyondTheNestingLimitAreSkipped() {
			ScriptParser shallow = new ScriptParser(ParserOptions.builder().maxNestingDepth(2).build());

			ObjectNode root = shallow.parse("a = { b = { c = { d = 1 } } e = 2 }\nf = 3");

			ScriptNode a = root.getChild("a").orElseThrow();
			assertThat(a.hasChild("b")).isTrue();
			assertThat(a.getChild("b").orElseThrow().hasChild("c")).isFalse();
			assertThat(a.getInt("e", 0)).isEqualTo(2);
			assertThat(root.getInt("f", 0)).isEqualTo(3);
			assertThat(shallow.errors()).hasSize(1);
			assertThat(shallow.errors().get(0)).contains("Maximum nesting depth (2)").contains("'c'").contains("line 1");
		}

		@Test
		void anonymousBlocksBeyondTheNestingLimitAreSkipped() {
			ScriptParser shallow = new ScriptParser(ParserOptions.builder().maxNestingDepth(1).build());

			ObjectNode root = shallow.parse("list = { { a = 1 } { b = 2 } }\nz = 1");

			ListNode list = (ListNode) root.getChild("list").orElseThrow();
			assertThat(list.isEmpty()).isTrue();
			assertThat(root.getInt("z", 0)).isEqualTo(1);
			assertThat(shallow.errors()).hasSize(2);
		}

		@Test
		void deeplyNestedInputDoesNotOverflowTheStack() {
			ObjectNode root = parser.parse("a = { ".repeat(100_000));

			assertThat(root.hasChild("a")).isTrue();
			assertThat(parser.errors())
					.anyMatch(e -> e.contains("Maximum nesting depth (" + ParserOptions.DEFAULT_MAX_NESTING_DEPTH + ")"));
		}

		@Test
		void recoveryStopsAtEnclosingBrace() {
			ObjectNode root = parser.parse("a = { x = 1 y }\nc = 1");

			assertThat(root.getChild("a").orElseThrow().getInt("x", 0)).isEqualTo(1);
			assertThat(root.getInt("c", 0)).isEqualTo(1);
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).doesNotContain("Missing '}'");
		}

		@Test
		void missingValueIsAnError() {
			ObjectNode root = parser.parse("a = }\nb = 2");

			assertThat(root.hasChild("a")).isFalse();
			assertThat(root.getInt("b", 0)).isEqualTo(2);
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).contains("Expected a value");
		}

		@Test
		void missingClosingBraceKeepsPartialBlock() {
			ObjectNode root = parser.parse("a = { b = 1\nc = 2");

			ScriptNode a = root.getChild("a").orElseThrow();
			assertThat(a.getInt("b", 0)).isEqualTo(1);
			assertThat(a.getInt("c", 0)).isEqualTo(2);
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.errors().get(0)).contains("Missing '}'").contains("line 1");
		}

		@Test
		void strayClosingBraceIsAWarning() {
			ObjectNode root = parser.parse("a = 1 }\nb = 2");

			assertThat(root.getInt("a", 0)).isEqualTo(1);
			assertThat(root.getInt("b", 0)).isEqualTo(2);
			assertThat(parser.errors()).isEmpty();
			assertThat(parser.warnings()).hasSize(1);
		}

		@Test
		void strayOperatorIsAWarning() {
			ObjectNode root = parser.parse("= 5\nb = 1");

			assertThat(root.getInt("b", 0)).isEqualTo(1);
			assertThat(root.size()).isEqualTo(1);
			assertThat(parser.errors()).isEmpty();
			assertThat(parser.warnings()).hasSize(1);
		}

		@Test
		void strategyFailureIsLoggedAndYieldsEmptyRoot() {
			ScriptParser failing = new ScriptParser((tokens, log) -> {
				throw new ScriptParseException("boom");
			});

			ObjectNode root = failing.parse("a = 1");

			assertThat(root.isEmpty()).isTrue();
			assertThat(failing.errors()).containsExactly("boom");
		}
	}

	@Nested
	@DisplayName("Options")
	class Options {

		@Test
		void accumulatingModeKeepsEveryRepeatedKey() {
			ScriptParser accumulating = new ScriptParser(ParserOptions.builder()
					.repeatedKeys(RepeatedKeyPolicy.ACCUMULATE)
					.build());

			ObjectNode root = accumulating.parse("add_core = FRA\nadd_core = ENG\nadd_core = BUR\nowner = FRA");

			assertThat(root.getChild("add_core").orElseThrow()).isInstanceOf(ListNode.class);
			assertThat(root.getValues("add_core", String.class)).containsExactly("FRA", "ENG", "BUR");
			assertThat(root.getChild("owner").orElseThrow()).isInstanceOf(ScalarNode.class);
		}

		@Test
		void keysAndIdentifiersGoThroughTheStringCache() {
			StringCache cache = mock(StringCache.class);
			when(cache.intern(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
			ScriptParser cached = new ScriptParser(ParserOptions.builder().stringCache(cache).build());

			ObjectNode root = cached.parse("owner = FRA");

			assertThat(root.getString("owner")).isEqualTo("FRA");
			verify(cache, atLeastOnce()).intern("owner");
			verify(cache, atLeastOnce()).intern("FRA");
		}

		@Test
		void interningCacheSharesInstances() {
			InterningStringCache cache = new InterningStringCache();
			ScriptParser cached = new ScriptParser(ParserOptions.builder().stringCache(cache).build());

			ObjectNode first = cached.parse("owner = FRA");
			ObjectNode second = cached.parse("owner = FRA");

			assertThat(scalar(first, "owner").value()).isSameAs(scalar(second, "owner").value());
			assertThat(cache.size()).isEqualTo(2);
		}
	}

	@Nested
	@DisplayName("Log and metrics")
	class LogAndMetrics {

		@Test
		void logAndMetricsAreResetPerCall() {
			parser.parse("broken\n");
			assertThat(parser.errors()).hasSize(1);
			assertThat(parser.metrics().errorCount()).isEqualTo(1);

			parser.parse("a = 1");
			assertThat(parser.errors()).isEmpty();
			assertThat(parser.metrics().errorCount()).isZero();
			assertThat(parser.metrics().tokensProcessed()).isEqualTo(3);
			assertThat(parser.metrics().linesProcessed()).isEqualTo(1);
			assertThat(parser.metrics().inputSizeBytes()).isEqualTo(5);
		}

		@Test
		void snapshotSurvivesNextCall() {
			parser.parse("a = 1\nb = 2");
			ParsingMetrics snapshot = parser.metrics().snapshot();

			parser.parse("");

			assertThat(snapshot.tokensProcessed()).isEqualTo(6);
			assertThat(snapshot.linesProcessed()).isEqualTo(2);
			assertThat(parser.metrics().tokensProcessed()).isZero();
		}

		@Test
		void warningsAreCounted() {
			parser.parse("}\na = 1");

			assertThat(parser.metrics().warningCount()).isEqualTo(1);
			assertThat(parser.hasErrors()).isFalse();
			assertThat(parser.metrics().toString()).contains("warnings 1");
		}
	}

	private static ScalarNode scalar(ScriptNode parent, String key) {
		return (ScalarNode) parent.getChild(key).orElseThrow();
	}
}
