package org.javai.paradox.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptBatchParserTest {

	@TempDir
	Path dir;

	@Test
	void resultsComeBackInInputOrder() {
		List<String> documents = new ArrayList<>();
		for (int i = 0; i < 50; i++) {
			documents.add("id = " + i + "\nname = \"doc" + i + "\"");
		}

		try (ScriptBatchParser batch = new ScriptBatchParser(ParserOptions.defaults(), 4)) {
			List<ParseResult> results = batch.parseAll(documents);

			assertThat(results).hasSize(50);
			for (int i = 0; i < 50; i++) {
				ParseResult result = results.get(i);
				assertThat(result.source()).isEqualTo(String.valueOf(i));
				assertThat(result.root().getInt("id", -1)).isEqualTo(i);
				assertThat(result.hasErrors()).isFalse();
				assertThat(result.metrics().tokensProcessed()).isEqualTo(6);
			}
		}
	}

	@Test
	void diagnosticsStayWithTheirDocument() {
		try (ScriptBatchParser batch = new ScriptBatchParser(ParserOptions.defaults(), 2)) {
			List<ParseResult> results = batch.parseAll(List.of("a = 1", "broken", "b = 2 }"));

			assertThat(results.get(0).diagnostics()).isEmpty();
			assertThat(results.get(1).errors()).hasSize(1);
			assertThat(results.get(1).warnings()).isEmpty();
			assertThat(results.get(2).errors()).isEmpty();
			assertThat(results.get(2).warnings()).hasSize(1);
		}
	}

	@Test
	void unreadableFilesBecomeFailedResults() throws Exception {
		Path good = dir.resolve("good.txt");
		Files.writeString(good, "owner = FRA");
		Path missing = dir.resolve("missing.txt");

		try (ScriptBatchParser batch = new ScriptBatchParser(ParserOptions.defaults(), 2)) {
			List<ParseResult> results = batch.parseFiles(List.of(good, missing));

			assertThat(results.get(0).root().getString("owner")).isEqualTo("FRA");
			assertThat(results.get(1).root().isEmpty()).isTrue();
			assertThat(results.get(1).errors()).hasSize(1);
			assertThat(results.get(1).errors().get(0)).contains("missing.txt");
		}
	}

	@Test
	void callerManagedExecutorIsLeftRunning() {
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			ScriptBatchParser batch = new ScriptBatchParser(executor, ScriptParser::new);
			assertThat(batch.parseAll(List.of("a = 1"))).hasSize(1);
			batch.close();

			assertThat(executor.isShutdown()).isFalse();
			assertThatThrownBy(() -> batch.parseAll(List.of("a = 1"))).isInstanceOf(IllegalStateException.class);
		} finally {
			executor.shutdownNow();
		}
	}
}
