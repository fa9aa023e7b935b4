package org.javai.eg.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EgSettingsLoaderTest {

	private final EgSettingsLoader loader = new EgSettingsLoader();

	@Test
	void loadsBundledDefaults() {
		EgSettings settings = loader.loadDefault();

		assertThat(settings).isEqualTo(EgSettings.defaults());
	}

	@Test
	void parsesAllKeys() {
		String yaml = """
				parser:
				  max-nesting-depth: 32
				  capitalize-constant-labels: false
				translator:
				  variable-prefix: "?x"
				""";

		EgSettings settings = loader.parseString(yaml);

		assertThat(settings.maxNestingDepth()).isEqualTo(32);
		assertThat(settings.capitalizeConstantLabels()).isFalse();
		assertThat(settings.variablePrefix()).isEqualTo("?x");
	}

	@Test
	void missingKeysFallBackToDefaults() {
		EgSettings settings = loader.parseString("parser:\n  max-nesting-depth: 10\n");

		assertThat(settings.maxNestingDepth()).isEqualTo(10);
		assertThat(settings.variablePrefix()).isEqualTo(EgSettings.DEFAULT_VARIABLE_PREFIX);
		assertThat(settings.capitalizeConstantLabels()).isTrue();
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(loader.parseString("")).isEqualTo(EgSettings.defaults());
	}

	@Test
	void parsesFromPath(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("eg-settings.yaml");
		Files.writeString(file, "translator:\n  variable-prefix: \"?n\"\n");

		assertThat(loader.parse(file).variablePrefix()).isEqualTo("?n");
	}

	@Test
	void missingFileReported(@TempDir Path dir) {
		Path file = dir.resolve("absent.yaml");

		assertThatThrownBy(() -> loader.parse(file))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("absent.yaml");
	}

	@Test
	void invalidValuesRejected() {
		assertThatThrownBy(() -> loader.parseString("parser:\n  max-nesting-depth: 0\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("Max nesting depth must be positive");
		assertThatThrownBy(() -> loader.parseString("parser:\n  max-nesting-depth: deep\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("must be an integer");
		assertThatThrownBy(() -> loader.parseString("translator:\n  variable-prefix: \"? v\"\n"))
				.isInstanceOf(SettingsException.class);
	}

	@Test
	void nonMappingRejected() {
		assertThatThrownBy(() -> loader.parseString("- just\n- a list\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessage("Settings must be a YAML mapping");
		assertThatThrownBy(() -> loader.parseString("parser: 3\n"))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("'parser' must be a mapping");
	}

	@Test
	void settingsValidation() {
		assertThatThrownBy(() -> new EgSettings(" ", 10, true)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> EgSettings.defaults().withVariablePrefix("(v")).isInstanceOf(IllegalArgumentException.class);
		assertThat(EgSettings.defaults().withMaxNestingDepth(5).maxNestingDepth()).isEqualTo(5);
	}
}
