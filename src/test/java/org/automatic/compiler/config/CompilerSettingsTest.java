package org.automatic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompilerSettingsTest {

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    @Test
    void referenceDefaults() {
        CompilerSettings settings = CompilerSettings.fromConfig(withDefaults(""));

        assertThat(settings.moduleName()).isEqualTo("automatic");
        assertThat(settings.includePaths()).isEmpty();
        assertThat(settings.maxIncludeDepth()).isEqualTo(16);
        assertThat(settings.verbosity()).isEqualTo(1);
        assertThat(settings.debugDump()).isFalse();
    }

    @Test
    void overridesAreRead() {
        CompilerSettings settings = CompilerSettings.fromConfig(withDefaults(String.join("\n",
                "automatic.compiler {",
                "  module-name = demo",
                "  debug-dump = true",
                "  preprocessor { include-paths = [\"lib\", \"/opt/mat\"], max-include-depth = 4 }",
                "}")));

        assertThat(settings.moduleName()).isEqualTo("demo");
        assertThat(settings.debugDump()).isTrue();
        assertThat(settings.maxIncludeDepth()).isEqualTo(4);
        assertThat(settings.includePaths()).containsExactly(Path.of("lib"), Path.of("/opt/mat"));
    }

    @Test
    void invalidValuesAreReportedAsBadValue() {
        assertThatThrownBy(() -> CompilerSettings.fromConfig(
                withDefaults("automatic.compiler.preprocessor.max-include-depth = 0")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("include depth");
        assertThatThrownBy(() -> CompilerSettings.fromConfig(withDefaults("automatic.compiler.module-name = \"  \"")))
                .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void wrongTypeIsAConfigError() {
        assertThatThrownBy(() -> CompilerSettings.fromConfig(withDefaults("automatic.compiler.verbosity = loud")))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void copiesAreIndependent() {
        CompilerSettings settings = CompilerSettings.fromConfig(withDefaults(""));

        CompilerSettings changed = settings.withDebugDump(true).withIncludePaths(List.of(Path.of("inc")));

        assertThat(changed.debugDump()).isTrue();
        assertThat(changed.includePaths()).containsExactly(Path.of("inc"));
        assertThat(settings.debugDump()).isFalse();
        assertThat(settings.includePaths()).isEmpty();
    }
}
