package org.circuitry.qasm3.namespace;

import org.circuitry.junit.extensions.logging.ExpectLog;
import org.circuitry.junit.extensions.logging.LogLevel;
import org.circuitry.junit.extensions.logging.LogWatchExtension;
import org.circuitry.qasm3.ExporterOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StandardGateVocabularyTest {

    @Test
    void resolve_defaultsProvideTheStandardLibrary() {
        assertThat(StandardGateVocabulary.resolve(ExporterOptions.defaults()))
                .contains("h", "x", "cx", "ccx", "rz", "p")
                .doesNotContain("U", "u", "barrier", "measure");
    }

    @Test
    void resolve_unionInIncludeOrder() {
        ExporterOptions options = ExporterOptions.builder()
                .includes(List.of("b.inc", "a.inc"))
                .includeVocabulary("a.inc", List.of("foo", "bar"))
                .includeVocabulary("b.inc", List.of("baz", "foo"))
                .build();

        assertThat(StandardGateVocabulary.resolve(options)).containsExactly("baz", "foo", "bar");
    }

    @Test
    void resolve_noIncludes_isEmpty() {
        assertThat(StandardGateVocabulary.resolve(ExporterOptions.builder().build())).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Include file 'mystery.inc' has no known gate vocabulary.*")
    void resolve_unknownInclude_warnsAndContributesNothing() {
        ExporterOptions options = ExporterOptions.builder()
                .includes(List.of("mystery.inc"))
                .build();

        assertThat(StandardGateVocabulary.resolve(options)).isEmpty();
    }
}
