package app.signaltrust.keys.env;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessEnvironmentTest {

    @Test
    void exportedValuesShadowBaseEnvironment() {
        ProcessEnvironment environment = new ProcessEnvironment(Map.of("OPENAI_API_KEY", "from-base"));

        environment.export("OPENAI_API_KEY", "from-export");

        assertThat(environment.get("OPENAI_API_KEY")).contains("from-export");
    }

    @Test
    void emptyValuesAreAbsent() {
        ProcessEnvironment environment = new ProcessEnvironment(Map.of("EMPTY", ""));

        assertThat(environment.get("EMPTY")).isEmpty();
        assertThat(environment.get("UNSET")).isEmpty();
    }

    @Test
    void childProcessesReceiveExportedValues() {
        ProcessEnvironment environment = new ProcessEnvironment(Map.of());
        environment.export("GROQ_API_KEY", "gsk_value");

        ProcessBuilder builder = environment.applyTo(new ProcessBuilder("env"));

        assertEquals("gsk_value", builder.environment().get("GROQ_API_KEY"));
        assertThat(environment.exported()).containsExactly(Map.entry("GROQ_API_KEY", "gsk_value"));
    }

    @Test
    void exportRequiresNameAndValue() {
        ProcessEnvironment environment = new ProcessEnvironment(Map.of());

        assertThrows(IllegalArgumentException.class, () -> environment.export(" ", "value"));
        assertThrows(IllegalArgumentException.class, () -> environment.export("NAME", null));
    }
}
