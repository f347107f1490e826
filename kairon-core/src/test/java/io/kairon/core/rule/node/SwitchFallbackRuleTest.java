package io.kairon.core.rule.node;

import static io.kairon.core.WorkflowFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.Severity;
import io.kairon.core.workflow.node.Node;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SwitchFallbackRuleTest {

    private final SwitchFallbackRule rule = new SwitchFallbackRule();

    @Test
    void shouldRejectUnknownFallbackFromVersionThree() {
        var route = switchNode(3, Map.of("fallbackOutput", "maybe"));

        List<Diagnostic> diagnostics = rule.check(route, context(route));

        assertThat(diagnostics)
                .singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR))
                .extracting(Diagnostic::message)
                .isEqualTo("'Route': Switch node fallbackOutput invalid value: 'maybe'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"extra", "none"})
    void shouldAcceptSupportedFallbacks(String fallback) {
        var route = switchNode(3.2, Map.of("fallbackOutput", fallback));

        assertThat(rule.check(route, context(route))).isEmpty();
    }

    @Test
    void shouldRejectNonStringFallback() {
        var route = switchNode(3, Map.of("fallbackOutput", 2));

        assertThat(rule.check(route, context(route)))
                .singleElement()
                .extracting(Diagnostic::message)
                .asString()
                .endsWith("got: number");
    }

    @Test
    void shouldNotValidateValueBeforeVersionThree() {
        var route = switchNode(2, Map.of("fallbackOutput", "maybe"));

        assertThat(rule.check(route, context(route))).isEmpty();
    }

    @Test
    void shouldWarnWithoutFallback() {
        var route = switchNode(3, Map.of());

        assertThat(rule.check(route, context(route)))
                .singleElement()
                .satisfies(d -> assertThat(d.severity()).isEqualTo(Severity.WARNING));
    }

    private static Node switchNode(Number version, Map<String, Object> options) {
        return Node.builder()
                .name("Route")
                .type("n8n-nodes-base.switch")
                .typeVersion(version)
                .parameters(Map.of("rules", Map.of(), "options", options))
                .build();
    }
}
