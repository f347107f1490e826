package io.kairon.core.rule.node;

import static io.kairon.core.WorkflowFixtures.code;
import static io.kairon.core.WorkflowFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.Severity;
import io.kairon.core.rule.NamePrefixExemption;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CtxConventionRuleTest {

    private final CtxConventionRule rule = new CtxConventionRule();

    // -------------------------------------------------------------------------
    // Legacy flat patterns
    // -------------------------------------------------------------------------

    @Nested
    class LegacyPatternTest {

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '"',
                value = {
                    "return { response: text };|returns flat {response:} instead of {ctx: {..., response:}}",
                    "return {error: 'bad input'};|returns flat {error:} instead of {ctx: {..., validation:}}",
                    "return { valid: false };|returns flat {valid:} instead of {ctx: {..., validation:}}",
                    "return { ...$json, extra: 1 };|spreads $json instead of $json.ctx",
                    "return { ...event, handled: true };|returns {...event} instead of ctx pattern"
                })
        void shouldReportLegacyPattern(String jsCode, String message) {
            var node = code("Format Reply", jsCode);

            assertThat(rule.check(node, context(node)))
                    .extracting(Diagnostic::message)
                    .contains("'Format Reply': " + message);
        }

        @Test
        void shouldAllowSpreadingCtx() {
            var node = code("Format Reply", "return { ctx: { ...$json.ctx, response: text } };");

            assertThat(rule.check(node, context(node))).isEmpty();
        }

        @Test
        void shouldReportEveryMatchingPattern() {
            var node = code("Format Reply", "if (x) return { error: 'e' };\nreturn { valid: true };");

            assertThat(rule.check(node, context(node)))
                    .hasSize(2)
                    .allSatisfy(d -> assertThat(d.severity()).isEqualTo(Severity.ERROR));
        }
    }

    // -------------------------------------------------------------------------
    // Flat access
    // -------------------------------------------------------------------------

    @Nested
    class FlatAccessTest {

        @Test
        void shouldWarnAboutFlatAccessWithoutCtxOutput() {
            var node =
                    code(
                            "Build Prompt",
                            "const text = $json.message;\nconst prompt = `Reply to: ${text}`;\nreturn { prompt };");

            assertThat(rule.check(node, context(node)))
                    .singleElement()
                    .satisfies(
                            d -> {
                                assertThat(d.severity()).isEqualTo(Severity.WARNING);
                                assertThat(d.message())
                                        .isEqualTo("'Build Prompt': may be using flat data access");
                            });
        }

        @Test
        void shouldAcceptFlatReadWhenCtxIsProduced() {
            var node =
                    code(
                            "Build Prompt",
                            "const text = $json.message;\nreturn { ctx: { ...$json.ctx, llm: { prompt: text } } };");

            assertThat(rule.check(node, context(node))).isEmpty();
        }

        @Test
        void shouldSkipShortAndPassthroughCode() {
            var shortNode = code("Pick", "return { text: $json.message };");
            var passthrough =
                    code(
                            "Forward",
                            "// Passthrough: forwards the webhook body untouched\nreturn $json.body;");

            assertThat(rule.check(shortNode, context(shortNode))).isEmpty();
            assertThat(rule.check(passthrough, context(passthrough))).isEmpty();
        }
    }

    // -------------------------------------------------------------------------
    // Exemptions
    // -------------------------------------------------------------------------

    @Test
    void shouldExemptPreContextNodesByPrefix() {
        var node = code("Parse Message", "return { response: $json.body.content };");

        assertThat(rule.check(node, context(node))).isEmpty();
    }

    @Test
    void shouldFlagRawInputNodeNamedDifferently() {
        var node = code("Read Raw Input", "return { response: $json.body.content };");

        assertThat(rule.check(node, context(node))).isNotEmpty();
    }

    @Test
    void shouldHonourConfiguredPrefixes() {
        var custom = new CtxConventionRule(new NamePrefixExemption(List.of("Ingest")));
        var ingest = code("Ingest Event", "return { response: $json.body.content };");
        var parse = code("Parse Message", "return { response: $json.body.content };");

        assertThat(custom.check(ingest, context(ingest))).isEmpty();
        assertThat(custom.check(parse, context(parse))).isNotEmpty();
    }
}
