package io.kairon.core.rule.node;

import static io.kairon.core.WorkflowFixtures.code;
import static io.kairon.core.WorkflowFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class CodeReturnShapeRuleTest {

    private final CodeReturnShapeRule rule = new CodeReturnShapeRule();

    @Test
    void shouldWarnAboutArrayReturnPerItem() {
        var node = code("Split", "runOnceForEachItem", "return [{ a: $json.a }];");

        assertThat(rule.check(node, context(node))).hasSize(1);
    }

    @Test
    void shouldAcceptExplicitItemWrapper() {
        var node = code("Split", "runOnceForEachItem", "return [{json: $json}];");

        assertThat(rule.check(node, context(node))).isEmpty();
    }

    @Test
    void shouldAcceptSpreadInput() {
        var node =
                code(
                        "Collect",
                        "runOnceForEachItem",
                        "const all = [...$input.all()];\nreturn [{ merged: all }];");

        assertThat(rule.check(node, context(node))).isEmpty();
    }

    @Test
    void shouldIgnoreAllItemsMode() {
        var node = code("Split", "runOnceForAllItems", "return [{ a: 1 }];");
        var unset = code("Split", "return [{ a: 1 }];");

        assertThat(rule.check(node, context(node))).isEmpty();
        assertThat(rule.check(unset, context(unset))).isEmpty();
    }
}
