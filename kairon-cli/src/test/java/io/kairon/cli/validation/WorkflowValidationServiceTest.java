package io.kairon.cli.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

import io.kairon.core.WorkflowLinter;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.ValidationStatus;
import io.kairon.core.rule.node.SubWorkflowReferenceRule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowValidationServiceTest {

    private static final String DEAD_CODE =
            """
            {
              "name": "Order_Flow",
              "nodes": [
                {"parameters": {"path": "orders"}, "name": "Webhook",
                 "type": "n8n-nodes-base.webhook", "typeVersion": 2, "position": [0, 0]},
                {"parameters": {}, "name": "A", "type": "n8n-nodes-base.noOp",
                 "typeVersion": 1, "position": [200, 0]},
                {"parameters": {}, "name": "B", "type": "n8n-nodes-base.noOp",
                 "typeVersion": 1, "position": [400, 0]}
              ],
              "connections": {
                "Webhook": {"main": [[{"node": "A", "type": "main", "index": 0}]]},
                "B": {"main": [[{"node": "A", "type": "main", "index": 0}]]}
              }
            }
            """;

    private static final String CALLER =
            """
            {
              "name": "Caller",
              "nodes": [
                {"parameters": {"path": "calls"}, "name": "Webhook",
                 "type": "n8n-nodes-base.webhook", "typeVersion": 2, "position": [0, 0]},
                {"parameters": {"workflowId": {"__rl": true, "mode": "list", "value": "7",
                                 "cachedResultName": "Query_DB"}, "options": {}},
                 "name": "Call DB", "type": "n8n-nodes-base.executeWorkflow",
                 "typeVersion": 1.2, "position": [200, 0]}
              ],
              "connections": {
                "Webhook": {"main": [[{"node": "Call DB", "type": "main", "index": 0}]]}
              }
            }
            """;

    @TempDir Path tempDir;

    private final WorkflowValidationService service =
            new WorkflowValidationService(new WorkflowLinter(), 4);

    @Test
    void shouldReturnReportsInInputOrder() throws Exception {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            files.add(write("Flow_" + i + ".json", DEAD_CODE.replace("Order_Flow", "Flow_" + i)));
        }

        List<FileReport> reports = service.validateAll(files, WorkflowRegistry.empty(), false);

        assertThat(reports).extracting(FileReport::path).containsExactlyElementsOf(files);
        assertThat(reports)
                .allSatisfy(report -> assertThat(report.result().getDeadNodes()).containsExactly("B"));
    }

    @Test
    void shouldTurnParseFailureIntoSingleError() throws IOException {
        Path broken = write("Broken.json", "[]");

        FileReport report = service.validate(broken, WorkflowRegistry.empty(), false);

        assertThat(report.result().getWorkflowName()).isEqualTo("Broken");
        assertThat(report.result().getErrors())
                .singleElement()
                .satisfies(
                        diagnostic -> {
                            assertThat(diagnostic.ruleId())
                                    .isEqualTo(WorkflowValidationService.PARSE_RULE_ID);
                            assertThat(diagnostic.message()).startsWith("Invalid workflow document");
                        });
    }

    @Test
    void shouldFixWriteAndRevalidate() throws IOException {
        Path file = write("Order_Flow.json", DEAD_CODE);

        FileReport report = service.validate(file, WorkflowRegistry.empty(), true);

        assertThat(report.fixed()).isTrue();
        assertThat(report.removedNodes()).containsExactly("B");
        assertThat(report.result().getStatus()).isEqualTo(ValidationStatus.PASS);
        String rewritten = Files.readString(file);
        assertThat(rewritten).doesNotContain("\"B\"");
        assertThat(rewritten).contains("\"A\"");
    }

    @Test
    void shouldNotRewriteFileThatWasAlreadyFixed() throws IOException {
        Path file = write("Order_Flow.json", DEAD_CODE);
        service.validate(file, WorkflowRegistry.empty(), true);
        String fixedOnce = Files.readString(file);

        FileReport second = service.validate(file, WorkflowRegistry.empty(), true);

        assertThat(second.fixed()).isFalse();
        assertThat(second.result().getDeadNodes()).isEmpty();
        assertThat(Files.readString(file)).isEqualTo(fixedOnce);
    }

    @Test
    void shouldReportWriteFailureAsError() throws IOException {
        Path file = write("Order_Flow.json", DEAD_CODE);
        WorkflowLinter linter = spy(new WorkflowLinter());
        doAnswer(
                        invocation -> {
                            Files.delete(file);
                            Files.createDirectory(file);
                            return invocation.callRealMethod();
                        })
                .when(linter)
                .fix(any(), any());
        WorkflowValidationService failingService = new WorkflowValidationService(linter, 1);

        FileReport report = failingService.validate(file, WorkflowRegistry.empty(), true);

        assertThat(report.fixed()).isFalse();
        assertThat(report.result().getStatus()).isEqualTo(ValidationStatus.FAIL);
        assertThat(report.result().getDeadNodes()).containsExactly("B");
        assertThat(report.result().getErrors())
                .filteredOn(d -> d.ruleId().equals(WorkflowValidationService.FIX_RULE_ID))
                .singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("Auto-fix failed: "));
    }

    @Test
    void shouldValidateSubWorkflowCallWithoutSourceAlongsideSiblings() throws Exception {
        Path caller = write("Caller.json", CALLER);
        Path target = write("Query_DB.json", DEAD_CODE.replace("Order_Flow", "Query_DB"));
        Path broken = write("Zz_Broken.json", "{");

        List<FileReport> reports =
                service.validateAll(
                        List.of(caller, target, broken),
                        WorkflowRegistry.ofNames("Caller", "Query_DB"),
                        false);

        assertThat(reports).extracting(FileReport::path).containsExactly(caller, target, broken);
        assertThat(reports.get(0).result().getErrors())
                .extracting(Diagnostic::ruleId)
                .doesNotContain(SubWorkflowReferenceRule.ID);
        assertThat(reports.get(1).result().getDeadNodes()).containsExactly("B");
        assertThat(reports.get(2).result().getErrors())
                .extracting(Diagnostic::ruleId)
                .containsExactly(WorkflowValidationService.PARSE_RULE_ID);
    }

    @Test
    void shouldRejectNegativeParallelism() {
        assertThatThrownBy(() -> new WorkflowValidationService(new WorkflowLinter(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Path write(String fileName, String json) throws IOException {
        return Files.writeString(tempDir.resolve(fileName), json);
    }
}
