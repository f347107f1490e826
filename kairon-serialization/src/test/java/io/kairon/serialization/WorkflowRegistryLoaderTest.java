package io.kairon.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.registry.WorkflowRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowRegistryLoaderTest {

    @TempDir Path projectDir;

    @Test
    void shouldRegisterEveryTopLevelWorkflow() throws IOException {
        write("Order_Flow.json", "{\"name\": \"Order_Flow\", \"id\": \"wf-1\", \"nodes\": []}");
        write("Query_DB.json", "{\"name\": \"Query_DB\", \"id\": 42}");
        write("Legacy.json", "{\"name\": \"Legacy\", \"isArchived\": true}");

        WorkflowRegistry registry = WorkflowRegistryLoader.build(projectDir);

        assertThat(registry.names()).containsExactlyInAnyOrder("Order_Flow", "Query_DB", "Legacy");
        assertThat(registry.containsId("wf-1")).isTrue();
        assertThat(registry.containsId("42")).isTrue();
        assertThat(registry.isArchived("Legacy")).isTrue();
        assertThat(registry.isArchived("Order_Flow")).isFalse();
    }

    @Test
    void shouldFallBackToFileStemForUnnamedWorkflow() throws IOException {
        write("Unnamed_Flow.json", "{\"nodes\": []}");

        WorkflowRegistry registry = WorkflowRegistryLoader.build(projectDir);

        assertThat(registry.exists("Unnamed_Flow")).isTrue();
    }

    @Test
    void shouldSkipBrokenAndNonWorkflowFiles() throws IOException {
        write("Good.json", "{\"name\": \"Good\"}");
        write("Broken.json", "{\"name\": ");
        write("List.json", "[1, 2, 3]");
        write("notes.txt", "{\"name\": \"Notes\"}");
        Files.createDirectories(projectDir.resolve("tests"));
        Files.writeString(projectDir.resolve("tests/Fixture.json"), "{\"name\": \"Fixture\"}");

        WorkflowRegistry registry = WorkflowRegistryLoader.build(projectDir);

        assertThat(registry.names()).containsExactly("Good");
    }

    @Test
    void shouldCountDuplicateNames() throws IOException {
        write("Flow_A.json", "{\"name\": \"Shared\"}");
        write("Flow_B.json", "{\"name\": \"Shared\"}");

        assertThat(WorkflowRegistryLoader.build(projectDir).occurrences("Shared")).isEqualTo(2);
    }

    @Test
    void shouldReturnEmptyRegistryForMissingDirectory() {
        WorkflowRegistry registry = WorkflowRegistryLoader.build(projectDir.resolve("absent"));

        assertThat(registry.size()).isZero();
    }

    @Test
    void shouldListWorkflowFilesInNameOrder() throws IOException {
        write("b.json", "{}");
        write("a.json", "{}");
        write("c.yaml", "{}");

        assertThat(WorkflowFiles.list(projectDir))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("a.json", "b.json");
    }

    private void write(String fileName, String json) throws IOException {
        Files.writeString(projectDir.resolve(fileName), json);
    }
}
