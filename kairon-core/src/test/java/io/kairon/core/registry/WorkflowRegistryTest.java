package io.kairon.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

public class WorkflowRegistryTest {

    private final WorkflowRegistry registry =
            WorkflowRegistry.of(
                    List.of(
                            new RegistryEntry("Query_DB", "wf-1", false),
                            new RegistryEntry("Old_Flow", "wf-2", true),
                            new RegistryEntry("Route_Message", null, false),
                            new RegistryEntry("Route_Message", "wf-4", false)));

    @Test
    void shouldResolveNames() {
        assertThat(registry.exists("Query_DB")).isTrue();
        assertThat(registry.exists("Old_Flow")).isTrue();
        assertThat(registry.exists("Missing")).isFalse();
        assertThat(registry.exists(null)).isFalse();
    }

    @Test
    void shouldReportArchivedNames() {
        assertThat(registry.isArchived("Old_Flow")).isTrue();
        assertThat(registry.isArchived("Query_DB")).isFalse();
        assertThat(registry.isArchived("Missing")).isFalse();
    }

    @Test
    void shouldIndexIds() {
        assertThat(registry.hasIds()).isTrue();
        assertThat(registry.containsId("wf-2")).isTrue();
        assertThat(registry.containsId("wf-9")).isFalse();
        assertThat(WorkflowRegistry.ofNames("A").hasIds()).isFalse();
    }

    @Test
    void shouldCountDuplicateNames() {
        assertThat(registry.occurrences("Route_Message")).isEqualTo(2);
        assertThat(registry.occurrences("Query_DB")).isEqualTo(1);
        assertThat(registry.occurrences("Missing")).isZero();
        assertThat(registry.size()).isEqualTo(4);
        assertThat(registry.names()).containsExactly("Query_DB", "Old_Flow", "Route_Message");
    }

    @Test
    void shouldShareEmptyRegistry() {
        assertThat(WorkflowRegistry.of(List.of())).isSameAs(WorkflowRegistry.empty());
        assertThat(WorkflowRegistry.empty().exists("Query_DB")).isFalse();
    }
}
