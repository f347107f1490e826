package io.kairon.cli.visualizer;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.workflow.WorkflowDocument;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Registry and dispatcher for graph visualization formats.
///
/// @implNote Thread-safe after construction. Format map is immutable.
/// @see VisualizationFormat
@ApplicationScoped
public class WorkflowVisualizer {

    public static final String DEFAULT_FORMAT = "text";

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with all CDI-discovered format implementations.
    ///
    /// @param formatInstances CDI-provided format implementations, not null
    @Inject
    public WorkflowVisualizer(Instance<VisualizationFormat> formatInstances) {
        this(formatInstances.stream().toList());
    }

    /// Creates a visualizer with explicit formats.
    ///
    /// @param formats format implementations with distinct names, not null
    public WorkflowVisualizer(Collection<VisualizationFormat> formats) {
        this.formats =
                formats.stream()
                        .collect(
                                Collectors.toUnmodifiableMap(
                                        VisualizationFormat::getName, Function.identity()));
    }

    /// Renders a document using the specified format.
    ///
    /// @param document the workflow to visualize, not null
    /// @param analysis reachability of the document, not null
    /// @param formatName the format name (e.g., "text", "mermaid"), not null
    /// @param styles output styling, not null
    /// @return formatted visualization, never null
    /// @throws IllegalArgumentException if format is not registered
    public String visualize(
            WorkflowDocument document,
            GraphAnalysis analysis,
            String formatName,
            AnsiStyles styles) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", getAvailableFormats()));
        }
        return format.render(document, analysis, styles);
    }

    /// Returns the names of all registered formats in alphabetical order.
    public Iterable<String> getAvailableFormats() {
        return new TreeMap<>(formats).keySet();
    }
}
