package io.kairon.cli.visualizer;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.workflow.WorkflowDocument;

/// Strategy interface for rendering a workflow's connection graph.
///
/// Implementations are discovered via CDI and registered in {@link WorkflowVisualizer}.
/// Each implementation provides a unique format name for selection.
///
/// ### Built-in Formats
/// - `text` - box-drawn node list with ANSI colors ({@link TextVisualizationFormat})
/// - `mermaid` - Mermaid flowchart syntax ({@link MermaidVisualizationFormat})
///
/// @see WorkflowVisualizer
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection (e.g., "text", "mermaid"), never null
    String getName();

    /// Renders the graph in this format.
    ///
    /// @param document the workflow to visualize, not null
    /// @param analysis reachability of the document, used to mark triggers and dead nodes
    /// @param styles output styling, ignored by formats without color
    /// @return formatted representation, never null
    String render(WorkflowDocument document, GraphAnalysis analysis, AnsiStyles styles);
}
