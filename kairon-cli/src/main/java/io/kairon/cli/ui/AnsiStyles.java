package io.kairon.cli.ui;

import io.kairon.core.result.Severity;
import io.kairon.core.result.ValidationStatus;

/// ANSI text styling for reports and graph renderings.
///
/// All methods return styled strings; output handling is the caller's responsibility.
/// With color disabled every method returns its input unchanged, which keeps CI logs
/// and piped output free of escape codes.
///
/// ### Usage
/// {@snippet :
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.status(ValidationStatus.FAIL) + " " + styles.bold("Order_Flow"));
/// }
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
///
/// @see #of(boolean) factory method for creating instances
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies gray color for secondary elements such as rule ids.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    // --- Semantic Colors ---

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors a label by finding severity: red errors, yellow warnings, blue infos.
    public String severity(Severity severity, String text) {
        return switch (severity) {
            case ERROR -> error(text);
            case WARNING -> warn(text);
            case INFO -> accent(text);
        };
    }

    /// Renders a document status as a bracketed, colored tag, e.g. `[FAIL]`.
    public String status(ValidationStatus status) {
        String tag = "[" + status.name() + "]";
        return switch (status) {
            case FAIL -> error(tag);
            case WARN -> warn(tag);
            case PASS -> success(tag);
        };
    }

    // --- Symbols ---

    /// Right arrow for connections.
    public String arrow() {
        return style("→", BLUE);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    // --- Box Drawing ---

    /// Box top-left corner: ┌─
    public String boxTop() {
        return style("┌─", DIM);
    }

    /// Box vertical line: │
    public String boxMid() {
        return style("│", DIM);
    }

    /// Box bottom-left corner: └─
    public String boxBottom() {
        return style("└─", DIM);
    }

    /// Horizontal rule of the given width.
    public String separator(int width) {
        return style("─".repeat(width), DIM);
    }
}
