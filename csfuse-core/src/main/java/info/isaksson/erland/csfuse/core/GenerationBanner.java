package info.isaksson.erland.csfuse.core;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/** The comment block written above the fused output. It is plain text, not part of the syntax tree. */
public final class GenerationBanner {

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "// ------------------------------------------------------------";

    private GenerationBanner() {}

    public static String render(String version, LocalDateTime generatedAt) {
        Objects.requireNonNull(generatedAt, "generatedAt");
        String v = version == null || version.isBlank() ? ToolVersion.UNKNOWN : version;
        return RULE + "\n"
                + "//  Generated by " + ToolVersion.TOOL_NAME + " v" + v + "\n"
                + "//  Generation Date: " + TIMESTAMP.format(generatedAt) + "\n"
                + RULE;
    }
}
