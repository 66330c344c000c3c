package info.isaksson.erland.csfuse.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** A source file and its text, read once. */
public final class SourceFile {
    public final Path path;
    public final String text;

    public SourceFile(Path path, String text) {
        this.path = Objects.requireNonNull(path, "path");
        this.text = Objects.requireNonNull(text, "text");
    }

    /** Read {@code path} as UTF-8; malformed bytes are replaced rather than rejected. */
    public static SourceFile read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return new SourceFile(path, new String(bytes, StandardCharsets.UTF_8));
    }

    /** Base name, e.g. {@code Feature.cs} for {@code Sub/Feature.cs}. */
    public String fileName() {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
