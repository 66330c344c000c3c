package info.isaksson.erland.csfuse.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/** Tool identity; the version is filtered into {@code csfuse/version.properties} by the build. */
public final class ToolVersion {

    public static final String TOOL_NAME = "csfuse";
    public static final String UNKNOWN = "unknown";

    private static final String RESOURCE = "/csfuse/version.properties";

    private ToolVersion() {}

    public static String version() {
        try (InputStream in = ToolVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) return UNKNOWN;
            Properties props = new Properties();
            props.load(in);
            String v = props.getProperty("version", "").trim();
            // unfiltered resource (e.g. run from an IDE without Maven resource processing)
            if (v.isEmpty() || v.startsWith("${")) return UNKNOWN;
            return v;
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
    }
}
