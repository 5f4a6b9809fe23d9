package de.bsommerfeld.scalatest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;

/**
 * Renders file locations the way build consoles print them, so terminals and
 * IDEs turn them into clickable links.
 */
public final class ConsoleLinks {

    private ConsoleLinks() {
    }

    /**
     * Returns a {@code file:///} URL for the absolute form of the given path,
     * e.g. {@code file:///home/me/build/reports/tests/index.html}.
     */
    public static String asClickableFileUrl(Path path) {
        String absolute = path.toAbsolutePath().toUri().getPath();
        try {
            return new URI("file", "", absolute, null, null).toString();
        } catch (URISyntaxException e) {
            // Path#toUri already produced a valid path component
            throw new IllegalStateException("Cannot render file URL for " + path, e);
        }
    }
}
