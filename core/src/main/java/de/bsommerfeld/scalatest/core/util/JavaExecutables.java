package de.bsommerfeld.scalatest.core.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Locates a {@code java} binary for spawning child JVMs.
 */
public final class JavaExecutables {

    private JavaExecutables() {
    }

    /**
     * Finds the {@code java} executable. Prefers the JVM this code runs on, then
     * {@code JAVA_HOME}, and finally falls back to whatever {@code java} the
     * {@code PATH} yields.
     */
    public static String resolve() {
        Path current = binaryIn(System.getProperty("java.home"));
        if (current != null) {
            return current.toString();
        }
        Path javaHome = binaryIn(System.getenv("JAVA_HOME"));
        if (javaHome != null) {
            return javaHome.toString();
        }
        return "java";
    }

    private static Path binaryIn(String home) {
        if (home == null || home.isEmpty()) {
            return null;
        }
        Path java = Path.of(home, "bin", isWindows() ? "java.exe" : "java");
        return Files.isExecutable(java) ? java : null;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ENGLISH).contains("win");
    }
}
