package co.fanki.importgraph.analysis.domain;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * String operations over root-relative module paths.
 *
 * <p>Module identities are relative paths with {@code /} separators so
 * that resolution can work on plain strings, independent of the host file
 * system.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModulePaths {

    private ModulePaths() {
    }

    /**
     * Converts a path relative to the root into a module identity.
     *
     * @param root the analysis root
     * @param file a file under the root
     * @return the relative path with forward slashes
     */
    public static String relativize(final Path root, final Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Returns the directory part of a relative path, empty at the root.
     *
     * @param relativePath the module path
     * @return the parent directory, without a trailing slash
     */
    public static String directoryOf(final String relativePath) {
        final int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    /**
     * Returns the last segment of a relative path.
     *
     * @param relativePath the module path
     * @return the file name
     */
    public static String fileName(final String relativePath) {
        final int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    /**
     * Joins a directory and a specifier, collapsing {@code .} and
     * {@code ..} segments.
     *
     * @param directory the base directory, empty for the root
     * @param specifier the relative specifier
     * @return the normalized path, or null if it escapes the root
     */
    public static String join(final String directory, final String specifier) {
        final Deque<String> segments = new ArrayDeque<>();
        appendSegments(segments, directory);

        for (final String segment : specifier.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }

    private static void appendSegments(final Deque<String> segments,
            final String directory) {
        if (directory == null || directory.isEmpty()) {
            return;
        }
        for (final String segment : directory.split("/")) {
            if (!segment.isEmpty()) {
                segments.addLast(segment);
            }
        }
    }

}
