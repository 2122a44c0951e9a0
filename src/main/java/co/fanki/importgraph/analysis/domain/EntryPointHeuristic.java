package co.fanki.importgraph.analysis.domain;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides from its file name whether a module looks like a program entry
 * point (server, CLI, worker, route handler) rather than a library module.
 *
 * <p>Matches {@code index.*}, {@code main.*}, {@code server.*},
 * {@code app.*}, {@code cli.*}, {@code worker.*}, {@code route.*} and any
 * name containing {@code .route.} or {@code .routes.}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EntryPointHeuristic {

    private static final List<Pattern> ENTRY_PATTERNS = List.of(
            Pattern.compile("^(?:index|main|server|app|cli|worker)\\."),
            Pattern.compile("\\.routes?\\."),
            Pattern.compile("^route\\."));

    private EntryPointHeuristic() {
    }

    /**
     * Checks whether the module is an entry point.
     *
     * @param file the module path, relative or absolute
     * @return true if the file name matches an entry point pattern
     */
    public static boolean isEntryPoint(final String file) {
        if (file == null) {
            return false;
        }
        final String name = ModulePaths.fileName(file.replace('\\', '/'));
        for (final Pattern pattern : ENTRY_PATTERNS) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

}
