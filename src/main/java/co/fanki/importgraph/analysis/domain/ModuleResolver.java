package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.Set;

/**
 * Maps relative import specifiers to discovered module files.
 *
 * <p>Resolution is a pure function of the specifier, the importing file
 * and the discovered file set; the file system is never consulted. Order
 * of attempts, first match wins:</p>
 * <ol>
 *   <li>the exact path, as written</li>
 *   <li>the path plus each {@link ModuleDiscovery#EXTENSIONS extension}</li>
 *   <li>{@code path/index} plus each extension</li>
 * </ol>
 *
 * <p>Package specifiers (not starting with a dot) and paths that climb
 * above the analysis root stay unresolved.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ModuleResolver {

    private final Set<String> knownFiles;

    /**
     * Creates a resolver over the discovered modules.
     *
     * @param theKnownFiles the relative paths of every discovered module
     */
    public ModuleResolver(final Set<String> theKnownFiles) {
        Preconditions.requireNonNull(theKnownFiles,
                "Known files are required");
        this.knownFiles = Set.copyOf(theKnownFiles);
    }

    /**
     * Resolves a specifier written in the given file.
     *
     * @param specifier the raw import specifier
     * @param importingFile the relative path of the importing module
     * @return the relative path of the target module, or null
     */
    public String resolve(final String specifier, final String importingFile) {
        Preconditions.requireNonBlank(specifier, "Specifier is required");
        Preconditions.requireNonBlank(importingFile,
                "Importing file is required");

        if (!specifier.startsWith(".")) {
            return null;
        }

        final String base = ModulePaths.join(
                ModulePaths.directoryOf(importingFile), specifier);
        if (base == null) {
            return null;
        }

        if (!base.isEmpty()) {
            if (knownFiles.contains(base)) {
                return base;
            }
            for (final String ext : ModuleDiscovery.EXTENSIONS) {
                final String candidate = base + ext;
                if (knownFiles.contains(candidate)) {
                    return candidate;
                }
            }
        }

        final String indexBase = base.isEmpty() ? "index" : base + "/index";
        for (final String ext : ModuleDiscovery.EXTENSIONS) {
            final String candidate = indexBase + ext;
            if (knownFiles.contains(candidate)) {
                return candidate;
            }
        }

        return null;
    }

    /**
     * Resolves an edge, returning it completed when a target is found.
     *
     * @param edge the unresolved edge
     * @return the resolved edge, or the same edge if unresolved
     */
    public ImportEdge resolve(final ImportEdge edge) {
        Preconditions.requireNonNull(edge, "Edge is required");
        final String target = resolve(edge.specifier(), edge.file());
        return target == null ? edge : edge.resolvedTo(target);
    }

}
