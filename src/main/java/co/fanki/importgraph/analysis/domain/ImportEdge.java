package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.List;

/**
 * A single import (or re-export) found in a module.
 *
 * <p>Created unresolved by a {@link ModuleExtractor} and completed by the
 * {@link ModuleResolver} through {@link #resolvedTo(String)}. Edges are
 * immutable; resolving returns a new edge.</p>
 *
 * <p>Symbolic kinds carry two parallel name lists: {@code symbols} holds
 * the names bound or exported by the importing file (the alias in
 * {@code b as c}), while {@code importedNames} holds the names the target
 * module is asked for (the {@code b}). Non-symbolic kinds leave both
 * empty.</p>
 *
 * @param file the relative path of the importing module
 * @param specifier the raw specifier as written (e.g. "../services/user")
 * @param kind the syntactic import form
 * @param symbols the local or re-exported names, in declaration order
 * @param importedNames the names requested from the target, in the same
 *                      order as {@code symbols}
 * @param target the relative path of the resolved module, null when
 *               unresolved
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportEdge(
        String file,
        String specifier,
        ImportKind kind,
        List<String> symbols,
        List<String> importedNames,
        String target
) {

    /** Shown in place of a symbol list for dynamic and require edges. */
    public static final String DYNAMIC_PLACEHOLDER = "(dynamic)";

    /** Shown in place of a symbol list for namespace edges. */
    public static final String NAMESPACE_PLACEHOLDER = "*";

    public ImportEdge {
        Preconditions.requireNonBlank(file, "Importing file is required");
        Preconditions.requireNonBlank(specifier, "Specifier is required");
        Preconditions.requireNonNull(kind, "Import kind is required");
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        importedNames = importedNames == null
                ? symbols : List.copyOf(importedNames);
        Preconditions.require(symbols.size() == importedNames.size(),
                "Symbols and imported names must be parallel");
    }

    /**
     * Creates an unresolved edge whose local names equal the requested
     * names.
     *
     * @param file the importing module
     * @param specifier the raw specifier
     * @param kind the import form
     * @param symbols the bound names
     * @return the unresolved edge
     */
    public static ImportEdge of(final String file, final String specifier,
            final ImportKind kind, final List<String> symbols) {
        return new ImportEdge(file, specifier, kind, symbols, symbols, null);
    }

    /**
     * Creates an unresolved edge with no symbol list.
     *
     * @param file the importing module
     * @param specifier the raw specifier
     * @param kind the import form
     * @return the unresolved edge
     */
    public static ImportEdge opaque(final String file, final String specifier,
            final ImportKind kind) {
        return new ImportEdge(file, specifier, kind, List.of(), List.of(),
                null);
    }

    /**
     * Returns a copy of this edge pointing at the given module.
     *
     * @param theTarget the relative path of the resolved module
     * @return the resolved edge
     */
    public ImportEdge resolvedTo(final String theTarget) {
        Preconditions.requireNonBlank(theTarget, "Target is required");
        return new ImportEdge(file, specifier, kind, symbols, importedNames,
                theTarget);
    }

    /**
     * Whether the resolver mapped this edge to a discovered module.
     *
     * @return true if resolved
     */
    public boolean isResolved() {
        return target != null;
    }

    /**
     * Whether the specifier is relative, thus a resolution candidate.
     *
     * @return true if the specifier starts with a dot
     */
    public boolean isRelative() {
        return specifier.startsWith(".");
    }

    /**
     * Whether this edge may reach exports of its target without naming
     * them: namespace, dynamic and require forms, and {@code export *}.
     *
     * @return true if the edge is opaque to symbol-level analysis
     */
    public boolean isOpaque() {
        return !kind.isSymbolic()
                || (kind == ImportKind.RE_EXPORT && symbols.isEmpty());
    }

    /**
     * Returns the symbol list for reporting, with placeholders for the
     * forms that bind no enumerable names.
     *
     * @return the symbols, or a single placeholder
     */
    public List<String> displaySymbols() {
        return switch (kind) {
            case DYNAMIC, REQUIRE -> List.of(DYNAMIC_PLACEHOLDER);
            case NAMESPACE -> List.of(NAMESPACE_PLACEHOLDER);
            case RE_EXPORT -> symbols.isEmpty()
                    ? List.of(NAMESPACE_PLACEHOLDER) : symbols;
            default -> symbols;
        };
    }

}
