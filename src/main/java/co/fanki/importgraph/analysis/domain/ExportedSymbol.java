package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

/**
 * A symbol a module makes available to importers.
 *
 * @param file the relative path of the owning module
 * @param name the exported name
 * @param kind named or default export
 * @param reExport true if the symbol is only forwarded from another module
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExportedSymbol(
        String file,
        String name,
        ExportKind kind,
        boolean reExport
) {

    public ExportedSymbol {
        Preconditions.requireNonBlank(file, "Owning file is required");
        Preconditions.requireNonBlank(name, "Symbol name is required");
        Preconditions.requireNonNull(kind, "Export kind is required");
    }

    /**
     * Creates a named export declared in the file itself.
     *
     * @param file the owning module
     * @param name the exported name
     * @return the exported symbol
     */
    public static ExportedSymbol named(final String file, final String name) {
        return new ExportedSymbol(file, name, ExportKind.NAMED, false);
    }

    /**
     * Creates a default export.
     *
     * @param file the owning module
     * @param name the declared name of the default export
     * @return the exported symbol
     */
    public static ExportedSymbol defaultExport(final String file,
            final String name) {
        return new ExportedSymbol(file, name, ExportKind.DEFAULT, false);
    }

    /**
     * Creates a symbol forwarded from another module.
     *
     * @param file the re-exporting module
     * @param name the name under which it is re-exported
     * @return the exported symbol
     */
    public static ExportedSymbol reExported(final String file,
            final String name) {
        return new ExportedSymbol(file, name, ExportKind.NAMED, true);
    }

}
