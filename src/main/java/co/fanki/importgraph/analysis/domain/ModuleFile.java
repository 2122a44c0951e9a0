package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.nio.file.Path;

/**
 * A source file read from the analysis root.
 *
 * <p>Only lives between reading and extraction; the graph keeps the
 * relative path as the file identity and drops the content.</p>
 *
 * @param absolutePath the absolute file path
 * @param relativePath the path relative to the analysis root, always with
 *                     {@code /} separators
 * @param content the raw text content
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleFile(
        Path absolutePath,
        String relativePath,
        String content
) {

    public ModuleFile {
        Preconditions.requireNonNull(absolutePath,
                "Absolute path is required");
        Preconditions.requireNonBlank(relativePath,
                "Relative path is required");
        Preconditions.requireNonNull(content, "Content is required");
    }

}
