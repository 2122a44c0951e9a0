package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.DomainException;
import co.fanki.importgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks an analysis root and collects the TypeScript/JavaScript module
 * files under it.
 *
 * <p>Directories that hold dependencies, version-control metadata or build
 * output are pruned. Symbolic links are not followed and, like any other
 * non-regular file, never reported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ModuleDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(
            ModuleDiscovery.class);

    /** Recognized extensions, in resolution priority order. */
    public static final List<String> EXTENSIONS = List.of(
            ".ts", ".tsx", ".js", ".jsx", ".mts", ".mjs");

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules", ".git", "dist", ".next", ".output", "build",
            "coverage");

    /**
     * Discovers all module files under the root.
     *
     * @param root the analysis root directory
     * @return absolute paths of the module files, sorted
     * @throws DomainException if the root is not a readable directory or the
     *         walk fails
     */
    public List<Path> discover(final Path root) {
        Preconditions.requireNonNull(root, "Analysis root is required");

        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new DomainException(
                    "Analysis root is not a readable directory: " + root,
                    DomainException.ROOT_NOT_FOUND);
        }

        final List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(final Path dir,
                        final BasicFileAttributes attrs) {
                    if (!dir.equals(root) && EXCLUDED_DIRS.contains(
                            dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(final Path file,
                        final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasModuleExtension(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file,
                        final IOException e) {
                    LOG.warn("Skipping unreadable entry {}: {}", file,
                            e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw new DomainException("Failed to walk " + root,
                    DomainException.DISCOVERY_FAILED, e);
        }

        files.sort(null);
        LOG.debug("Discovered {} module files under {}", files.size(), root);
        return files;
    }

    /**
     * Checks whether the file name carries a recognized extension.
     *
     * @param file the file to check
     * @return true if the file is a module candidate
     */
    public static boolean hasModuleExtension(final Path file) {
        final String name = file.getFileName().toString();
        for (final String ext : EXTENSIONS) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a root-relative path is one that discovery would
     * return: it carries a module extension and crosses no excluded
     * directory.
     *
     * @param relative the path relative to the analysis root
     * @return true if the path can be a module of the graph
     */
    public static boolean isDiscoverable(final Path relative) {
        if (!hasModuleExtension(relative)) {
            return false;
        }
        final Path parent = relative.getParent();
        if (parent != null) {
            for (final Path segment : parent) {
                if (EXCLUDED_DIRS.contains(segment.toString())) {
                    return false;
                }
            }
        }
        return true;
    }

}
