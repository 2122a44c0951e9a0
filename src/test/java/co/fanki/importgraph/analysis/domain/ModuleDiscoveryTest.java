package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ModuleDiscovery}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ModuleDiscoveryTest {

    private final ModuleDiscovery discovery = new ModuleDiscovery();

    @Test
    void whenDiscovering_givenAllModuleExtensions_shouldFindEveryFile(
            @TempDir final Path root) throws IOException {

        for (final String name : List.of("a.ts", "b.tsx", "c.js", "d.jsx",
                "e.mts", "f.mjs")) {
            write(root, name, "export const x = 1;");
        }
        write(root, "README.md", "# readme");
        write(root, "styles.css", "body {}");

        final List<String> found = relative(root, discovery.discover(root));

        assertEquals(List.of("a.ts", "b.tsx", "c.js", "d.jsx", "e.mts",
                "f.mjs"), found);
    }

    @Test
    void whenDiscovering_givenExcludedDirectories_shouldSkipThem(
            @TempDir final Path root) throws IOException {

        write(root, "src/app.ts", "");
        for (final String dir : List.of("node_modules/pkg", ".git", "dist",
                ".next", ".output", "build", "coverage")) {
            write(root, dir + "/skip.js", "");
        }

        final List<String> found = relative(root, discovery.discover(root));

        assertEquals(List.of("src/app.ts"), found);
    }

    @Test
    void whenDiscovering_givenNestedDirectories_shouldReturnSortedPaths(
            @TempDir final Path root) throws IOException {

        write(root, "z.ts", "");
        write(root, "lib/b.ts", "");
        write(root, "lib/a.ts", "");

        final List<String> found = relative(root, discovery.discover(root));

        assertEquals(List.of("lib/a.ts", "lib/b.ts", "z.ts"), found);
    }

    @Test
    void whenDiscovering_givenSymbolicLinks_shouldSkipThem(
            @TempDir final Path root) throws IOException {

        final Path real = write(root, "real/a.ts", "export const a = 1;");
        Files.createSymbolicLink(root.resolve("link.ts"), real);
        Files.createSymbolicLink(root.resolve("linked-dir"),
                root.resolve("real"));

        final List<String> found = relative(root, discovery.discover(root));

        assertEquals(List.of("real/a.ts"), found);
    }

    @Test
    void whenCheckingDiscoverable_shouldRequireExtensionOutsideExcludedDirs() {
        assertTrue(ModuleDiscovery.isDiscoverable(Path.of("src/app.ts")));
        assertTrue(ModuleDiscovery.isDiscoverable(Path.of("index.js")));
        assertFalse(ModuleDiscovery.isDiscoverable(Path.of("styles.css")));
        assertFalse(ModuleDiscovery.isDiscoverable(
                Path.of("node_modules/x/index.js")));
        assertFalse(ModuleDiscovery.isDiscoverable(
                Path.of("packages/ui/dist/index.js")));
    }

    @Test
    void whenDiscovering_givenMissingRoot_shouldThrowRootNotFound(
            @TempDir final Path root) {

        final DomainException e = assertThrows(DomainException.class,
                () -> discovery.discover(root.resolve("missing")));

        assertEquals(DomainException.ROOT_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void whenDiscovering_givenFileAsRoot_shouldThrowRootNotFound(
            @TempDir final Path root) throws IOException {

        final Path file = write(root, "a.ts", "");

        final DomainException e = assertThrows(DomainException.class,
                () -> discovery.discover(file));

        assertEquals(DomainException.ROOT_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void whenCheckingExtension_shouldMatchOnlyModuleFiles() {
        assertTrue(ModuleDiscovery.hasModuleExtension(Path.of("x.d.ts")));
        assertTrue(ModuleDiscovery.hasModuleExtension(Path.of("x.mjs")));
        assertFalse(ModuleDiscovery.hasModuleExtension(Path.of("x.json")));
        assertFalse(ModuleDiscovery.hasModuleExtension(Path.of("ts")));
    }

    private static Path write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private static List<String> relative(final Path root,
            final List<Path> files) {
        return files.stream()
                .map(file -> ModulePaths.relativize(root, file))
                .toList();
    }

}
