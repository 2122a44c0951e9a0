package co.fanki.importgraph.analysis.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DeadExportDetector}.
 *
 * <p>Each test writes a small tree to a temporary directory and parses it
 * with the regular pipeline, so the detector sees real extracted edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DeadExportDetectorTest {

    @TempDir
    Path root;

    private final DeadExportDetector detector = new DeadExportDetector();

    @Test
    void whenDetecting_givenUnimportedExport_shouldFlagItHighConfidence()
            throws IOException {
        write("util.ts", """
                export const used = 1;
                export function unused() {}
                """);
        write("consumer.ts", "import { used } from './util';\n");

        final List<DeadExport> dead = detect();

        assertEquals(1, dead.size());
        assertEquals("util.ts", dead.get(0).file());
        assertEquals("unused", dead.get(0).symbol());
        assertEquals(DeadExportConfidence.HIGH, dead.get(0).confidence());
    }

    @Test
    void whenDetecting_givenNamespaceImport_shouldNeverFlagOwningModule()
            throws IOException {
        write("util.ts", """
                export const a = 1;
                export const b = 2;
                """);
        write("consumer.ts", "import * as util from './util';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenDynamicOrRequireImport_shouldBeConservative()
            throws IOException {
        write("lazy.ts", "export const page = 1;\n");
        write("legacy.js", "export const helper = 1;\n");
        write("loader.js", """
                const lazy = () => import('./lazy');
                const legacy = require('./legacy');
                """);

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenAliasedNamedImport_shouldMatchOriginalName()
            throws IOException {
        write("math.ts", "export const add = () => 0;\n");
        write("calc.ts", "import { add as plus } from './math';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenSameNameImportedFromOtherModule_shouldNotFlag()
            throws IOException {
        write("a.ts", "export const shared = 1;\n");
        write("b.ts", "export const shared = 2;\n");
        write("c.ts", "import { shared } from './a';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenPathAliasImport_shouldNotFlag()
            throws IOException {
        write("src/lib/format.ts", "export function formatDate() {}\n");
        write("src/feature.ts", """
                import { formatDate } from '@/lib/format';
                formatDate();
                """);

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenNameOnlyMentionedElsewhere_shouldNotFlag()
            throws IOException {
        write("handlers.ts", "export const onSave = () => {};\n");
        write("registry.js",
                "module.exports = { save: handlers['onSave'] };\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenNameOnlyInsideLongerIdentifier_shouldFlag()
            throws IOException {
        write("format.ts", "export const formatDate = () => '';\n");
        write("other.ts", "export const formatDateTime = () => '';\n"
                + "console.log(formatDateTime);\n");

        final List<DeadExport> dead = detect();

        assertEquals(2, dead.size());
        assertEquals("formatDate", dead.get(0).symbol());
        assertEquals("formatDateTime", dead.get(1).symbol());
    }

    @Test
    void whenDetecting_givenDefaultExport_shouldBeUsedByDefaultImport()
            throws IOException {
        write("widget.tsx", """
                export default function Widget() {}
                export const helper = 1;
                """);
        write("page.tsx", "import W from './widget';\n");

        final List<DeadExport> dead = detect();

        assertEquals(1, dead.size());
        assertEquals("helper", dead.get(0).symbol());
    }

    @Test
    void whenDetecting_givenBarrelReExportingPart_shouldFlagOnlyTheRest()
            throws IOException {
        write("lib/format.ts", """
                export const formatDate = () => '';
                export const formatMoney = () => '';
                """);
        write("lib/barrel.ts", "export { formatDate } from './format';\n");
        write("feature.ts", "import { formatDate } from './lib/barrel';\n");

        final List<DeadExport> dead = detect();

        assertEquals(1, dead.size());
        assertEquals("lib/format.ts", dead.get(0).file());
        assertEquals("formatMoney", dead.get(0).symbol());
    }

    @Test
    void whenDetecting_givenBarrelAliasNeverImported_shouldStayConservative()
            throws IOException {
        write("lib/format.ts", "export const formatMoney = () => '';\n");
        write("lib/barrel.ts",
                "export { formatMoney as money } from './format';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenAliasUsedThroughBarrel_shouldCountAsUsed()
            throws IOException {
        write("lib/format.ts", "export const formatMoney = () => '';\n");
        write("lib/barrel.ts",
                "export { formatMoney as money } from './format';\n");
        write("feature.ts", "import { money } from './lib/barrel';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenEntryPointBarrel_shouldTreatReExportAsUsed()
            throws IOException {
        write("lib/format.ts", "export const formatDate = () => '';\n");
        write("lib/index.ts", "export { formatDate } from './format';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenExportStarBarrel_shouldKeepEverythingAlive()
            throws IOException {
        write("lib/format.ts", "export const formatDate = () => '';\n");
        write("lib/all.ts", "export * from './format';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenEntryPointOrTestFile_shouldUseMediumConfidence()
            throws IOException {
        write("server.ts", "export const port = 3000;\n");
        write("user.spec.ts", "export const fixture = {};\n");
        write("orphan.ts", "export const lonely = 1;\n");

        final List<DeadExport> dead = detect();

        assertEquals(3, dead.size());
        assertEquals(DeadExportConfidence.HIGH, dead.get(0).confidence());
        assertEquals("orphan.ts", dead.get(0).file());
        assertEquals(DeadExportConfidence.MEDIUM, dead.get(1).confidence());
        assertEquals(DeadExportConfidence.MEDIUM, dead.get(2).confidence());
        assertEquals("Entry point export, may be used externally",
                dead.get(1).reason());
        assertEquals("Test file export, may be intentional",
                dead.get(2).reason());
    }

    @Test
    void whenDetecting_givenSelfImportOnly_shouldStillFlag()
            throws IOException {
        write("loop.ts", """
                import { value } from './loop';
                export const value = 1;
                """);

        assertEquals(1, detect().size());
    }

    @Test
    void whenDetecting_givenPackageImportWithSameName_shouldNotFlag()
            throws IOException {
        write("util.ts", "export const debounce = () => {};\n");
        write("app.ts", "import { debounce } from 'lodash';\n");

        assertTrue(detect().isEmpty());
    }

    @Test
    void whenDetecting_givenIgnorePattern_shouldSkipMatchingFiles()
            throws IOException {
        write("types.d.ts", "export interface Shape {}\n");
        write("orphan.ts", "export const lonely = 1;\n");

        final List<DeadExport> dead = detector.detect(parse(), "*.d.ts");

        assertEquals(1, dead.size());
        assertEquals("orphan.ts", dead.get(0).file());
    }

    private List<DeadExport> detect() {
        return detector.detect(parse());
    }

    private DependencyGraph parse() {
        return new ModuleGraphParser(new ModuleDiscovery(),
                new PatternModuleExtractor(), 2).parse(root);
    }

    private void write(final String relative, final String content)
            throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

}
