package co.fanki.importgraph.analysis.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PatternModuleExtractor}.
 *
 * <p>Covers each import form, the export forms and the comment handling,
 * using in-memory module content.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PatternModuleExtractorTest {

    private final PatternModuleExtractor extractor =
            new PatternModuleExtractor();

    // -- imports --

    @Test
    void whenExtracting_givenNamedImport_shouldKeepOriginalAndLocalNames() {
        final FileAnalysis analysis = extract("src/a.ts",
                "import { foo, bar as baz } from './b';");

        assertEquals(1, analysis.imports().size());
        final ImportEdge edge = analysis.imports().get(0);
        assertEquals(ImportKind.NAMED, edge.kind());
        assertEquals("./b", edge.specifier());
        assertEquals(List.of("foo", "baz"), edge.symbols());
        assertEquals(List.of("foo", "bar"), edge.importedNames());
        assertNull(edge.target());
    }

    @Test
    void whenExtracting_givenDefaultImport_shouldBindLocalName() {
        final FileAnalysis analysis = extract("a.ts",
                "import Widget from './widget';");

        final ImportEdge edge = analysis.imports().get(0);
        assertEquals(ImportKind.DEFAULT, edge.kind());
        assertEquals(List.of("Widget"), edge.symbols());
    }

    @Test
    void whenExtracting_givenDefaultAndNamedImport_shouldEmitBothEdges() {
        final FileAnalysis analysis = extract("a.ts",
                "import React, { useState } from 'react';");

        assertEquals(2, analysis.imports().size());
        assertEquals(ImportKind.DEFAULT, analysis.imports().get(0).kind());
        assertEquals(List.of("React"), analysis.imports().get(0).symbols());
        assertEquals(ImportKind.NAMED, analysis.imports().get(1).kind());
        assertEquals(List.of("useState"),
                analysis.imports().get(1).symbols());
    }

    @Test
    void whenExtracting_givenNamespaceImport_shouldUsePlaceholder() {
        final FileAnalysis analysis = extract("a.ts",
                "import * as utils from './utils';");

        final ImportEdge edge = analysis.imports().get(0);
        assertEquals(ImportKind.NAMESPACE, edge.kind());
        assertTrue(edge.symbols().isEmpty());
        assertEquals(List.of("*"), edge.displaySymbols());
        assertTrue(edge.isOpaque());
    }

    @Test
    void whenExtracting_givenSideEffectImport_shouldTreatAsNamespace() {
        final FileAnalysis analysis = extract("a.ts",
                "import './polyfills';");

        assertEquals(1, analysis.imports().size());
        assertEquals(ImportKind.NAMESPACE, analysis.imports().get(0).kind());
        assertEquals("./polyfills", analysis.imports().get(0).specifier());
    }

    @Test
    void whenExtracting_givenDynamicImportAndRequire_shouldBeOpaque() {
        final FileAnalysis analysis = extract("a.js", """
                const lazy = await import('./lazy');
                const fs = require("fs");
                const cfg = require('./config');
                """);

        assertEquals(3, analysis.imports().size());
        assertEquals(ImportKind.DYNAMIC, analysis.imports().get(0).kind());
        assertEquals(List.of("(dynamic)"),
                analysis.imports().get(0).displaySymbols());
        assertEquals(ImportKind.REQUIRE, analysis.imports().get(1).kind());
        assertEquals("fs", analysis.imports().get(1).specifier());
        assertEquals("./config", analysis.imports().get(2).specifier());
    }

    @Test
    void whenExtracting_givenTypeOnlyImport_shouldStillRecordEdge() {
        final FileAnalysis analysis = extract("a.ts", """
                import type { User } from './model';
                import { type Order, Item } from './order';
                """);

        assertEquals(List.of("User"), analysis.imports().get(0).symbols());
        assertEquals(List.of("Order", "Item"),
                analysis.imports().get(1).symbols());
    }

    @Test
    void whenExtracting_givenMultilineImport_shouldParseAllBindings() {
        final FileAnalysis analysis = extract("a.ts", """
                import {
                  alpha,
                  beta,
                } from './greek';
                """);

        assertEquals(List.of("alpha", "beta"),
                analysis.imports().get(0).symbols());
    }

    @Test
    void whenExtracting_givenCommentedOutImports_shouldIgnoreThem() {
        final FileAnalysis analysis = extract("a.ts", """
                // import { gone } from './gone';
                /* import { alsoGone } from './also-gone'; */
                /**
                 * require('./doc')
                 */
                import { kept } from './kept';
                """);

        assertEquals(1, analysis.imports().size());
        assertEquals("./kept", analysis.imports().get(0).specifier());
    }

    @Test
    void whenExtracting_givenUrlInsideString_shouldNotBlankCode() {
        final FileAnalysis analysis = extract("a.ts", """
                const url = "http://example.com";
                import { kept } from './kept';
                """);

        assertEquals(1, analysis.imports().size());
    }

    @Test
    void whenExtracting_givenSeveralForms_shouldKeepSourceOrder() {
        final FileAnalysis analysis = extract("a.ts", """
                const x = require('./first');
                import { second } from './second';
                export * from './third';
                """);

        assertEquals(List.of("./first", "./second", "./third"),
                analysis.imports().stream().map(ImportEdge::specifier)
                        .toList());
    }

    // -- re-exports --

    @Test
    void whenExtracting_givenReExportList_shouldRecordEdgeAndExports() {
        final FileAnalysis analysis = extract("lib/index.ts",
                "export { parse, format as fmt } from './text';");

        final ImportEdge edge = analysis.imports().get(0);
        assertEquals(ImportKind.RE_EXPORT, edge.kind());
        assertEquals(List.of("parse", "fmt"), edge.symbols());
        assertEquals(List.of("parse", "format"), edge.importedNames());
        assertFalse(edge.isOpaque());

        assertEquals(2, analysis.exports().size());
        assertTrue(analysis.exports().get(0).reExport());
        assertEquals("fmt", analysis.exports().get(1).name());
    }

    @Test
    void whenExtracting_givenExportStar_shouldBeOpaqueReExport() {
        final FileAnalysis analysis = extract("lib/index.ts", """
                export * from './a';
                export * as b from './b';
                """);

        assertEquals(2, analysis.imports().size());
        assertTrue(analysis.imports().get(0).isOpaque());
        assertEquals(ImportKind.RE_EXPORT, analysis.imports().get(1).kind());
        assertEquals(1, analysis.exports().size());
        assertEquals("b", analysis.exports().get(0).name());
        assertTrue(analysis.exports().get(0).reExport());
    }

    // -- exports --

    @Test
    void whenExtracting_givenDeclarations_shouldRecordNamedExports() {
        final FileAnalysis analysis = extract("a.ts", """
                export const A = 1;
                export let b = 2;
                export function fn() {}
                export async function load() {}
                export class Service {}
                export abstract class Base {}
                export interface Shape {}
                export type Id = string;
                export enum Color { RED }
                export const enum Flag { ON }
                """);

        assertEquals(List.of("A", "b", "fn", "load", "Service", "Base",
                "Shape", "Id", "Color", "Flag"),
                names(analysis));
        assertTrue(analysis.exports().stream()
                .allMatch(e -> e.kind() == ExportKind.NAMED));
    }

    @Test
    void whenExtracting_givenExportList_shouldUseExportedNames() {
        final FileAnalysis analysis = extract("a.ts", """
                const one = 1;
                const two = 2;
                export { one, two as second };
                """);

        assertEquals(List.of("one", "second"), names(analysis));
        assertFalse(analysis.exports().get(0).reExport());
    }

    @Test
    void whenExtracting_givenDefaultExports_shouldRecordDefaultKind() {
        final FileAnalysis named = extract("a.ts",
                "export default function handler() {}");
        final FileAnalysis identifier = extract("b.ts", """
                const app = {};
                export default app;
                """);
        final FileAnalysis anonymous = extract("c.ts",
                "export default () => 42;");
        final FileAnalysis aliased = extract("d.ts", """
                const main = 1;
                export { main as default };
                """);

        assertEquals(ExportKind.DEFAULT, named.exports().get(0).kind());
        assertEquals("handler", named.exports().get(0).name());
        assertEquals("app", identifier.exports().get(0).name());
        assertEquals(1, anonymous.exports().size());
        assertEquals("default", anonymous.exports().get(0).name());
        assertEquals(ExportKind.DEFAULT, aliased.exports().get(0).kind());
        assertEquals("main", aliased.exports().get(0).name());
    }

    @Test
    void whenExtracting_givenDefaultClass_shouldNotDuplicateExport() {
        final FileAnalysis analysis = extract("a.ts",
                "export default class Store {}");

        assertEquals(1, analysis.exports().size());
        assertEquals("Store", analysis.exports().get(0).name());
    }

    @Test
    void whenExtracting_givenGeneratorExports_shouldAcceptAnyStarSpacing() {
        final FileAnalysis analysis = extract("a.ts", """
                export function *ids() {}
                export function* keys() {}
                export async function * pages() {}
                """);
        final FileAnalysis defaults = extract("b.ts",
                "export default function *main() {}");

        assertEquals(List.of("ids", "keys", "pages"), names(analysis));
        assertEquals(1, defaults.exports().size());
        assertEquals("main", defaults.exports().get(0).name());
        assertEquals(ExportKind.DEFAULT, defaults.exports().get(0).kind());
    }

    @Test
    void whenExtracting_shouldCollectWholeWordsIncludingComments() {
        final FileAnalysis analysis = extract("a.ts", """
                const total = price * qty; // see formatDate
                const size = '3px';
                """);

        assertTrue(analysis.identifiers().containsAll(
                List.of("total", "price", "qty", "formatDate", "size")));
        assertFalse(analysis.identifiers().contains("px"));
    }

    @Test
    void whenExtracting_givenNoModuleSyntax_shouldReturnEmptyAnalysis() {
        final FileAnalysis analysis = extract("plain.js",
                "console.log('hello');");

        assertTrue(analysis.imports().isEmpty());
        assertTrue(analysis.exports().isEmpty());
        assertEquals("plain.js", analysis.file());
    }

    // -- comment blanking --

    @Test
    void whenBlankingComments_shouldPreserveLengthAndNewlines() {
        final String source = "a /* x\ny */ b // z\nc";

        final String blanked = PatternModuleExtractor.blankComments(source);

        assertEquals(source.length(), blanked.length());
        assertEquals("a     \n     b     \nc", blanked);
    }

    @Test
    void whenBlankingComments_givenSlashesInTemplate_shouldKeepThem() {
        final String source = "const t = `//not a comment`;";

        assertEquals(source, PatternModuleExtractor.blankComments(source));
    }

    private FileAnalysis extract(final String relative, final String code) {
        return extractor.extract(new ModuleFile(
                Path.of("/project").resolve(relative), relative, code));
    }

    private static List<String> names(final FileAnalysis analysis) {
        return analysis.exports().stream().map(ExportedSymbol::name).toList();
    }

}
