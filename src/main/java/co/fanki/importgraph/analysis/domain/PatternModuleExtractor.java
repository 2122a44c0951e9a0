package co.fanki.importgraph.analysis.domain;

import co.fanki.importgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex based {@link ModuleExtractor} for ES modules and CommonJS.
 *
 * <p>Comments are blanked out before matching, keeping offsets, so that
 * commented-out imports are ignored. String and template literals are
 * left intact, which means an import statement written inside a string
 * is still picked up; this is a known limitation of the pattern
 * approach, as are re-exports nested in conditional code.</p>
 *
 * <p>Recognized forms:</p>
 * <ul>
 *   <li>{@code import { a, b as c } from './x'} - named</li>
 *   <li>{@code import x from './x'} - default</li>
 *   <li>{@code import * as ns from './x'}, {@code import './x'} -
 *       namespace</li>
 *   <li>{@code export { a } from './x'}, {@code export * from './x'} -
 *       re-export</li>
 *   <li>{@code import('./x')} - dynamic</li>
 *   <li>{@code require('./x')} - require</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PatternModuleExtractor implements ModuleExtractor {

    private static final String IDENTIFIER = "[A-Za-z_$][\\w$]*";

    /** {@code import [type] <clause> from '<specifier>'}. */
    private static final Pattern IMPORT_FROM_PATTERN = Pattern.compile(
            "\\bimport\\s+(?:type\\s+)?([^'\";]*?)\\s*\\bfrom\\s*"
                    + "['\"]([^'\"]+)['\"]");

    /** {@code import '<specifier>'}, evaluated for side effects only. */
    private static final Pattern SIDE_EFFECT_IMPORT_PATTERN = Pattern.compile(
            "\\bimport\\s*['\"]([^'\"]+)['\"]");

    /** {@code import('<specifier>')}. */
    private static final Pattern DYNAMIC_IMPORT_PATTERN = Pattern.compile(
            "\\bimport\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** {@code require('<specifier>')}. */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "\\brequire\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** {@code export [type] { a, b as c } from '<specifier>'}. */
    private static final Pattern RE_EXPORT_LIST_PATTERN = Pattern.compile(
            "\\bexport\\s+(?:type\\s+)?\\{([^}]*)}\\s*from\\s*"
                    + "['\"]([^'\"]+)['\"]");

    /** {@code export * [as ns] from '<specifier>'}. */
    private static final Pattern RE_EXPORT_ALL_PATTERN = Pattern.compile(
            "\\bexport\\s*\\*\\s*(?:as\\s+(" + IDENTIFIER + ")\\s*)?"
                    + "from\\s*['\"]([^'\"]+)['\"]");

    /** {@code export { a, b as c }}, optionally followed by from. */
    private static final Pattern EXPORT_LIST_PATTERN = Pattern.compile(
            "\\bexport\\s+(?:type\\s+)?\\{([^}]*)}(\\s*from\\b)?");

    /** {@code export [declare] [async] [abstract] <keyword> Name}. */
    private static final Pattern EXPORT_DECLARATION_PATTERN = Pattern.compile(
            "\\bexport\\s+(?:declare\\s+)?(?:async\\s+)?(?:abstract\\s+)?"
                    + "(?:function(?:\\s*\\*\\s*|\\s+)|(?:class|const\\s+enum"
                    + "|const|let|var|type|interface|enum|namespace)\\s+)("
                    + IDENTIFIER + ")");

    /** {@code export default [async] function|class Name}. */
    private static final Pattern EXPORT_DEFAULT_DECLARATION_PATTERN =
            Pattern.compile("\\bexport\\s+default\\s+(?:async\\s+)?"
                    + "(?:abstract\\s+)?(?:function(?:\\s*\\*\\s*|\\s+)"
                    + "|class\\s+)(" + IDENTIFIER + ")");

    /** {@code export default Name;}. */
    private static final Pattern EXPORT_DEFAULT_IDENTIFIER_PATTERN =
            Pattern.compile("\\bexport\\s+default\\s+(" + IDENTIFIER
                    + ")\\s*(?:;|$)", Pattern.MULTILINE);

    private static final Pattern EXPORT_DEFAULT_PATTERN = Pattern.compile(
            "\\bexport\\s+default\\b");

    /** Words that can follow {@code export default} without naming it. */
    private static final Set<String> DEFAULT_KEYWORDS = Set.of(
            "function", "class", "async", "abstract", "new", "await",
            "typeof", "void", "null", "undefined", "true", "false", "this");

    private static final Pattern AS_SEPARATOR = Pattern.compile("\\s+as\\s+");

    private static final Pattern NAMESPACE_CLAUSE = Pattern.compile(
            "\\*\\s*as\\s+(" + IDENTIFIER + ")");

    /** An identifier not glued to a preceding word character. */
    private static final Pattern WORD_PATTERN = Pattern.compile(
            "(?<![\\w$])" + IDENTIFIER);

    /** {@inheritDoc} */
    @Override
    public FileAnalysis extract(final ModuleFile file) {
        Preconditions.requireNonNull(file, "Module file is required");

        final String path = file.relativePath();
        final String code = blankComments(file.content());

        final List<Located<ImportEdge>> imports = new ArrayList<>();
        final List<Located<ExportedSymbol>> exports = new ArrayList<>();

        extractStaticImports(path, code, imports);
        extractOpaqueImports(path, code, SIDE_EFFECT_IMPORT_PATTERN,
                ImportKind.NAMESPACE, imports);
        extractOpaqueImports(path, code, DYNAMIC_IMPORT_PATTERN,
                ImportKind.DYNAMIC, imports);
        extractOpaqueImports(path, code, REQUIRE_PATTERN,
                ImportKind.REQUIRE, imports);
        extractReExports(path, code, imports, exports);
        extractExports(path, code, exports);

        return new FileAnalysis(path, inSourceOrder(imports),
                inSourceOrder(exports), words(file.content()));
    }

    /**
     * Collects the identifier-like words of the raw content, comments and
     * strings included, so that a name referenced in any form is seen.
     */
    private static Set<String> words(final String content) {
        final Set<String> words = new HashSet<>();
        final Matcher matcher = WORD_PATTERN.matcher(content);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    private void extractStaticImports(final String path, final String code,
            final List<Located<ImportEdge>> imports) {

        final Matcher matcher = IMPORT_FROM_PATTERN.matcher(code);
        while (matcher.find()) {
            final String clause = matcher.group(1).trim();
            final String specifier = matcher.group(2);
            final int offset = matcher.start();

            if (clause.isEmpty()) {
                continue;
            }

            final int braceStart = clause.indexOf('{');
            final String head = braceStart >= 0
                    ? clause.substring(0, braceStart) : clause;

            // default binding: "x" in "x", "x, { a }" or "x, * as ns"
            final String defaultName = head.split(",")[0].trim();
            if (!defaultName.isEmpty() && !defaultName.startsWith("*")) {
                imports.add(new Located<>(offset, ImportEdge.of(path,
                        specifier, ImportKind.DEFAULT,
                        List.of(defaultName))));
            }

            if (NAMESPACE_CLAUSE.matcher(head).find()) {
                imports.add(new Located<>(offset, ImportEdge.opaque(path,
                        specifier, ImportKind.NAMESPACE)));
            }

            if (braceStart >= 0) {
                final int braceEnd = clause.indexOf('}', braceStart);
                final String list = braceEnd > braceStart
                        ? clause.substring(braceStart + 1, braceEnd)
                        : clause.substring(braceStart + 1);
                final List<String> locals = new ArrayList<>();
                final List<String> originals = new ArrayList<>();
                parseBindingList(list, originals, locals);
                imports.add(new Located<>(offset, new ImportEdge(path,
                        specifier, ImportKind.NAMED, locals, originals,
                        null)));
            }
        }
    }

    private void extractOpaqueImports(final String path, final String code,
            final Pattern pattern, final ImportKind kind,
            final List<Located<ImportEdge>> imports) {

        final Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            imports.add(new Located<>(matcher.start(),
                    ImportEdge.opaque(path, matcher.group(1), kind)));
        }
    }

    private void extractReExports(final String path, final String code,
            final List<Located<ImportEdge>> imports,
            final List<Located<ExportedSymbol>> exports) {

        final Matcher list = RE_EXPORT_LIST_PATTERN.matcher(code);
        while (list.find()) {
            final List<String> exported = new ArrayList<>();
            final List<String> originals = new ArrayList<>();
            parseBindingList(list.group(1), originals, exported);

            final int offset = list.start();
            imports.add(new Located<>(offset, new ImportEdge(path,
                    list.group(2), ImportKind.RE_EXPORT, exported,
                    originals, null)));
            for (final String name : exported) {
                exports.add(new Located<>(offset,
                        ExportedSymbol.reExported(path, name)));
            }
        }

        final Matcher all = RE_EXPORT_ALL_PATTERN.matcher(code);
        while (all.find()) {
            final int offset = all.start();
            imports.add(new Located<>(offset, ImportEdge.opaque(path,
                    all.group(2), ImportKind.RE_EXPORT)));
            if (all.group(1) != null) {
                exports.add(new Located<>(offset,
                        ExportedSymbol.reExported(path, all.group(1))));
            }
        }
    }

    private void extractExports(final String path, final String code,
            final List<Located<ExportedSymbol>> exports) {

        final Matcher declaration = EXPORT_DECLARATION_PATTERN.matcher(code);
        while (declaration.find()) {
            exports.add(new Located<>(declaration.start(),
                    ExportedSymbol.named(path, declaration.group(1))));
        }

        final Matcher list = EXPORT_LIST_PATTERN.matcher(code);
        while (list.find()) {
            if (list.group(2) != null) {
                continue; // re-export, handled separately
            }
            final List<String> locals = new ArrayList<>();
            final List<String> exported = new ArrayList<>();
            parseBindingList(list.group(1), locals, exported);
            for (int i = 0; i < exported.size(); i++) {
                final ExportedSymbol symbol = "default".equals(exported.get(i))
                        ? ExportedSymbol.defaultExport(path, locals.get(i))
                        : ExportedSymbol.named(path, exported.get(i));
                exports.add(new Located<>(list.start(), symbol));
            }
        }

        final Matcher namedDefault =
                EXPORT_DEFAULT_DECLARATION_PATTERN.matcher(code);
        while (namedDefault.find()) {
            exports.add(new Located<>(namedDefault.start(),
                    ExportedSymbol.defaultExport(path,
                            namedDefault.group(1))));
        }

        final Matcher identifierDefault =
                EXPORT_DEFAULT_IDENTIFIER_PATTERN.matcher(code);
        while (identifierDefault.find()) {
            final String name = identifierDefault.group(1);
            if (!DEFAULT_KEYWORDS.contains(name)) {
                exports.add(new Located<>(identifierDefault.start(),
                        ExportedSymbol.defaultExport(path, name)));
            }
        }

        // anonymous: export default function () {}, export default { ... }
        final Set<Integer> named = new HashSet<>();
        for (final Located<ExportedSymbol> export : exports) {
            named.add(export.offset());
        }
        final Matcher anyDefault = EXPORT_DEFAULT_PATTERN.matcher(code);
        while (anyDefault.find()) {
            if (!named.contains(anyDefault.start())) {
                exports.add(new Located<>(anyDefault.start(),
                        ExportedSymbol.defaultExport(path, "default")));
            }
        }
    }

    /**
     * Splits {@code a, b as c, type d} into the names on the left of
     * {@code as} and the names on the right (equal when there is no alias).
     */
    private void parseBindingList(final String list,
            final List<String> left, final List<String> right) {

        for (final String raw : list.split(",")) {
            String binding = raw.trim();
            if (binding.startsWith("type ")) {
                binding = binding.substring(5).trim();
            }
            if (binding.isEmpty()) {
                continue;
            }
            final String[] parts = AS_SEPARATOR.split(binding);
            final String original = parts[0].trim();
            final String alias = parts[parts.length - 1].trim();
            if (original.isEmpty() || alias.isEmpty()
                    || original.contains("'") || original.contains("\"")) {
                continue;
            }
            left.add(original);
            right.add(alias);
        }
    }

    private static <T> List<T> inSourceOrder(final List<Located<T>> found) {
        found.sort(Comparator.<Located<T>>comparingInt(Located::offset));
        final List<T> result = new ArrayList<>(found.size());
        for (final Located<T> located : found) {
            result.add(located.value());
        }
        return result;
    }

    /**
     * Replaces line and block comments with spaces, keeping line breaks
     * and string literals so offsets and line numbers stay stable.
     *
     * @param source the raw file content
     * @return the content with comments blanked
     */
    static String blankComments(final String source) {
        final StringBuilder out = new StringBuilder(source);
        final int length = source.length();
        char quote = 0;
        int i = 0;

        while (i < length) {
            final char c = source.charAt(i);
            final char next = i + 1 < length ? source.charAt(i + 1) : 0;

            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote || (c == '\n' && quote != '`')) {
                    quote = 0;
                }
                i++;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                i++;
            } else if (c == '/' && next == '/') {
                while (i < length && source.charAt(i) != '\n') {
                    out.setCharAt(i, ' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                final int end = source.indexOf("*/", i + 2);
                final int stop = end < 0 ? length : end + 2;
                for (; i < stop; i++) {
                    if (source.charAt(i) != '\n') {
                        out.setCharAt(i, ' ');
                    }
                }
            } else {
                i++;
            }
        }
        return out.toString();
    }

    /** A match kept with its offset so results can be merged in order. */
    private record Located<T>(int offset, T value) {}

}
