package co.fanki.importgraph.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DependencyGraphBuilder} and the
 * {@link DependencyGraph} it produces.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyGraphBuilderTest {

    @Test
    void whenBuilding_givenDependencies_shouldKeepReverseAsTranspose() {
        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("a.ts").addNode("b.ts").addNode("c.ts")
                .addNode("d.ts")
                .addDependency("a.ts", "b.ts")
                .addDependency("a.ts", "c.ts")
                .addDependency("b.ts", "c.ts")
                .addDependency("c.ts", "a.ts")
                .build();

        assertTranspose(graph);
        assertEquals(Set.of("b.ts", "c.ts"), graph.dependencies("a.ts"));
        assertEquals(Set.of("a.ts", "b.ts"), graph.dependents("c.ts"));
        assertEquals(4, graph.edgeCount());
        assertTrue(graph.dependents("d.ts").isEmpty());
        assertTrue(graph.dependencies("d.ts").isEmpty());
    }

    @Test
    void whenBuilding_givenDuplicateDependency_shouldCountOnce() {
        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("a.ts").addNode("b.ts")
                .addDependency("a.ts", "b.ts")
                .addDependency("a.ts", "b.ts")
                .build();

        assertEquals(1, graph.edgeCount());
        assertEquals(Set.of("a.ts"), graph.dependents("b.ts"));
    }

    @Test
    void whenBuilding_givenDependencyToUnknownNode_shouldIgnoreIt() {
        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("a.ts")
                .addDependency("a.ts", "ghost.ts")
                .build();

        assertEquals(0, graph.edgeCount());
        assertTrue(graph.forward().isEmpty());
        assertTrue(graph.reverse().isEmpty());
    }

    @Test
    void whenAddingAnalysis_givenMixedEdges_shouldSplitResolvedAndUnresolved() {
        final ModuleResolver resolver = new ModuleResolver(
                Set.of("src/a.ts", "src/b.ts"));
        final FileAnalysis analysis = new FileAnalysis("src/a.ts", List.of(
                ImportEdge.of("src/a.ts", "./b", ImportKind.NAMED,
                        List.of("x")),
                ImportEdge.of("src/a.ts", "react", ImportKind.DEFAULT,
                        List.of("React")),
                ImportEdge.opaque("src/a.ts", "./missing",
                        ImportKind.REQUIRE)),
                List.of(ExportedSymbol.named("src/a.ts", "main")));

        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("src/a.ts").addNode("src/b.ts")
                .addAnalysis(analysis, resolver)
                .build();

        assertEquals(Set.of("src/b.ts"), graph.dependencies("src/a.ts"));
        assertEquals(2, graph.unresolvedEdges().size());
        assertEquals(1, graph.importsOf("src/a.ts").size());
        assertEquals("src/b.ts", graph.importsOf("src/a.ts").get(0).target());
        assertEquals(1, graph.importersOf("src/b.ts").size());
        assertEquals(List.of(ExportedSymbol.named("src/a.ts", "main")),
                graph.exportsOf("src/a.ts"));
        assertTranspose(graph);
    }

    @Test
    void whenCheckingMentions_shouldIgnoreTheOwningModule() {
        final ModuleResolver resolver = new ModuleResolver(
                Set.of("a.ts", "b.ts"));
        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("a.ts").addNode("b.ts")
                .addAnalysis(new FileAnalysis("a.ts", List.of(), List.of(),
                        Set.of("helper", "local")), resolver)
                .addAnalysis(new FileAnalysis("b.ts", List.of(), List.of(),
                        Set.of("helper")), resolver)
                .build();

        assertTrue(graph.isMentionedOutside("helper", "a.ts"));
        assertFalse(graph.isMentionedOutside("local", "a.ts"));
        assertTrue(graph.isMentionedOutside("local", "b.ts"));
    }

    @Test
    void whenMarkingSkipped_shouldKeepFileAsNode() {
        final DependencyGraph graph = new DependencyGraphBuilder()
                .markSkipped("broken.ts")
                .build();

        assertTrue(graph.contains("broken.ts"));
        assertEquals(List.of("broken.ts"), graph.skippedFiles());
    }

    @Test
    void whenBuilding_shouldReturnSortedUnmodifiableFiles() {
        final DependencyGraph graph = new DependencyGraphBuilder()
                .addNode("z.ts").addNode("a.ts").addNode("m/b.ts")
                .build();

        assertEquals(List.of("a.ts", "m/b.ts", "z.ts"),
                List.copyOf(graph.files()));
        assertThrows(UnsupportedOperationException.class,
                () -> graph.files().add("x.ts"));
        assertThrows(UnsupportedOperationException.class,
                () -> graph.forward().clear());
    }

    @Test
    void whenAddingNode_givenBlankName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyGraphBuilder().addNode(" "));
    }

    private static void assertTranspose(final DependencyGraph graph) {
        for (final Map.Entry<String, Set<String>> entry
                : graph.forward().entrySet()) {
            for (final String to : entry.getValue()) {
                assertTrue(graph.dependents(to).contains(entry.getKey()),
                        entry.getKey() + " -> " + to + " missing in reverse");
            }
        }
        for (final Map.Entry<String, Set<String>> entry
                : graph.reverse().entrySet()) {
            for (final String from : entry.getValue()) {
                assertTrue(graph.dependencies(from).contains(entry.getKey()),
                        from + " -> " + entry.getKey()
                                + " missing in forward");
            }
        }
    }

}
