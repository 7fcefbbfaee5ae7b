package com.vidnyan.attackgraph.domain.pattern;

import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.graph.AttackStepNode;
import com.vidnyan.attackgraph.domain.language.AttackStepType;
import com.vidnyan.attackgraph.domain.model.Asset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SearchPatternTest {

    private final SearchPattern modifyThenRead = SearchPattern.of(
            SearchCondition.nameIs("attemptModify"),
            SearchCondition.anyOneOrMore(),
            SearchCondition.nameIs("attemptRead"));

    private AttackGraph graph;

    @BeforeEach
    void setUp() {
        graph = new AttackGraph();
    }

    private AttackStepNode node(String assetName, String stepName) {
        return graph.addNode(new AttackStepNode(
                AttackStepType.OR, stepName, new Asset(graph.getNodes().size(), assetName, "Application")));
    }

    @Test
    void findMatches_ShouldReturnWholeChain() {
        AttackStepNode modify = node("app", "attemptModify");
        AttackStepNode x1 = node("x1", "fullAccess");
        AttackStepNode x2 = node("x2", "fullAccess");
        AttackStepNode read = node("data", "attemptRead");
        graph.addEdge(modify, x1);
        graph.addEdge(x1, x2);
        graph.addEdge(x2, read);

        List<List<AttackStepNode>> matches = modifyThenRead.findMatches(graph);

        assertEquals(List.of(List.of(modify, x1, x2, read)), matches);
    }

    @Test
    void findMatches_ShouldReturnEveryReachableEnd() {
        AttackStepNode modify = node("app", "attemptModify");
        AttackStepNode x1 = node("x1", "fullAccess");
        AttackStepNode x2 = node("x2", "fullAccess");
        AttackStepNode read1 = node("data1", "attemptRead");
        AttackStepNode read2 = node("data2", "attemptRead");
        graph.addEdge(modify, x1);
        graph.addEdge(x1, read1);
        graph.addEdge(x1, x2);
        graph.addEdge(x2, read2);

        List<List<AttackStepNode>> matches = modifyThenRead.findMatches(graph);

        assertEquals(Set.of(List.of(modify, x1, read1), List.of(modify, x1, x2, read2)), Set.copyOf(matches));
        assertEquals(2, matches.size());
    }

    @Test
    void findMatches_ShouldRequireMinimumRepetitions() {
        AttackStepNode modify = node("app", "attemptModify");
        AttackStepNode read = node("data", "attemptRead");
        graph.addEdge(modify, read);

        assertTrue(modifyThenRead.findMatches(graph).isEmpty());

        SearchPattern optionalMiddle = SearchPattern.of(
                SearchCondition.nameIs("attemptModify"),
                SearchCondition.repeated(n -> true, 0, 1),
                SearchCondition.nameIs("attemptRead"));
        assertEquals(List.of(List.of(modify, read)), optionalMiddle.findMatches(graph));
    }

    @Test
    void findMatches_ShouldRespectMaximumRepetitions() {
        AttackStepNode longModify = node("long", "attemptModify");
        AttackStepNode x1 = node("x1", "fullAccess");
        AttackStepNode x2 = node("x2", "fullAccess");
        AttackStepNode x3 = node("x3", "fullAccess");
        AttackStepNode longRead = node("longData", "attemptRead");
        graph.addEdge(longModify, x1);
        graph.addEdge(x1, x2);
        graph.addEdge(x2, x3);
        graph.addEdge(x3, longRead);

        AttackStepNode shortModify = node("short", "attemptModify");
        AttackStepNode y1 = node("y1", "fullAccess");
        AttackStepNode y2 = node("y2", "fullAccess");
        AttackStepNode shortRead = node("shortData", "attemptRead");
        graph.addEdge(shortModify, y1);
        graph.addEdge(y1, y2);
        graph.addEdge(y2, shortRead);

        SearchPattern atMostTwoHops = SearchPattern.of(
                SearchCondition.nameIs("attemptModify"),
                SearchCondition.repeated(n -> n.getName().equals("fullAccess"), 1, 2),
                SearchCondition.nameIs("attemptRead"));

        assertEquals(List.of(List.of(shortModify, y1, y2, shortRead)), atMostTwoHops.findMatches(graph));
    }

    @Test
    void findMatches_ShouldStopOnCycles() {
        AttackStepNode modify = node("app", "attemptModify");
        AttackStepNode x1 = node("x1", "fullAccess");
        AttackStepNode x2 = node("x2", "fullAccess");
        AttackStepNode read = node("data", "attemptRead");
        graph.addEdge(modify, x1);
        graph.addEdge(x1, x2);
        graph.addEdge(x2, x1);
        graph.addEdge(x2, read);

        List<List<AttackStepNode>> matches = modifyThenRead.findMatches(graph);

        assertEquals(List.of(List.of(modify, x1, x2, read)), matches);
    }

    @Test
    void searchCondition_ShouldRejectInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> SearchCondition.repeated(n -> true, 2, 1));
        assertThrows(IllegalArgumentException.class, () -> new SearchPattern(List.of()));
    }
}
