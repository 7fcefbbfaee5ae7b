package com.vidnyan.attackgraph.domain.pattern;

import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.graph.AttackStepNode;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * An ordered list of conditions matched against chains of nodes that follow
 * child edges.
 *
 * The search keeps an explicit stack of partial matches. A node that is
 * already on the partial path ends that branch, so cyclic graphs terminate.
 */
@Slf4j
public class SearchPattern {

    private final List<SearchCondition> conditions;

    public SearchPattern(List<SearchCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("A search pattern needs at least one condition");
        }
        this.conditions = List.copyOf(conditions);
    }

    public static SearchPattern of(SearchCondition... conditions) {
        return new SearchPattern(Arrays.asList(conditions));
    }

    /**
     * All distinct node paths matching every condition in order, in discovery order.
     */
    public List<List<AttackStepNode>> findMatches(AttackGraph graph) {
        SearchCondition first = conditions.get(0);
        Set<List<AttackStepNode>> matches = new LinkedHashSet<>();

        for (AttackStepNode start : graph.getNodes()) {
            if (first.matches(start)) {
                search(start, matches);
            }
        }

        log.debug("Pattern with {} conditions matched {} paths", conditions.size(), matches.size());
        return new ArrayList<>(matches);
    }

    private void search(AttackStepNode start, Set<List<AttackStepNode>> matches) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, 0, 0, List.of()));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            AttackStepNode node = frame.node();
            if (frame.path().contains(node)) {
                continue;
            }

            SearchCondition condition = conditions.get(frame.conditionIndex());
            boolean hasNext = frame.conditionIndex() + 1 < conditions.size();

            // Leave the current condition behind and try the next one on this node
            if (hasNext && !condition.mustMatchAgain(frame.matchCount())) {
                stack.push(new Frame(node, frame.conditionIndex() + 1, 0, frame.path()));
            }

            if (!condition.matches(node)) {
                continue;
            }

            List<AttackStepNode> path = new ArrayList<>(frame.path());
            path.add(node);
            List<AttackStepNode> matchedPath = Collections.unmodifiableList(path);
            int matchCount = frame.matchCount() + 1;
            boolean satisfied = !condition.mustMatchAgain(matchCount);

            for (AttackStepNode child : node.getChildren()) {
                if (hasNext && satisfied) {
                    stack.push(new Frame(child, frame.conditionIndex() + 1, 0, matchedPath));
                }
                if (condition.canMatchAgain(matchCount)) {
                    stack.push(new Frame(child, frame.conditionIndex(), matchCount, matchedPath));
                }
            }

            if (!hasNext && satisfied) {
                matches.add(matchedPath);
            }
        }
    }

    private record Frame(AttackStepNode node, int conditionIndex, int matchCount, List<AttackStepNode> path) {}
}
