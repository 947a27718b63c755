package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels;
import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.NormalizationConfig.PathScoring;

import java.util.*;

class PathRanker {

    List<ReasoningPath> rank(List<Node> nodes, List<Edge> edges, PathScoring scoring) {
        Map<String, Node> eligible = GraphTopology.indexById(nodes.stream().filter(n -> !n.flaggedComparator()).toList());
        Map<String, List<Edge>> adjacency = GraphTopology.forwardAdjacency(edges);

        Set<String> visited = new HashSet<>();
        List<ReasoningPath> paths = new ArrayList<>();

        for (Node drug : eligible.values()) {
            if (!drug.hasType(NodeType.DRUG)) continue;

            for (Edge first : adjacency.getOrDefault(drug.id(), List.of())) {
                Node intermediate = eligible.get(first.target());
                if (intermediate == null || intermediate.hasType(NodeType.DISEASE)) continue;

                for (Edge second : adjacency.getOrDefault(intermediate.id(), List.of())) {
                    Node disease = eligible.get(second.target());
                    if (disease == null || !disease.hasType(NodeType.DISEASE)) continue;

                    String key = ReasoningPath.keyOf(drug.id(), intermediate.id(), disease.id());
                    if (!visited.add(key)) continue;

                    paths.add(new ReasoningPath(
                            key,
                            drug.label() + " → " + disease.label(),
                            List.of(drug.id(), intermediate.id(), disease.id()),
                            score(first, second, scoring),
                            sourceCount(first, second)));
                }
            }
        }

        // List.sort is stable, ties keep discovery order
        paths.sort(Comparator.comparingDouble(ReasoningPath::confidenceScore).reversed());
        return paths.stream().limit(scoring.maxPaths()).toList();
    }

    static double score(Edge first, Edge second, PathScoring scoring) {
        Polarity a = first.polarity();
        Polarity b = second.polarity();
        if (a == Polarity.SUPPORTS || b == Polarity.SUPPORTS) return scoring.supports();
        if (a == Polarity.CONTRADICTS || b == Polarity.CONTRADICTS) return scoring.contradicts();
        if (a == Polarity.SUGGESTS || b == Polarity.SUGGESTS) return scoring.suggests();
        return scoring.base();
    }

    static int sourceCount(Edge... hops) {
        Set<String> references = new HashSet<>();
        for (Edge hop : hops) {
            hop.evidenceId().ifPresent(references::add);
            if (hop.metadata().get(GraphModels.SOURCES) instanceof Collection<?> sources) {
                sources.stream().filter(Objects::nonNull).map(String::valueOf).forEach(references::add);
            }
        }
        return references.size();
    }
}
