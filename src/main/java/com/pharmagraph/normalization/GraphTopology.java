package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Edge;
import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.graph.GraphModels.NodeType;

import java.util.*;

final class GraphTopology {
    private GraphTopology() {}

    static boolean isDirectClaim(Edge edge, Map<String, Node> nodesById) {
        Node source = nodesById.get(edge.source());
        Node target = nodesById.get(edge.target());
        return source != null && target != null
                && source.hasType(NodeType.DRUG)
                && target.hasType(NodeType.DISEASE);
    }

    static Map<String, Integer> degrees(Collection<Edge> edges) {
        Map<String, Integer> degree = new HashMap<>();
        for (Edge e : edges) {
            degree.merge(e.source(), 1, Integer::sum);
            degree.merge(e.target(), 1, Integer::sum);
        }
        return degree;
    }

    static Map<String, Integer> inDegrees(Collection<Edge> edges) {
        Map<String, Integer> degree = new HashMap<>();
        edges.forEach(e -> degree.merge(e.target(), 1, Integer::sum));
        return degree;
    }

    static Map<String, List<Edge>> forwardAdjacency(Collection<Edge> edges) {
        Map<String, List<Edge>> adj = new LinkedHashMap<>();
        edges.forEach(e -> adj.computeIfAbsent(e.source(), k -> new ArrayList<>()).add(e));
        return adj;
    }

    static Map<String, Node> indexById(Collection<Node> nodes) {
        Map<String, Node> index = new LinkedHashMap<>();
        nodes.forEach(n -> index.putIfAbsent(n.id(), n));
        return index;
    }
}
