package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.NormalizationModels.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

class InvariantValidator {
    private static final Logger logger = LoggerFactory.getLogger(InvariantValidator.class);
    static final int MIN_EVIDENCE_EDGES = 2;

    ValidationResult validate(List<Edge> edges, Map<String, Node> nodesById) {
        List<Warning> warnings = new ArrayList<>();
        int directRemoved = 0;
        Map<EdgeKey, Edge> unique = new LinkedHashMap<>();

        for (Edge edge : edges) {
            if (GraphTopology.isDirectClaim(edge, nodesById)) {
                logger.error("Direct drug -> disease edge survived mediation: {} -> {}", edge.source(), edge.target());
                warnings.add(new Warning(WarningCode.DIRECT_DRUG_DISEASE_EDGE,
                        "Direct drug -> disease edge removed: " + label(nodesById, edge.source()) + " -> " + label(nodesById, edge.target()),
                        edgeContext(edge)));
                directRemoved++;
                continue;
            }
            unique.putIfAbsent(edge.key(), edge);
        }
        List<Edge> validated = List.copyOf(unique.values());
        int duplicates = edges.size() - directRemoved - validated.size();

        Map<String, Integer> degree = GraphTopology.degrees(validated);
        Map<String, Integer> incoming = GraphTopology.inDegrees(validated);
        for (Node node : nodesById.values()) {
            int touching = degree.getOrDefault(node.id(), 0);
            // zero-degree nodes are reported by the orphan pruner
            if (touching == 0) continue;

            if (node.hasType(NodeType.DISEASE) && incoming.getOrDefault(node.id(), 0) == 0) {
                warnings.add(new Warning(WarningCode.DISEASE_WITHOUT_INCOMING_EDGES,
                        "Disease node \"" + node.label() + "\" has no incoming edges",
                        Map.of("nodeId", node.id())));
            }
            if ((node.hasType(NodeType.EVIDENCE) || node.hasType(NodeType.TRIAL)) && touching < MIN_EVIDENCE_EDGES) {
                warnings.add(new Warning(WarningCode.UNDER_CONNECTED_EVIDENCE,
                        "Evidence node \"" + node.label() + "\" has only " + touching + " edge(s)",
                        Map.of("nodeId", node.id(), "edgeCount", touching)));
            }
        }
        return new ValidationResult(validated, warnings, directRemoved, duplicates);
    }

    private static String label(Map<String, Node> nodesById, String id) {
        Node node = nodesById.get(id);
        return node == null || node.label() == null ? id : node.label();
    }

    private static Map<String, Object> edgeContext(Edge edge) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("source", edge.source());
        context.put("target", edge.target());
        if (edge.relationship() != null) context.put("relationship", edge.relationship());
        return context;
    }
}
