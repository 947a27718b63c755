package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.NormalizationModels.PruneResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

class OrphanPruner {
    private static final Logger logger = LoggerFactory.getLogger(OrphanPruner.class);

    PruneResult prune(List<Node> nodes, List<Edge> edges) {
        Map<String, Integer> degree = GraphTopology.degrees(edges);
        List<Node> connected = new ArrayList<>();
        List<Warning> warnings = new ArrayList<>();

        for (Node node : nodes) {
            if (degree.getOrDefault(node.id(), 0) > 0) {
                connected.add(node);
                continue;
            }
            logger.debug("Removing isolated node {} ({})", node.label(), node.type().wireName());
            warnings.add(new Warning(WarningCode.ORPHAN_REMOVED,
                    "Removed isolated node: " + node.label() + " (" + node.type().wireName() + ")",
                    Map.of("nodeId", node.id(), "type", node.type().wireName())));
        }
        return new PruneResult(List.copyOf(connected), edges, warnings);
    }
}
