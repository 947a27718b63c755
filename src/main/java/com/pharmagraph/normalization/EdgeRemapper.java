package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Edge;
import com.pharmagraph.normalization.NormalizationModels.RemapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

class EdgeRemapper {
    private static final Logger logger = LoggerFactory.getLogger(EdgeRemapper.class);

    RemapResult remap(List<Edge> edges, IdentityMap identity, Set<String> finalNodeIds) {
        List<Edge> remapped = new ArrayList<>();
        int badSource = 0;
        int badTarget = 0;

        for (Edge edge : edges) {
            if (edge == null) continue;

            String source = identity.resolve(edge.source()).orElse(null);
            if (source == null || !finalNodeIds.contains(source)) {
                logger.debug("Dropping {} edge {} -> {}: unknown source", edge.relationship(), edge.source(), edge.target());
                badSource++;
                continue;
            }
            String target = identity.resolve(edge.target()).orElse(null);
            if (target == null || !finalNodeIds.contains(target)) {
                logger.debug("Dropping {} edge {} -> {}: unknown target", edge.relationship(), edge.source(), edge.target());
                badTarget++;
                continue;
            }
            remapped.add(edge.withEndpoints(source, target));
        }
        return new RemapResult(remapped, badSource, badTarget);
    }
}
