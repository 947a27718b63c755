package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels;
import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.graph.GraphModels.NodeType;
import com.pharmagraph.normalization.NormalizationModels.FilterResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

class NodeFilter {
    private static final Logger logger = LoggerFactory.getLogger(NodeFilter.class);

    FilterResult filter(List<Node> nodes, List<String> excludedLabels, List<String> comparatorLabels) {
        List<Node> kept = new ArrayList<>();
        Set<String> removed = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();

        for (Node node : nodes) {
            if (node == null || node.id() == null || node.id().isBlank()) continue;
            // first occurrence of an id wins
            if (!seen.add(node.id())) continue;

            if (!node.hasType(NodeType.DRUG)) {
                kept.add(node);
                continue;
            }
            if (containsAny(node.label(), excludedLabels)) {
                logger.debug("Removing non-drug entity {} ({})", node.label(), node.id());
                removed.add(node.id());
                continue;
            }
            kept.add(containsAny(node.label(), comparatorLabels)
                    ? node.withMetadata(GraphModels.IS_COMPARATOR, true)
                    : node);
        }
        return new FilterResult(kept, removed);
    }

    static boolean containsAny(String label, List<String> needles) {
        if (label == null || needles.isEmpty()) return false;
        String haystack = label.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(n -> haystack.contains(n.toLowerCase(Locale.ROOT)));
    }
}
