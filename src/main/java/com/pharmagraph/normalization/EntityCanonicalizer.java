package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.graph.GraphModels.NodeType;
import com.pharmagraph.normalization.NormalizationModels.CanonicalizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Merges disease nodes by canonical label. The representative id depends on the canonical
 * label alone, so feeding a normalized graph back in keeps every disease id.
 */
class EntityCanonicalizer {
    private static final Logger logger = LoggerFactory.getLogger(EntityCanonicalizer.class);
    static final String CANONICAL_ID_PREFIX = "disease_canonical_";

    CanonicalizationResult canonicalize(List<Node> nodes, NormalizationConfig config) {
        IdentityMap identity = new IdentityMap();
        // keyed by slug: labels differing only in case or spacing are one disease
        Map<String, Node> representatives = new HashMap<>();
        Set<String> reserved = new LinkedHashSet<>();
        List<Node> result = new ArrayList<>();

        for (Node node : nodes) {
            if (!isMergeable(node)) {
                if (node.id().startsWith(CANONICAL_ID_PREFIX)) {
                    logger.warn("Dropping {} node {}: id is in the canonical disease namespace",
                            node.type().wireName(), node.id());
                    reserved.add(node.id());
                    continue;
                }
                result.add(node);
                identity.assign(node.id(), node.id());
                continue;
            }

            String canonical = config.canonicalDiseaseLabel(node.label());
            if (!canonical.equals(node.label())) {
                logger.debug("Canonicalizing {} -> {}", node.label(), canonical);
            }

            String id = slugId(canonical);
            Node representative = representatives.get(id);
            if (representative == null) {
                representative = node.withIdentity(id, canonical);
                representatives.put(id, representative);
                result.add(representative);
            }
            identity.assign(node.id(), representative.id());
        }
        return new CanonicalizationResult(result, identity, reserved);
    }

    static String slugId(String canonicalLabel) {
        return CANONICAL_ID_PREFIX + canonicalLabel.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    // a disease without a label has nothing to merge on and keeps its own id
    private static boolean isMergeable(Node node) {
        return node.hasType(NodeType.DISEASE) && node.label() != null && !node.label().isBlank();
    }
}
