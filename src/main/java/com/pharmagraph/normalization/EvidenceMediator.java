package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Edge;
import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.normalization.NormalizationModels.MediationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces every drug to disease claim with a drug to evidence to disease chain, using the
 * evidence node named in the edge metadata. Claims without resolvable evidence are dropped.
 */
class EvidenceMediator {
    private static final Logger logger = LoggerFactory.getLogger(EvidenceMediator.class);

    MediationResult mediate(List<Edge> edges, Map<String, Node> nodesById) {
        List<Edge> mediated = new ArrayList<>();
        int succeeded = 0;
        int dropped = 0;

        for (Edge edge : edges) {
            if (!GraphTopology.isDirectClaim(edge, nodesById)) {
                mediated.add(edge);
                continue;
            }

            Optional<String> evidenceId = edge.evidenceId().filter(nodesById::containsKey);
            if (evidenceId.isEmpty()) {
                logger.debug("No evidence path for {} -> {}, dropping claim", edge.source(), edge.target());
                dropped++;
                continue;
            }
            mediated.add(edge.withEndpoints(edge.source(), evidenceId.get()));
            mediated.add(edge.withEndpoints(evidenceId.get(), edge.target()));
            succeeded++;
        }
        return new MediationResult(mediated, succeeded, dropped);
    }
}
