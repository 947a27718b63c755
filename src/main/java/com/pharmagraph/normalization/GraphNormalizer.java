package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.NormalizationModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a raw graph snapshot into a displayable graph plus ranked reasoning paths.
 *
 * <p>Stages run strictly in order: node filtering, disease canonicalization, edge remapping,
 * evidence mediation, invariant validation, orphan pruning and path ranking. The call is
 * stateless and never throws on malformed graph input; anomalies end up as dropped entities
 * or {@link Warning}s on the result.</p>
 *
 * <p>Guaranteed on every result: no drug to disease edge, every node has at least one edge
 * (or there are no nodes), one disease node per canonical label, no dangling endpoints and no
 * two edges sharing source, target and relationship.</p>
 */
@Component
public class GraphNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(GraphNormalizer.class);

    private final NodeFilter nodeFilter = new NodeFilter();
    private final EntityCanonicalizer canonicalizer = new EntityCanonicalizer();
    private final EdgeRemapper edgeRemapper = new EdgeRemapper();
    private final EvidenceMediator evidenceMediator = new EvidenceMediator();
    private final InvariantValidator invariantValidator = new InvariantValidator();
    private final OrphanPruner orphanPruner = new OrphanPruner();
    private final PathRanker pathRanker = new PathRanker();

    public NormalizedGraph normalize(GraphSnapshot snapshot, NormalizationConfig config) {
        GraphSnapshot raw = snapshot == null ? GraphSnapshot.empty() : snapshot;
        NormalizationConfig cfg = config == null ? NormalizationConfig.empty() : config;
        if (raw.blank()) return NormalizedGraph.empty();

        FilterResult filtered = nodeFilter.filter(raw.nodes(), cfg.excludedDrugLabels(), cfg.comparatorDrugLabels());
        CanonicalizationResult canonical = canonicalizer.canonicalize(filtered.nodes(), cfg);
        Map<String, Node> nodesById = GraphTopology.indexById(canonical.nodes());
        logger.debug("Nodes: {} raw -> {} filtered -> {} canonical (identity map: {} entries)",
                raw.nodes().size(), filtered.nodes().size(), canonical.nodes().size(), canonical.identityMap().size());

        RemapResult remapped = edgeRemapper.remap(raw.edges(), canonical.identityMap(), nodesById.keySet());
        MediationResult mediated = evidenceMediator.mediate(remapped.edges(), nodesById);
        ValidationResult validated = invariantValidator.validate(mediated.edges(), nodesById);
        PruneResult pruned = orphanPruner.prune(canonical.nodes(), validated.edges());
        logger.debug("Edges: {} raw -> {} remapped -> {} mediated -> {} final (mediation ok={}, dropped={})",
                raw.edges().size(), remapped.edges().size(), mediated.edges().size(), validated.edges().size(),
                mediated.mediated(), mediated.dropped());

        List<ReasoningPath> paths = pathRanker.rank(pruned.nodes(), pruned.edges(), cfg.scoring());

        List<Warning> warnings = new ArrayList<>(validated.warnings());
        warnings.addAll(pruned.warnings());
        if (pruned.nodes().isEmpty() || pruned.edges().isEmpty()) {
            warnings.add(new Warning(WarningCode.GRAPH_COLLAPSED,
                    "Snapshot with " + raw.nodes().size() + " node(s) and " + raw.edges().size()
                            + " edge(s) produced an empty graph",
                    Map.of("rawNodes", raw.nodes().size(), "rawEdges", raw.edges().size())));
        }

        PipelineStats stats = new PipelineStats(
                raw.nodes().size(),
                filtered.nodes().size(),
                filtered.removedIds().size() + canonical.reservedIds().size(),
                canonical.identityMap().mergedCount(),
                pruned.nodes().size(),
                raw.edges().size(),
                remapped.edges().size(),
                remapped.droppedBadSource(),
                remapped.droppedBadTarget(),
                mediated.mediated(),
                mediated.dropped(),
                validated.directEdgesRemoved(),
                validated.duplicatesRemoved(),
                pruned.edges().size(),
                canonical.nodes().size() - pruned.nodes().size(),
                paths.size(),
                countByType(pruned.nodes()));

        return new NormalizedGraph(pruned.nodes(), pruned.edges(), paths, List.copyOf(warnings), stats);
    }

    private static Map<NodeType, Long> countByType(List<Node> nodes) {
        return nodes.stream().collect(Collectors.groupingBy(Node::type, () -> new EnumMap<>(NodeType.class), Collectors.counting()));
    }
}
