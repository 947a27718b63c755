package com.pharmagraph.service;

import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.GraphNormalizer;
import com.pharmagraph.normalization.NormalizationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recent normalized view. Every snapshot is recomputed from scratch and a
 * result is published only when no newer snapshot has been published first.
 */
@Service
public class GraphViewService {
    private static final Logger logger = LoggerFactory.getLogger(GraphViewService.class);

    private final GraphNormalizer normalizer;
    private final NormalizationConfig config;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<PublishedView> latest = new AtomicReference<>();

    public GraphViewService(GraphNormalizer normalizer, NormalizationConfig config) {
        this.normalizer = normalizer;
        this.config = config;
    }

    public NormalizedGraph submit(GraphSnapshot snapshot) {
        long generation = generations.incrementAndGet();
        NormalizedGraph graph = normalizer.normalize(snapshot, config);
        PublishedView candidate = new PublishedView(generation, graph);

        PublishedView current = latest.accumulateAndGet(candidate,
                (prev, next) -> prev == null || next.generation() > prev.generation() ? next : prev);
        if (current != candidate) {
            logger.debug("Discarding stale view {} (latest is {})", generation, current.generation());
        }

        logger.info("Normalized snapshot {}: {} nodes, {} edges, {} paths, {} warnings",
                generation, graph.nodes().size(), graph.edges().size(),
                graph.reasoningPaths().size(), graph.warnings().size());
        return graph;
    }

    public Optional<NormalizedGraph> latestView() {
        return Optional.ofNullable(latest.get()).map(PublishedView::graph);
    }

    public long latestGeneration() {
        PublishedView view = latest.get();
        return view == null ? 0L : view.generation();
    }

    public List<Node> searchNodes(String query) {
        List<Node> nodes = latestView().map(NormalizedGraph::nodes).orElse(List.of());
        if (query == null || query.isBlank()) return nodes;

        String q = query.trim().toLowerCase(Locale.ROOT);
        return nodes.stream()
                .filter(n -> (n.label() != null && n.label().toLowerCase(Locale.ROOT).contains(q))
                        || n.type().wireName().contains(q))
                .toList();
    }

    public List<ReasoningPath> paths(String drugId, String diseaseId) {
        return latestView().map(NormalizedGraph::reasoningPaths).orElse(List.of()).stream()
                .filter(p -> drugId == null || drugId.isBlank() || p.drugId().equals(drugId))
                .filter(p -> diseaseId == null || diseaseId.isBlank() || p.diseaseId().equals(diseaseId))
                .toList();
    }

    public List<ReasoningPath> pathsThrough(String nodeId) {
        return latestView().map(NormalizedGraph::reasoningPaths).orElse(List.of()).stream()
                .filter(p -> p.passesThrough(nodeId))
                .toList();
    }

    public record PublishedView(long generation, NormalizedGraph graph) {}
}
