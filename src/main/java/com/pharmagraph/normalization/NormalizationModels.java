package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Edge;
import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.graph.GraphModels.Warning;

import java.util.List;
import java.util.Set;

public class NormalizationModels {
    public record FilterResult(List<Node> nodes, Set<String> removedIds) {}

    public record CanonicalizationResult(List<Node> nodes, IdentityMap identityMap, Set<String> reservedIds) {}

    public record RemapResult(List<Edge> edges, int droppedBadSource, int droppedBadTarget) {}

    public record MediationResult(List<Edge> edges, int mediated, int dropped) {}

    public record ValidationResult(List<Edge> edges, List<Warning> warnings, int directEdgesRemoved, int duplicatesRemoved) {}

    public record PruneResult(List<Node> nodes, List<Edge> edges, List<Warning> warnings) {}
}
