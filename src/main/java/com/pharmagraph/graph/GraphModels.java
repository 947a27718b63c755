package com.pharmagraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

public class GraphModels {
    public static final String EVIDENCE_ID = "evidence_id";
    public static final String SOURCES = "sources";
    public static final String IS_COMPARATOR = "isComparator";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphSnapshot(List<Node> nodes, List<Edge> edges) {
        public GraphSnapshot {
            nodes = nodes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(nodes));
            edges = edges == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(edges));
        }

        public static GraphSnapshot empty() {
            return new GraphSnapshot(List.of(), List.of());
        }

        public boolean blank() {
            return nodes.isEmpty() && edges.isEmpty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(String id, String label, NodeType type, Map<String, Object> metadata) {
        public Node {
            type = type == null ? NodeType.UNKNOWN : type;
            metadata = copyOf(metadata);
        }

        public boolean hasType(NodeType expected) {
            return type == expected;
        }

        public boolean flaggedComparator() {
            Object flag = metadata.get(IS_COMPARATOR);
            return Boolean.TRUE.equals(flag) || (flag instanceof String s && Boolean.parseBoolean(s));
        }

        public Node withMetadata(String key, Object value) {
            Map<String, Object> next = new LinkedHashMap<>(metadata);
            next.put(key, value);
            return new Node(id, label, type, next);
        }

        public Node withIdentity(String newId, String newLabel) {
            return new Node(newId, newLabel, type, metadata);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Edge(String source, String target, String relationship, double weight, Map<String, Object> metadata) {
        public Edge {
            metadata = copyOf(metadata);
        }

        public Optional<String> evidenceId() {
            Object value = metadata.get(EVIDENCE_ID);
            if (value == null) return Optional.empty();
            String id = String.valueOf(value);
            return id.isBlank() ? Optional.empty() : Optional.of(id);
        }

        public Polarity polarity() {
            return Polarity.of(relationship);
        }

        public EdgeKey key() {
            return new EdgeKey(source, target, relationship);
        }

        public Edge withEndpoints(String newSource, String newTarget) {
            return new Edge(newSource, newTarget, relationship, weight, metadata);
        }
    }

    public record EdgeKey(String source, String target, String relationship) {}

    public enum NodeType {
        DRUG, DISEASE, EVIDENCE, TARGET, PATHWAY, ADVERSE, TRIAL, PATENT, MARKET_SIGNAL, UNKNOWN;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static NodeType fromWire(String value) {
            if (value == null) return UNKNOWN;
            for (NodeType type : values()) {
                if (type.wireName().equalsIgnoreCase(value.trim())) return type;
            }
            return UNKNOWN;
        }
    }

    public enum Polarity {
        SUPPORTS, SUGGESTS, CONTRADICTS, NEUTRAL;

        public static Polarity of(String relationship) {
            if (relationship == null) return NEUTRAL;
            return switch (relationship.trim().toUpperCase(Locale.ROOT)) {
                case "SUPPORTS" -> SUPPORTS;
                case "SUGGESTS" -> SUGGESTS;
                case "CONTRADICTS" -> CONTRADICTS;
                default -> NEUTRAL;
            };
        }
    }

    public record ReasoningPath(String id, String name, List<String> nodes, double confidenceScore, int sourceCount) {
        public static String keyOf(String drugId, String intermediateId, String diseaseId) {
            return drugId + "-" + intermediateId + "-" + diseaseId;
        }

        public String drugId() { return nodes.get(0); }
        public String intermediateId() { return nodes.get(1); }
        public String diseaseId() { return nodes.get(2); }

        public boolean passesThrough(String nodeId) {
            return nodes.contains(nodeId);
        }
    }

    public enum WarningCode {
        DIRECT_DRUG_DISEASE_EDGE,
        DISEASE_WITHOUT_INCOMING_EDGES,
        UNDER_CONNECTED_EVIDENCE,
        ORPHAN_REMOVED,
        GRAPH_COLLAPSED
    }

    public record Warning(WarningCode code, String message, Map<String, Object> context) {
        public Warning {
            context = copyOf(context);
        }
    }

    public record PipelineStats(int rawNodes,
                                int filteredNodes,
                                int removedNodes,
                                int mergedNodes,
                                int finalNodes,
                                int rawEdges,
                                int remappedEdges,
                                int droppedBadSource,
                                int droppedBadTarget,
                                int mediatedEdges,
                                int mediationDropped,
                                int directEdgesRemoved,
                                int duplicatesRemoved,
                                int finalEdges,
                                int orphansRemoved,
                                int reasoningPaths,
                                Map<NodeType, Long> nodeCounts) {
        public static PipelineStats empty() {
            return new PipelineStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, Map.of());
        }
    }

    public record NormalizedGraph(List<Node> nodes,
                                  List<Edge> edges,
                                  List<ReasoningPath> reasoningPaths,
                                  List<Warning> warnings,
                                  PipelineStats stats) {
        public static NormalizedGraph empty() {
            return new NormalizedGraph(List.of(), List.of(), List.of(), List.of(), PipelineStats.empty());
        }

        public GraphSnapshot toSnapshot() {
            return new GraphSnapshot(nodes, edges);
        }
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
