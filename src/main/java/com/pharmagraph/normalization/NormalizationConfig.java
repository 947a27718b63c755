package com.pharmagraph.normalization;

import java.util.*;

/**
 * Taxonomy and scoring inputs of {@link GraphNormalizer}. Built from application properties
 * in the running service, constructed directly in tests that need an alternate taxonomy.
 *
 * @param diseaseSynonyms      raw disease label to canonical label, many-to-one, exact match
 * @param excludedDrugLabels   case-insensitive substrings that remove a drug node
 * @param comparatorDrugLabels case-insensitive substrings that flag a drug node as comparator
 * @param scoring              reasoning path score tiers and result limit
 */
public record NormalizationConfig(Map<String, String> diseaseSynonyms,
                                  List<String> excludedDrugLabels,
                                  List<String> comparatorDrugLabels,
                                  PathScoring scoring) {
    public NormalizationConfig {
        diseaseSynonyms = diseaseSynonyms == null ? Map.of() : Map.copyOf(diseaseSynonyms);
        excludedDrugLabels = sanitize(excludedDrugLabels);
        comparatorDrugLabels = sanitize(comparatorDrugLabels);
        scoring = scoring == null ? PathScoring.defaults() : scoring;
    }

    public static NormalizationConfig empty() {
        return new NormalizationConfig(Map.of(), List.of(), List.of(), PathScoring.defaults());
    }

    /** Follows synonym chains (A -> B -> C) to their end, stopping on a cycle. */
    public String canonicalDiseaseLabel(String label) {
        if (label == null) return null;
        Set<String> visited = new HashSet<>();
        String current = label;
        while (visited.add(current) && diseaseSynonyms.containsKey(current)) {
            current = diseaseSynonyms.get(current);
        }
        return current;
    }

    private static List<String> sanitize(List<String> labels) {
        if (labels == null) return List.of();
        return labels.stream()
                .filter(Objects::nonNull)
                .filter(l -> !l.isBlank())
                .distinct()
                .toList();
    }

    public record PathScoring(double base, double supports, double suggests, double contradicts, int maxPaths) {
        public static final int DEFAULT_MAX_PATHS = 12;

        public PathScoring {
            if (maxPaths < 0) {
                throw new IllegalArgumentException("maxPaths cannot be negative: " + maxPaths);
            }
        }

        public static PathScoring defaults() {
            return new PathScoring(50.0, 80.0, 65.0, 30.0, DEFAULT_MAX_PATHS);
        }
    }
}
