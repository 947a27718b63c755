package com.pharmagraph.config;

import com.pharmagraph.normalization.NormalizationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.*;

@ConfigurationProperties(prefix = "pharmagraph.normalization")
public record NormalizationProperties(List<SynonymGroup> diseaseSynonyms,
                                      List<String> excludedDrugLabels,
                                      List<String> comparatorDrugLabels,
                                      @DefaultValue Scoring scoring) {

    public NormalizationConfig toConfig() {
        Map<String, String> synonyms = new LinkedHashMap<>();
        if (diseaseSynonyms != null) {
            for (SynonymGroup group : diseaseSynonyms) {
                if (group == null || group.canonical() == null || group.aliases() == null) continue;
                group.aliases().stream()
                        .filter(Objects::nonNull)
                        .forEach(alias -> synonyms.putIfAbsent(alias, group.canonical()));
            }
        }
        return new NormalizationConfig(synonyms, excludedDrugLabels, comparatorDrugLabels,
                scoring == null ? null : scoring.toPathScoring());
    }

    public record SynonymGroup(String canonical, List<String> aliases) {}

    public record Scoring(@DefaultValue("50") double base,
                          @DefaultValue("80") double supports,
                          @DefaultValue("65") double suggests,
                          @DefaultValue("30") double contradicts,
                          @DefaultValue("12") int maxPaths) {
        NormalizationConfig.PathScoring toPathScoring() {
            return new NormalizationConfig.PathScoring(base, supports, suggests, contradicts, maxPaths);
        }
    }
}
