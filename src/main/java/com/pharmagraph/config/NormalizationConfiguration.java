package com.pharmagraph.config;

import com.pharmagraph.normalization.NormalizationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(NormalizationProperties.class)
public class NormalizationConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(NormalizationConfiguration.class);

    @Bean
    public NormalizationConfig normalizationConfig(NormalizationProperties properties) {
        NormalizationConfig config = properties.toConfig();
        logger.info("Normalization taxonomy loaded: {} disease synonyms, {} excluded drug labels, {} comparator labels, max {} paths",
                config.diseaseSynonyms().size(), config.excludedDrugLabels().size(),
                config.comparatorDrugLabels().size(), config.scoring().maxPaths());
        return config;
    }
}
