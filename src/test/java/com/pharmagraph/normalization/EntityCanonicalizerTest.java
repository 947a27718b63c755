package com.pharmagraph.normalization;

import com.pharmagraph.graph.GraphModels.Node;
import com.pharmagraph.graph.GraphModels.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pharmagraph.normalization.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EntityCanonicalizerTest {
    private final EntityCanonicalizer canonicalizer = new EntityCanonicalizer();

    @Test
    void mergesSynonymousDiseasesIntoFirstRepresentative() {
        Node colon = new Node("d1", "Colon Cancer", NodeType.DISEASE, Map.of("source", "ctgov"));
        Node rectal = new Node("d2", "Rectal Cancer", NodeType.DISEASE, Map.of("source", "pubmed"));

        var result = canonicalizer.canonicalize(List.of(colon, rectal, drug("x", "DrugX")), TAXONOMY);

        List<Node> diseases = result.nodes().stream().filter(n -> n.hasType(NodeType.DISEASE)).toList();
        assertEquals(1, diseases.size());
        Node rep = diseases.get(0);
        assertEquals("disease_canonical_colorectal_cancer", rep.id());
        assertEquals("Colorectal Cancer", rep.label());
        assertEquals("ctgov", rep.metadata().get("source"));

        IdentityMap identity = result.identityMap();
        assertEquals(rep.id(), identity.resolve("d1").orElseThrow());
        assertEquals(rep.id(), identity.resolve("d2").orElseThrow());
        assertEquals("x", identity.resolve("x").orElseThrow());
        assertEquals(Set.of("d1", "d2"), identity.originalsOf(rep.id()));
        assertEquals(1, identity.mergedCount());
    }

    @Test
    void unmappedDiseaseKeepsItsLabelButGetsCanonicalId() {
        var result = canonicalizer.canonicalize(List.of(disease("d", "Chronic  Kidney Disease")), TAXONOMY);

        assertEquals("disease_canonical_chronic_kidney_disease", result.nodes().get(0).id());
        assertEquals("Chronic  Kidney Disease", result.nodes().get(0).label());
    }

    @Test
    void sameLabelDuplicatesCollapse() {
        var result = canonicalizer.canonicalize(List.of(disease("a", "Asthma"), disease("b", "Asthma")), TAXONOMY);

        assertEquals(1, result.nodes().size());
        assertEquals(result.identityMap().resolve("a"), result.identityMap().resolve("b"));
    }

    @Test
    void labelsDifferingOnlyInCaseShareOneNode() {
        var result = canonicalizer.canonicalize(List.of(
                disease("a", "Lung Cancer"),
                disease("b", "lung  cancer")
        ), TAXONOMY);

        assertEquals(List.of("disease_canonical_lung_cancer"), result.nodes().stream().map(Node::id).toList());
        assertEquals("Lung Cancer", result.nodes().get(0).label());
        assertEquals(result.identityMap().resolve("a"), result.identityMap().resolve("b"));
    }

    @Test
    void nonDiseaseNodeInCanonicalNamespaceIsDropped() {
        var result = canonicalizer.canonicalize(List.of(
                evidence("disease_canonical_gout", "Stray evidence"),
                disease("g", "Gout")
        ), TAXONOMY);

        assertEquals(List.of("disease_canonical_gout"), result.nodes().stream().map(Node::id).toList());
        assertTrue(result.nodes().get(0).hasType(NodeType.DISEASE));
        assertEquals(Set.of("disease_canonical_gout"), result.reservedIds());
        assertEquals("disease_canonical_gout", result.identityMap().resolve("g").orElseThrow());
    }

    @Test
    void removedNodesHaveNoIdentityEntry() {
        var result = canonicalizer.canonicalize(List.of(drug("x", "DrugX")), TAXONOMY);

        assertFalse(result.identityMap().contains("placebo-node"));
        assertTrue(result.identityMap().resolve("placebo-node").isEmpty());
    }

    @Test
    void synonymChainsResolveToTheirEnd() {
        var config = new NormalizationConfig(Map.of("NIDDM", "T2D", "T2D", "Type 2 Diabetes"), List.of(), List.of(), null);

        assertEquals("Type 2 Diabetes", config.canonicalDiseaseLabel("NIDDM"));
        assertEquals("Asthma", config.canonicalDiseaseLabel("Asthma"));
    }
}
