package com.pharmagraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmagraph.graph.GraphModels.*;
import com.pharmagraph.normalization.GraphNormalizer;
import com.pharmagraph.normalization.NormalizationConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.pharmagraph.normalization.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class GraphViewServiceTest {
    private static final String COLORECTAL = "disease_canonical_colorectal_cancer";

    @Autowired
    private GraphViewService service;
    @Autowired
    private ObjectMapper objectMapper;

    private GraphSnapshot fixture() throws IOException {
        try (InputStream in = new ClassPathResource("snapshots/colorectal-snapshot.json").getInputStream()) {
            return objectMapper.readValue(in, GraphSnapshot.class);
        }
    }

    @Test
    void normalizesFetchedSnapshotWithConfiguredTaxonomy() throws IOException {
        NormalizedGraph graph = service.submit(fixture());

        assertEquals(6, graph.nodes().size());
        assertEquals(8, graph.edges().size());
        assertTrue(graph.nodes().stream().noneMatch(n -> n.id().equals("drug_placebo")));
        assertTrue(graph.nodes().stream().filter(n -> n.id().equals("drug_celecoxib")).findFirst().orElseThrow().flaggedComparator());

        assertEquals(List.of("drug_aspirin-ev_cohort-" + COLORECTAL, "drug_aspirin-ev_rct-" + COLORECTAL),
                graph.reasoningPaths().stream().map(ReasoningPath::id).toList());
        assertEquals(80.0, graph.reasoningPaths().get(0).confidenceScore());
        assertEquals(65.0, graph.reasoningPaths().get(1).confidenceScore());
        assertEquals(2, graph.reasoningPaths().get(0).sourceCount());
        assertEquals("Aspirin → Colorectal Cancer", graph.reasoningPaths().get(0).name());

        assertEquals(2, graph.warnings().stream().filter(w -> w.code() == WarningCode.ORPHAN_REMOVED).count());
        assertEquals(1, graph.stats().removedNodes());
        assertEquals(1, graph.stats().droppedBadSource());
        assertEquals(3, graph.stats().mediatedEdges());
        assertEquals(1, graph.stats().mediationDropped());
        assertEquals(1, graph.stats().duplicatesRemoved());
        assertEquals(2L, graph.stats().nodeCounts().get(NodeType.DRUG));
    }

    @Test
    void latestSubmissionReplacesPreviousView() throws IOException {
        service.submit(fixture());
        long before = service.latestGeneration();

        NormalizedGraph small = service.submit(snapshot(
                List.of(drug("m", "Metformin"), disease("t", "T2DM"), evidence("e", "UKPDS")),
                List.of(claim("m", "t", "SUGGESTS", "e"))));

        assertEquals(before + 1, service.latestGeneration());
        assertSame(small, service.latestView().orElseThrow());
        assertEquals("disease_canonical_type_2_diabetes_mellitus", small.reasoningPaths().get(0).diseaseId());
    }

    @Test
    void searchesAndFiltersTheLatestView() throws IOException {
        service.submit(fixture());

        assertEquals(List.of("drug_aspirin"), service.searchNodes("aspi").stream().map(Node::id).toList());
        assertEquals(2, service.searchNodes("TRIAL").size());
        assertEquals(6, service.searchNodes("  ").size());

        assertEquals(2, service.paths("drug_aspirin", COLORECTAL).size());
        assertTrue(service.paths("drug_celecoxib", null).isEmpty());
        assertEquals(1, service.pathsThrough("ev_rct").size());
    }

    @Test
    void olderSubmissionFinishingLastIsNotPublished() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicBoolean holdNext = new AtomicBoolean(true);
        GraphNormalizer slowFirst = new GraphNormalizer() {
            @Override
            public NormalizedGraph normalize(GraphSnapshot snapshot, NormalizationConfig config) {
                if (holdNext.getAndSet(false)) {
                    firstStarted.countDown();
                    try {
                        releaseFirst.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.normalize(snapshot, config);
            }
        };
        GraphViewService views = new GraphViewService(slowFirst, TAXONOMY);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<NormalizedGraph> older = executor.submit(() -> views.submit(fixture()));
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

            NormalizedGraph newer = views.submit(snapshot(
                    List.of(drug("m", "Metformin"), disease("t", "T2DM"), evidence("e", "UKPDS")),
                    List.of(claim("m", "t", "SUGGESTS", "e"))));
            releaseFirst.countDown();
            NormalizedGraph stale = older.get(5, TimeUnit.SECONDS);

            assertEquals(6, stale.nodes().size());
            assertSame(newer, views.latestView().orElseThrow());
            assertEquals(2, views.latestGeneration());
            assertTrue(views.searchNodes("aspirin").isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }
}
