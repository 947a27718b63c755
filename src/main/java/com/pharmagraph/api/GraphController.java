package com.pharmagraph.api;

import com.pharmagraph.graph.GraphModels;
import com.pharmagraph.service.GraphViewService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/graph")
public class GraphController {
    private final GraphViewService viewService;

    public GraphController(GraphViewService viewService) {
        this.viewService = viewService;
    }

    @PostMapping("/normalize")
    public ResponseEntity<GraphModels.NormalizedGraph> normalize(@RequestBody GraphModels.GraphSnapshot snapshot) {
        return ResponseEntity.ok(viewService.submit(snapshot));
    }

    @GetMapping("/view")
    public ResponseEntity<GraphModels.NormalizedGraph> view() {
        return viewService.latestView()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/nodes")
    public ResponseEntity<List<GraphModels.Node>> nodes(@RequestParam(required = false) String query) {
        return ResponseEntity.ok(viewService.searchNodes(query));
    }

    @GetMapping("/paths")
    public ResponseEntity<List<GraphModels.ReasoningPath>> paths(@RequestParam(required = false) String drugId,
                                                                 @RequestParam(required = false) String diseaseId) {
        return ResponseEntity.ok(viewService.paths(drugId, diseaseId));
    }

    @GetMapping("/nodes/{nodeId}/paths")
    public ResponseEntity<List<GraphModels.ReasoningPath>> pathsThrough(@PathVariable String nodeId) {
        return ResponseEntity.ok(viewService.pathsThrough(nodeId));
    }
}
