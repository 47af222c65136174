package com.purchasingpower.hsn.api;

import com.purchasingpower.hsn.knowledge.GraphBuilder;
import com.purchasingpower.hsn.knowledge.GraphStatistics;
import com.purchasingpower.hsn.knowledge.IntegrityReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the knowledge graph health.
 */
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphBuilder graphBuilder;

    @GetMapping("/statistics")
    public ResponseEntity<GraphStatistics> statistics() {
        return ResponseEntity.ok(graphBuilder.statistics());
    }

    @GetMapping("/integrity")
    public ResponseEntity<IntegrityReport> integrity() {
        return ResponseEntity.ok(graphBuilder.validateIntegrity());
    }
}
