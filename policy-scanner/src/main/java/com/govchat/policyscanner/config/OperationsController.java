package com.govchat.policyscanner.config;

import com.govchat.policyscanner.indexing.IndexingRequest;
import com.govchat.policyscanner.indexing.IndexingService;
import com.govchat.policyscanner.indexing.IndexingStatus;
import com.govchat.policyscanner.model.DocumentStatus;
import com.govchat.policyscanner.scraper.PluginRegistry;
import com.govchat.policyscanner.service.SourceIngestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class OperationsController {

    private final SourceIngestService ingestService;
    private final IndexingService indexingService;
    private final PluginRegistry pluginRegistry;

    // ── Ingest triggers ───────────────────────────────────────────────────────

    @PostMapping("/ingest/{sourceId}")
    public ResponseEntity<Map<String, String>> triggerSource(@PathVariable String sourceId) {
        if (ingestService.findSource(sourceId).isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown source: " + sourceId));
        }
        new Thread(() -> ingestService.ingest(sourceId), "manual-ingest-" + sourceId).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", sourceId));
    }

    @PostMapping("/ingest")
    public ResponseEntity<Map<String, String>> triggerAll() {
        new Thread(ingestService::ingestAll, "manual-ingest-all").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "all"));
    }

    // ── Indexing ──────────────────────────────────────────────────────────────

    /**
     * Start an indexing run in the background.
     *
     * POST /index/run?sourceId=gemeenteblad-utrecht&status=failed&force=false&max=500
     */
    @PostMapping("/index/run")
    public ResponseEntity<Map<String, String>> runIndexing(
            @RequestParam(required = false) String sourceId,
            @RequestParam(defaultValue = "pending") String status,
            @RequestParam(defaultValue = "false") boolean force,
            @RequestParam(required = false) Integer max) {
        DocumentStatus statusFilter;
        try {
            statusFilter = DocumentStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        IndexingRequest request = IndexingRequest.builder()
                .sourceId(sourceId)
                .statusFilter(statusFilter)
                .forceReindex(force)
                .maxDocuments(max)
                .build();

        new Thread(() -> {
            try {
                indexingService.run(request);
            } catch (Exception e) {
                log.error("Manual indexing run failed: {}", e.getMessage(), e);
            }
        }, "manual-index").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "filter", statusFilter.value()));
    }

    @PostMapping("/index/documents/{id}/reindex")
    public ResponseEntity<Map<String, Object>> reindex(@PathVariable String id) {
        boolean indexed = indexingService.reindexDocument(id);
        return ResponseEntity.ok(Map.of("id", id, "indexed", indexed));
    }

    @DeleteMapping("/index/documents")
    public ResponseEntity<Map<String, Object>> deleteFromIndex(@RequestBody List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No document ids given"));
        }
        boolean deleted = indexingService.deleteFromIndex(ids);
        return ResponseEntity.ok(Map.of("requested", ids.size(), "deleted", deleted));
    }

    @GetMapping("/index/status")
    public ResponseEntity<IndexingStatus> indexStatus() {
        return ResponseEntity.ok(indexingService.status());
    }

    // ── Plugins ───────────────────────────────────────────────────────────────

    @GetMapping("/plugins")
    public ResponseEntity<List<PluginRegistry.PluginInfo>> plugins() {
        return ResponseEntity.ok(pluginRegistry.list().stream()
                .map(pluginRegistry::info)
                .flatMap(Optional::stream)
                .toList());
    }

    @GetMapping("/plugins/{name}")
    public ResponseEntity<?> plugin(@PathVariable String name) {
        return pluginRegistry.info(name)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    Map<String, String> body = new LinkedHashMap<>();
                    body.put("error", "Plugin '" + name + "' not found");
                    body.put("available", String.join(", ", pluginRegistry.list()));
                    return ResponseEntity.status(404).body(body);
                });
    }
}
