package com.geico.poc.ttlindex;

import com.geico.poc.ttlindex.dto.TtlIndexRequest;
import com.geico.poc.ttlindex.dto.TtlResponse;
import com.geico.poc.ttlindex.dto.WorkerSettingsRequest;
import com.geico.poc.ttlindex.lifecycle.RecoveryInProgressException;
import com.geico.poc.ttlindex.lifecycle.TtlWorkerManager;
import com.geico.poc.ttlindex.policy.InvalidTtlIndexException;
import com.geico.poc.ttlindex.policy.TtlPolicy;
import com.geico.poc.ttlindex.worker.CleanupResult;
import com.geico.poc.ttlindex.worker.EnvironmentWorkerSettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ttl")
public class TtlController {

    private static final Logger log = LoggerFactory.getLogger(TtlController.class);

    @Autowired
    private TtlIndexService ttlIndexService;

    @Autowired
    private TtlWorkerManager workerManager;

    @Autowired
    private EnvironmentWorkerSettingsProvider settingsProvider;

    @PostMapping("/indexes")
    public ResponseEntity<TtlResponse> createIndex(@RequestBody TtlIndexRequest request) {
        try {
            boolean created = ttlIndexService.createIndex(
                request.getTableName(), request.getColumnName(),
                request.getExpireAfterSeconds(), request.getBatchSize());
            return ResponseEntity.ok(TtlResponse.of(created));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @DeleteMapping("/indexes/{table}/{column}")
    public ResponseEntity<TtlResponse> dropIndex(@PathVariable("table") String table,
                                                 @PathVariable("column") String column) {
        try {
            return ResponseEntity.ok(TtlResponse.of(ttlIndexService.dropIndex(table, column)));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @PatchMapping("/indexes/{table}/{column}")
    public ResponseEntity<TtlResponse> setActive(@PathVariable("table") String table,
                                                 @PathVariable("column") String column,
                                                 @RequestParam("active") boolean active) {
        try {
            return ResponseEntity.ok(TtlResponse.of(ttlIndexService.setActive(table, column, active)));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/indexes")
    public ResponseEntity<TtlResponse> summary() {
        try {
            List<TtlPolicy> policies = ttlIndexService.summary();
            return ResponseEntity.ok(TtlResponse.ok(policies));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/run")
    public ResponseEntity<TtlResponse> runNow() {
        CleanupResult result = ttlIndexService.runNow();
        if (result.isFailed()) {
            return errorResponse(result.getError());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("status", result.getStatus().name());
        body.put("rowsDeleted", result.getRowsDeleted());
        return ResponseEntity.ok(TtlResponse.ok(body));
    }

    @PostMapping("/worker/start")
    public ResponseEntity<TtlResponse> startWorker() {
        try {
            return ResponseEntity.ok(TtlResponse.of(workerManager.start()));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/worker/stop")
    public ResponseEntity<TtlResponse> stopWorker() {
        try {
            return ResponseEntity.ok(TtlResponse.of(workerManager.stop()));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/worker/reload")
    public ResponseEntity<TtlResponse> reloadWorker() {
        return ResponseEntity.ok(TtlResponse.ok(workerManager.reload()));
    }

    @GetMapping("/worker/status")
    public ResponseEntity<TtlResponse> workerStatus() {
        try {
            return ResponseEntity.ok(TtlResponse.ok(workerManager.status()));
        } catch (Exception e) {
            return errorResponse(e);
        }
    }

    @PutMapping("/worker/settings")
    public ResponseEntity<TtlResponse> updateSettings(@RequestBody WorkerSettingsRequest request) {
        settingsProvider.applyOverrides(request.getNaptime(), request.getEnabled());
        int signalled = workerManager.reload();
        return ResponseEntity.ok(TtlResponse.ok(signalled));
    }

    private ResponseEntity<TtlResponse> errorResponse(Exception e) {
        HttpStatus status;
        if (e instanceof InvalidTtlIndexException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof RecoveryInProgressException) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("❌ TTL request failed: " + e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(TtlResponse.error(e.getMessage()));
    }
}
