package com.geico.poc.ttlindex;

import com.geico.poc.ttlindex.lifecycle.RecoveryInProgressException;
import com.geico.poc.ttlindex.lifecycle.TtlWorkerManager;
import com.geico.poc.ttlindex.policy.InvalidTtlIndexException;
import com.geico.poc.ttlindex.policy.TtlPolicy;
import com.geico.poc.ttlindex.worker.CleanupResult;
import com.geico.poc.ttlindex.worker.EnvironmentWorkerSettingsProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TtlController.class)
public class TtlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TtlIndexService ttlIndexService;

    @MockBean
    private TtlWorkerManager workerManager;

    @MockBean
    private EnvironmentWorkerSettingsProvider settingsProvider;

    @Test
    public void testCreateIndex() throws Exception {
        when(ttlIndexService.createIndex("orders", "created_at", 3600, null)).thenReturn(true);

        mockMvc.perform(post("/api/ttl/indexes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tableName\":\"orders\",\"columnName\":\"created_at\",\"expireAfterSeconds\":3600}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    public void testInvalidIndexIsBadRequest() throws Exception {
        when(ttlIndexService.createIndex(anyString(), anyString(), anyInt(), any()))
            .thenThrow(new InvalidTtlIndexException("column orders.amount must be date/timestamp, found numeric"));

        mockMvc.perform(post("/api/ttl/indexes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tableName\":\"orders\",\"columnName\":\"amount\",\"expireAfterSeconds\":60}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("column orders.amount must be date/timestamp, found numeric"));
    }

    @Test
    public void testDropMissingIndex() throws Exception {
        when(ttlIndexService.dropIndex("orders", "created_at")).thenReturn(false);

        mockMvc.perform(delete("/api/ttl/indexes/orders/created_at"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void testDeactivate() throws Exception {
        when(ttlIndexService.setActive("orders", "created_at", false)).thenReturn(true);

        mockMvc.perform(patch("/api/ttl/indexes/orders/created_at").param("active", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    public void testSummary() throws Exception {
        when(ttlIndexService.summary())
            .thenReturn(Collections.singletonList(new TtlPolicy("orders", "created_at", 3600, 10000)));

        mockMvc.perform(get("/api/ttl/indexes"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result[0].tableName").value("orders"))
            .andExpect(jsonPath("$.result[0].expireAfterSeconds").value(3600));
    }

    @Test
    public void testRunNow() throws Exception {
        when(ttlIndexService.runNow()).thenReturn(CleanupResult.completed(25));

        mockMvc.perform(post("/api/ttl/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.status").value("COMPLETED"))
            .andExpect(jsonPath("$.result.rowsDeleted").value(25));
    }

    @Test
    public void testFailedRunIsServerError() throws Exception {
        when(ttlIndexService.runNow())
            .thenReturn(CleanupResult.failed(new DataAccessResourceFailureException("connection refused")));

        mockMvc.perform(post("/api/ttl/run"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void testStartDuringRecoveryIsConflict() throws Exception {
        when(workerManager.start()).thenThrow(new RecoveryInProgressException("cannot start TTL worker during recovery"));

        mockMvc.perform(post("/api/ttl/worker/start"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("cannot start TTL worker during recovery"));
    }

    @Test
    public void testStopWithoutWorker() throws Exception {
        when(workerManager.stop()).thenReturn(false);

        mockMvc.perform(post("/api/ttl/worker/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void testSettingsOverrideReloadsWorkers() throws Exception {
        when(workerManager.reload()).thenReturn(1);

        mockMvc.perform(put("/api/ttl/worker/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"naptime\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value(1));

        verify(settingsProvider).applyOverrides(5, null);
        verify(workerManager).reload();
    }
}
