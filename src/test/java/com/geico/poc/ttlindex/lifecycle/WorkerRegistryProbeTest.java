package com.geico.poc.ttlindex.lifecycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcOperations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class WorkerRegistryProbeTest {

    private JdbcOperations jdbc;
    private WorkerRegistryProbe probe;

    @BeforeEach
    public void setUp() {
        jdbc = mock(JdbcOperations.class);
        probe = new WorkerRegistryProbe(jdbc);
    }

    @Test
    public void testWorkerName() {
        assertEquals("TTL Worker DB 16384", WorkerRegistryProbe.workerName(16384L));
    }

    @Test
    public void testWorkerRunningMatchesApplicationNamePrefix() {
        when(jdbc.queryForObject(anyString(), eq(Boolean.class), eq("TTL Worker DB %"))).thenReturn(true);

        assertTrue(probe.isWorkerRunning());
    }

    @Test
    public void testNullAnswersMeanNoWorker() {
        when(jdbc.queryForObject(anyString(), eq(Boolean.class), eq("TTL Worker DB %"))).thenReturn(null);
        when(jdbc.queryForObject(anyString(), eq(Boolean.class), eq(77))).thenReturn(null);

        assertFalse(probe.isWorkerRunning());
        assertFalse(probe.terminateBackend(77));
    }
}
