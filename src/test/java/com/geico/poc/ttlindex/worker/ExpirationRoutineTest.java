package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.policy.TtlPolicy;
import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcOperations;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ExpirationRoutineTest {

    private JdbcOperations jdbc;
    private TtlPolicyRepository policyRepository;
    private ExpirationRoutine routine;

    @BeforeEach
    public void setUp() {
        jdbc = mock(JdbcOperations.class);
        policyRepository = mock(TtlPolicyRepository.class);
        routine = new ExpirationRoutine(jdbc, policyRepository);
    }

    private void lockAcquired(boolean acquired) {
        when(jdbc.queryForObject(anyString(), eq(Boolean.class), eq(ExpirationRoutine.RUNNER_LOCK_NAME)))
            .thenReturn(acquired);
    }

    @Test
    public void testDeletesInBatchesUntilNothingLeft() {
        lockAcquired(true);
        TtlPolicy orders = new TtlPolicy("orders", "created_at", 3600, 2);
        when(policyRepository.findActive()).thenReturn(Collections.singletonList(orders));
        String sql = ExpirationRoutine.deleteStatement("orders", "created_at");
        when(jdbc.update(eq(sql), eq(3600), eq(2))).thenReturn(2, 2, 1, 0);

        long deleted = routine.run();

        assertEquals(5, deleted);
        verify(jdbc, times(4)).update(eq(sql), eq(3600), eq(2));
        verify(policyRepository).recordRun(eq("orders"), eq("created_at"), any(Instant.class), eq(5L));
    }

    @Test
    public void testSumsAcrossPolicies() {
        lockAcquired(true);
        TtlPolicy sessions = new TtlPolicy("sessions", "last_seen", 60, 100);
        TtlPolicy events = new TtlPolicy("events", "ts", 86400, 100);
        when(policyRepository.findActive()).thenReturn(Arrays.asList(events, sessions));
        when(jdbc.update(eq(ExpirationRoutine.deleteStatement("events", "ts")), eq(86400), eq(100)))
            .thenReturn(3, 0);
        when(jdbc.update(eq(ExpirationRoutine.deleteStatement("sessions", "last_seen")), eq(60), eq(100)))
            .thenReturn(0);

        assertEquals(3, routine.run());
        verify(policyRepository).recordRun(eq("events"), eq("ts"), any(Instant.class), eq(3L));
        verify(policyRepository).recordRun(eq("sessions"), eq("last_seen"), any(Instant.class), eq(0L));
    }

    @Test
    public void testSkipsWhenAnotherRunnerHoldsTheLock() {
        lockAcquired(false);

        assertEquals(0, routine.run());
        verify(policyRepository, never()).findActive();
    }

    @Test
    public void testErrorsPropagate() {
        lockAcquired(true);
        TtlPolicy orders = new TtlPolicy("orders", "created_at", 3600, 10);
        when(policyRepository.findActive()).thenReturn(Collections.singletonList(orders));
        when(jdbc.update(anyString(), eq(3600), eq(10)))
            .thenThrow(new DataIntegrityViolationException("violates foreign key constraint"));

        assertThrows(DataIntegrityViolationException.class, () -> routine.run());
        verify(policyRepository, never()).recordRun(anyString(), anyString(), any(), anyLong());
    }

    @Test
    public void testDeleteStatementQuotesIdentifiers() {
        String sql = ExpirationRoutine.deleteStatement("Order\"Log", "createdAt");

        assertTrue(sql.startsWith("DELETE FROM \"Order\"\"Log\" WHERE ctid = ANY(ARRAY("));
        assertTrue(sql.contains("\"createdAt\" < now() - (? * INTERVAL '1 second')"));
        assertTrue(sql.endsWith("LIMIT ?))"));
    }
}
