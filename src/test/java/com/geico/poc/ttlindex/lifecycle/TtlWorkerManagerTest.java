package com.geico.poc.ttlindex.lifecycle;

import com.geico.poc.ttlindex.supervisor.BackgroundWorker;
import com.geico.poc.ttlindex.supervisor.BackgroundWorkerHandle;
import com.geico.poc.ttlindex.supervisor.RestartPolicy;
import com.geico.poc.ttlindex.supervisor.StartCondition;
import com.geico.poc.ttlindex.supervisor.StartupStatus;
import com.geico.poc.ttlindex.supervisor.WorkerStartupException;
import com.geico.poc.ttlindex.supervisor.WorkerSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TtlWorkerManagerTest {

    private static final long DATABASE_OID = 16384L;

    @Mock
    private RecoveryStateProbe recoveryProbe;

    @Mock
    private WorkerRegistryProbe registryProbe;

    @Mock
    private WorkerStartGuard startGuard;

    @Mock
    private WorkerSupervisor supervisor;

    @Mock
    private BackgroundWorkerHandle handle;

    @InjectMocks
    private TtlWorkerManager manager;

    @BeforeEach
    public void setUp() {
        lenient().when(startGuard.runExclusively(any())).thenAnswer(invocation -> {
            Supplier<?> action = invocation.getArgument(0);
            return action.get();
        });
        lenient().when(registryProbe.currentDatabaseOid()).thenReturn(DATABASE_OID);
    }

    // ========================================
    // start
    // ========================================

    @Test
    public void testStartRegistersWorkerForCurrentDatabase() {
        when(supervisor.register(any(BackgroundWorker.class))).thenReturn(Optional.of(handle));
        when(supervisor.waitForStartup(handle)).thenReturn(StartupStatus.STARTED);

        assertTrue(manager.start());

        verify(supervisor).register(argThat(worker ->
            worker.getName().equals("TTL Worker DB 16384") && worker.getMainArg() == DATABASE_OID));
    }

    @Test
    public void testStartIsIdempotent() {
        when(registryProbe.isWorkerRunning()).thenReturn(true);

        assertTrue(manager.start());
        assertTrue(manager.start());

        verify(supervisor, never()).register(any());
    }

    @Test
    public void testStartRefusedDuringRecovery() {
        when(recoveryProbe.isInRecovery()).thenReturn(true);

        assertThrows(RecoveryInProgressException.class, () -> manager.start());
        verifyNoInteractions(startGuard, supervisor);
    }

    @Test
    public void testStartWithoutFreeSlot() {
        when(supervisor.register(any(BackgroundWorker.class))).thenReturn(Optional.empty());

        assertFalse(manager.start());
        verify(supervisor, never()).waitForStartup(any());
    }

    @Test
    public void testWorkerStoppedBeforeStartup() {
        when(supervisor.register(any(BackgroundWorker.class))).thenReturn(Optional.of(handle));
        when(supervisor.waitForStartup(handle)).thenReturn(StartupStatus.STOPPED);

        assertFalse(manager.start());
    }

    @Test
    public void testSupervisorDiedDuringStartup() {
        when(supervisor.register(any(BackgroundWorker.class))).thenReturn(Optional.of(handle));
        when(supervisor.waitForStartup(handle)).thenReturn(StartupStatus.SUPERVISOR_DIED);

        assertThrows(WorkerStartupException.class, () -> manager.start());
    }

    @Test
    public void testStartRunsUnderStartGuard() {
        when(registryProbe.isWorkerRunning()).thenReturn(true);

        manager.start();

        verify(startGuard).runExclusively(any());
    }

    @Test
    public void testWorkerDescriptor() {
        BackgroundWorker worker = TtlWorkerManager.describeWorker(DATABASE_OID);

        assertEquals("TTL Worker DB 16384", worker.getName());
        assertEquals("TTL Index Worker", worker.getType());
        assertEquals("pg_ttl_index", worker.getLibraryName());
        assertEquals("ttl_worker_main", worker.getFunctionName());
        assertEquals(RestartPolicy.NEVER, worker.getRestartPolicy());
        assertEquals(StartCondition.RECOVERY_FINISHED, worker.getStartCondition());
    }

    // ========================================
    // stop / reload
    // ========================================

    @Test
    public void testStopWithoutWorker() {
        when(registryProbe.findWorkerPids()).thenReturn(Collections.emptyList());

        assertFalse(manager.stop());
        verify(registryProbe, never()).terminateBackend(anyInt());
    }

    @Test
    public void testStopLetsLocalWorkerFinishItsPass() {
        when(registryProbe.findWorkerPids()).thenReturn(Collections.singletonList(101));
        when(supervisor.signalTerminate(101)).thenReturn(true);

        assertTrue(manager.stop());

        verify(registryProbe, never()).terminateBackend(anyInt());
    }

    @Test
    public void testStopTerminatesBackendsOwnedElsewhere() {
        when(registryProbe.findWorkerPids()).thenReturn(Arrays.asList(101, 102));
        when(supervisor.signalTerminate(101)).thenReturn(true);
        when(supervisor.signalTerminate(102)).thenReturn(false);
        when(registryProbe.terminateBackend(102)).thenReturn(true);

        assertTrue(manager.stop());

        verify(registryProbe, never()).terminateBackend(101);
        verify(registryProbe).terminateBackend(102);
    }

    @Test
    public void testStopReportsFailureWhenNothingWasTerminated() {
        when(registryProbe.findWorkerPids()).thenReturn(Collections.singletonList(102));
        when(supervisor.signalTerminate(102)).thenReturn(false);
        when(registryProbe.terminateBackend(102)).thenReturn(false);

        assertFalse(manager.stop());
    }

    @Test
    public void testReload() {
        when(supervisor.signalReloadAll()).thenReturn(1);

        assertEquals(1, manager.reload());
    }
}
