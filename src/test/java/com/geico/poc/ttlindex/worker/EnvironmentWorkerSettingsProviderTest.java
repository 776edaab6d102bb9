package com.geico.poc.ttlindex.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentWorkerSettingsProviderTest {

    private MockEnvironment environment;
    private EnvironmentWorkerSettingsProvider provider;

    @BeforeEach
    public void setUp() {
        environment = new MockEnvironment();
        provider = new EnvironmentWorkerSettingsProvider(environment);
    }

    @Test
    public void testDefaults() {
        WorkerSettings settings = provider.load();

        assertEquals(60, settings.getNaptime());
        assertTrue(settings.isEnabled());
        assertEquals(60_000L, settings.getNaptimeMillis());
    }

    @Test
    public void testBindsFromEnvironment() {
        environment.setProperty("pg-ttl-index.naptime", "5");
        environment.setProperty("pg-ttl-index.enabled", "false");
        environment.setProperty("pg-ttl-index.default-batch-size", "500");

        WorkerSettings settings = provider.load();

        assertEquals(5, settings.getNaptime());
        assertFalse(settings.isEnabled());
    }

    @Test
    public void testPicksUpChangesOnNextLoad() {
        environment.setProperty("pg-ttl-index.naptime", "5");
        assertEquals(5, provider.load().getNaptime());

        environment.setProperty("pg-ttl-index.naptime", "30");
        assertEquals(30, provider.load().getNaptime());
    }

    @Test
    public void testInvalidNaptimeKeepsPreviousValue() {
        environment.setProperty("pg-ttl-index.naptime", "5");
        provider.load();

        environment.setProperty("pg-ttl-index.naptime", "0");
        environment.setProperty("pg-ttl-index.enabled", "false");
        WorkerSettings settings = provider.load();

        assertEquals(5, settings.getNaptime());
        assertFalse(settings.isEnabled());
    }

    @Test
    public void testInvalidNaptimeOnFirstLoadFallsBackToDefault() {
        environment.setProperty("pg-ttl-index.naptime", "-3");

        assertEquals(60, provider.load().getNaptime());
    }

    @Test
    public void testOverridesTakePrecedence() {
        environment.setProperty("pg-ttl-index.naptime", "5");

        provider.applyOverrides(2, false);
        WorkerSettings settings = provider.load();

        assertEquals(2, settings.getNaptime());
        assertFalse(settings.isEnabled());
    }

    @Test
    public void testPartialOverrideKeepsEarlierOverrides() {
        provider.applyOverrides(2, false);
        provider.applyOverrides(null, true);

        WorkerSettings settings = provider.load();

        assertEquals(2, settings.getNaptime());
        assertTrue(settings.isEnabled());
        assertNotNull(environment.getPropertySources().get(EnvironmentWorkerSettingsProvider.OVERRIDES_SOURCE_NAME));
    }
}
