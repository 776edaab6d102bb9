package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.config.TtlIndexConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Binds worker settings fresh from the Spring {@link ConfigurableEnvironment} on every load,
 * so property sources changed at runtime are picked up on the next reload.
 *
 * Runtime overrides go into a highest-precedence property source named
 * {@value #OVERRIDES_SOURCE_NAME}.
 */
@Component
public class EnvironmentWorkerSettingsProvider implements WorkerSettingsProvider {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentWorkerSettingsProvider.class);

    public static final String PREFIX = "pg-ttl-index";
    public static final String OVERRIDES_SOURCE_NAME = "pgTtlIndexRuntimeOverrides";

    private final ConfigurableEnvironment environment;

    // Last settings that passed validation
    private volatile WorkerSettings lastGood;

    @Autowired
    public EnvironmentWorkerSettingsProvider(ConfigurableEnvironment environment) {
        this.environment = environment;
    }

    @Override
    public WorkerSettings load() {
        WorkerSettings bound = Binder.get(environment)
            .bind(PREFIX, WorkerSettings.class)
            .orElseGet(WorkerSettings::new);

        if (bound.getNaptime() < TtlIndexConfig.NAPTIME_MIN_SECONDS) {
            WorkerSettings previous = lastGood != null ? lastGood : new WorkerSettings();
            log.warn("⚠️  Invalid " + PREFIX + ".naptime=" + bound.getNaptime() +
                     " (minimum " + TtlIndexConfig.NAPTIME_MIN_SECONDS + "), keeping naptime=" +
                     previous.getNaptime() + "s");
            bound.setNaptime(previous.getNaptime());
        }

        lastGood = bound;
        return bound;
    }

    /**
     * Apply runtime overrides for {@code naptime} and/or {@code enabled}. Null values leave
     * the current setting alone. Takes effect on the worker's next reload.
     */
    public synchronized void applyOverrides(Integer naptime, Boolean enabled) {
        Map<String, Object> overrides = new HashMap<>();
        PropertySource<?> existing = environment.getPropertySources().get(OVERRIDES_SOURCE_NAME);
        if (existing instanceof MapPropertySource) {
            overrides.putAll(((MapPropertySource) existing).getSource());
        }
        if (naptime != null) {
            overrides.put(PREFIX + ".naptime", naptime);
        }
        if (enabled != null) {
            overrides.put(PREFIX + ".enabled", enabled);
        }

        MapPropertySource source = new MapPropertySource(OVERRIDES_SOURCE_NAME, overrides);
        if (existing != null) {
            environment.getPropertySources().replace(OVERRIDES_SOURCE_NAME, source);
        } else {
            environment.getPropertySources().addFirst(source);
        }
        log.info("🔧 TTL worker settings overridden: " + overrides);
    }
}
