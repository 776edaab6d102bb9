package com.geico.poc.ttlindex;

import com.geico.poc.ttlindex.config.TtlIndexConfig;
import com.geico.poc.ttlindex.lifecycle.TtlWorkerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Installs the policy table and starts the worker once the application is up,
 * as configured by {@code pg-ttl-index.auto-install} and {@code pg-ttl-index.auto-start}.
 */
@Component
public class TtlIndexBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TtlIndexBootstrap.class);

    @Autowired
    private TtlIndexConfig config;

    @Autowired
    private TtlIndexService ttlIndexService;

    @Autowired
    private TtlWorkerManager workerManager;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.isAutoInstall()) {
            ttlIndexService.install();
        }
        if (config.isAutoStart()) {
            boolean started = workerManager.start();
            if (started) {
                log.info("✅ TTL worker auto-started");
            } else {
                log.warn("⚠️  TTL worker auto-start failed");
            }
        }
    }
}
