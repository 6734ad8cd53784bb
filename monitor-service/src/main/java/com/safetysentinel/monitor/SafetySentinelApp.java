package com.safetysentinel.monitor;

import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.config.RulesConfig;
import com.safetysentinel.core.config.RulesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: loads configuration and rules, starts the engine
 * and runs until the JVM is asked to stop.
 *
 * @since 1.0.0
 */
public final class SafetySentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(SafetySentinelApp.class);

    private SafetySentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load rules and pattern thresholds
        RulesConfig rulesConfig = RulesLoader.load();

        // 2. Environment config, with YAML pattern thresholds layered on top
        MonitorConfig config = MonitorConfig.builderFromEnvironment(System::getenv)
                .patternThresholds(rulesConfig.patternThresholds())
                .build();

        // 3. Build the engine and register rules
        MonitoringEngine engine = new MonitoringEngine(config, new LoggingNotificationSink());
        List<String> ids = rulesConfig.getRules().stream()
                .map(engine::registerRule)
                .toList();
        LOG.info("Registered {} alert rule(s): {}", ids.size(), ids);

        // 4. Run until shutdown
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.shutdown();
            stopped.countDown();
        }, "sentinel-shutdown"));

        engine.start();
        stopped.await();
    }
}
