package com.dbseed.quarkusroot;

import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.quarkusroot.readiness.EngineReadinessWatcher;
import com.dbseed.quarkusroot.validator.ConfigurationValidator;
import io.quarkus.arc.All;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.context.ManagedExecutor;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class QuarkusStartupAndShutdownHandler {

    private static final int INVALID_CONFIGURATION_EXIT_CODE = 2;

    @Inject
    @All
    List<ConfigurationValidator> configurationValidators;

    @Inject
    EngineReadinessWatcher engineReadinessWatcher;

    @Inject
    ManagedExecutor managedExecutor;

    private final CancellationToken cancellationToken = new CancellationToken();

    public void startup(@Observes @Priority(Interceptor.Priority.PLATFORM_BEFORE) StartupEvent startupEvent) {
        try {
            log.info("Checking provided configuration values...");
            AtomicBoolean configurationValid = new AtomicBoolean(true);
            configurationValidators.forEach(configurationValidator -> {
                if (!configurationValidator.validate()) {
                    configurationValid.set(false);
                }
            });

            if (!configurationValid.get()) {
                log.error("CONFIGURATION INVALID. DB SEED FAILED TO START!");
                Quarkus.asyncExit(INVALID_CONFIGURATION_EXIT_CODE);
                return;
            }
            log.info("Provided configuration is valid!");

            managedExecutor.runAsync(() -> engineReadinessWatcher.watch(cancellationToken));
            log.info("Waiting for database engine to become ready...");
        } catch (Throwable t) {
            log.error("Error while starting DB seed up!", t);
            Quarkus.asyncExit(1);
        }
    }

    public void shutdown(@Observes @Priority(Interceptor.Priority.PLATFORM_AFTER) ShutdownEvent shutdownEvent) {
        log.info("DB seed is shutting down...");
        cancellationToken.cancel();
        log.info("DB seed was shut down.");
    }
}
