package biz.kryukov.dev.svcwatch.spring;

import biz.kryukov.dev.svcwatch.ConfigurationException;
import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.SvcWatch;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.registry.TargetDefinition;
import biz.kryukov.dev.svcwatch.registry.TargetRegistry;
import biz.kryukov.dev.svcwatch.store.SecretStore;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for svcwatch: creates a SvcWatch bean from application.yml properties.
 *
 * <p>A {@link MeterRegistry}, {@link SecretStore} or {@link TargetRegistry} beans in the
 * context are picked up when present.</p>
 */
@AutoConfiguration
@ConditionalOnClass(SvcWatch.class)
@ConditionalOnProperty(prefix = "svcwatch", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SvcWatchProperties.class)
public class SvcWatchAutoConfiguration {

    /**
     * Creates a {@link SvcWatch} bean configured from application properties.
     *
     * @param properties    svcwatch configuration properties
     * @param meterRegistry optional Micrometer meter registry
     * @param secretStore   optional secret store
     * @param registries    target registries in the context
     * @return configured SvcWatch instance
     */
    @Bean
    @ConditionalOnMissingBean
    public SvcWatch svcWatch(SvcWatchProperties properties,
                             ObjectProvider<MeterRegistry> meterRegistry,
                             ObjectProvider<SecretStore> secretStore,
                             ObjectProvider<TargetRegistry> registries) {
        SvcWatch.Builder builder = SvcWatch.builder()
                .config(watchConfig(properties))
                .meterRegistry(meterRegistry.getIfAvailable())
                .secretStore(secretStore.getIfAvailable());
        if (properties.getWorkers() != null) {
            builder.workers(properties.getWorkers());
        }
        registries.orderedStream().forEach(builder::registry);

        properties.getTargets().forEach((name, target) -> {
            if (target.getUrl() == null || target.getUrl().isBlank()) {
                throw new ConfigurationException("svcwatch.targets." + name + ".url is required");
            }
            builder.target(new TargetDefinition(name, target.getUrl(), target.getApiType(),
                    target.getApiUrl(), target.getAuthEndpoint(),
                    Credentials.of(target.getUsername(), target.getPassword(), target.getApiKey())));
        });

        return builder.build();
    }

    /** Creates a lifecycle bean for automatic start/stop of monitoring. */
    @Bean
    @ConditionalOnMissingBean
    public SvcWatchLifecycle svcWatchLifecycle(SvcWatch svcWatch) {
        return new SvcWatchLifecycle(svcWatch);
    }

    /** Creates a Spring Boot Actuator HealthIndicator for target liveness. */
    @Bean
    @ConditionalOnMissingBean
    public SvcWatchHealthIndicator svcWatchHealthIndicator(SvcWatch svcWatch) {
        return new SvcWatchHealthIndicator(svcWatch);
    }

    /** Creates an Actuator endpoint exposing targets at {@code /actuator/targets}. */
    @Bean
    @ConditionalOnMissingBean
    public TargetsEndpoint targetsEndpoint(SvcWatch svcWatch) {
        return new TargetsEndpoint(svcWatch);
    }

    static WatchConfig watchConfig(SvcWatchProperties properties) {
        WatchConfig.Builder config = WatchConfig.builder();
        if (properties.getInterval() != null) {
            config.interval(properties.getInterval());
        }
        if (properties.getInitialDelay() != null) {
            config.initialDelay(properties.getInitialDelay());
        }
        if (properties.getProbeTimeout() != null) {
            config.probeTimeout(properties.getProbeTimeout());
        }
        if (properties.getScanTimeout() != null) {
            config.scanTimeout(properties.getScanTimeout());
        }
        if (properties.getAuthTimeout() != null) {
            config.authTimeout(properties.getAuthTimeout());
        }
        if (properties.getRequestTimeout() != null) {
            config.requestTimeout(properties.getRequestTimeout());
        }
        if (properties.getHistorySize() != null) {
            config.historySize(properties.getHistorySize());
        }
        if (properties.getUserAgent() != null) {
            config.userAgent(properties.getUserAgent());
        }
        return config.build();
    }
}
