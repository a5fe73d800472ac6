package com.meshcontrol.core.config;

import com.meshcontrol.core.events.EventBus;
import com.meshcontrol.core.health.HealthProbe;
import com.meshcontrol.core.health.HttpHealthProbe;
import com.meshcontrol.core.mesh.ServiceMeshManager;
import com.meshcontrol.core.metrics.MeshMetrics;
import com.meshcontrol.core.pool.ConnectionFactory;
import com.meshcontrol.core.pool.HttpConnectionFactory;
import com.meshcontrol.core.pool.HttpTransport;
import com.meshcontrol.core.pool.MeshTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class MeshConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock meshClock() {
        return Clock.systemUTC();
    }

    /** Fails startup with an {@code InvalidServiceConfigurationException} on bad {@code mesh.*} values. */
    @Bean
    public MeshSettings meshSettings(MeshProperties properties) {
        return MeshSettings.from(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthProbe healthProbe(MeshProperties properties) {
        return new HttpHealthProbe(Duration.ofMillis(properties.getProbeTimeoutMs()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory connectionFactory(MeshProperties properties) {
        return new HttpConnectionFactory(Duration.ofMillis(properties.getPool().getConnectTimeoutMs()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MeshTransport meshTransport() {
        return new HttpTransport();
    }

    @Bean(initMethod = "initialize", destroyMethod = "stop")
    public ServiceMeshManager serviceMeshManager(MeshSettings settings, HealthProbe healthProbe,
                                                 ConnectionFactory connectionFactory, MeshTransport transport,
                                                 MeshMetrics metrics, EventBus eventBus, Clock clock) {
        return new ServiceMeshManager(settings, healthProbe, connectionFactory, transport, metrics, eventBus, clock);
    }
}
