package com.meshcontrol.core.config;

import com.meshcontrol.core.balancer.StrategyType;
import com.meshcontrol.core.breaker.CircuitBreakerConfig;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.model.ServiceType;
import com.meshcontrol.core.ratelimit.RateLimitAlgorithm;
import com.meshcontrol.core.ratelimit.RateLimitRule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeshSettingsTest {

    @Test
    void defaultPropertiesMatchDefaults() {
        MeshSettings settings = MeshSettings.from(new MeshProperties());

        assertEquals(MeshSettings.defaults(), settings);
        assertEquals(CircuitBreakerConfig.DEFAULT, settings.breaker());
        assertEquals(StrategyType.ROUND_ROBIN, settings.strategy());
    }

    @Test
    void presetWithOverrides() {
        MeshProperties props = new MeshProperties();
        props.getBreaker().setPreset("aggressive");
        props.getBreaker().setOpenTimeoutSec(45);

        CircuitBreakerConfig breaker = MeshSettings.from(props).breaker();

        assertEquals(3, breaker.failureThreshold());
        assertEquals(2, breaker.successThreshold());
        assertEquals(Duration.ofSeconds(45), breaker.openTimeout());
    }

    @Test
    void unknownPresetRejected() {
        MeshProperties props = new MeshProperties();
        props.getBreaker().setPreset("reckless");

        assertThrows(InvalidServiceConfigurationException.class, () -> MeshSettings.from(props));
    }

    @Test
    void strategyNameAcceptsDashes() {
        MeshProperties props = new MeshProperties();
        props.setLoadBalancingStrategy("least-response-time");

        assertEquals(StrategyType.LEAST_RESPONSE_TIME, MeshSettings.from(props).strategy());
    }

    @Test
    void nonPositiveIntervalsRejected() {
        MeshProperties props = new MeshProperties();
        props.setHealthCheckIntervalSec(0);

        InvalidServiceConfigurationException e =
                assertThrows(InvalidServiceConfigurationException.class, () -> MeshSettings.from(props));
        assertTrue(e.getMessage().contains("healthCheckIntervalSec"));
    }

    @Test
    void rateLimitRulesConverted() {
        MeshProperties.RateLimitRuleProperties bucket = new MeshProperties.RateLimitRuleProperties();
        bucket.setName("api");
        bucket.setResourcePattern("api/.*");
        bucket.setCapacity(10);
        bucket.setRefillPerSecond(2.5);
        MeshProperties.RateLimitRuleProperties window = new MeshProperties.RateLimitRuleProperties();
        window.setName("login");
        window.setAlgorithm("sliding-window");
        window.setLimit(5);
        window.setWindowSec(60);
        MeshProperties props = new MeshProperties();
        props.setRateLimitRules(List.of(bucket, window));

        List<RateLimitRule> rules = MeshSettings.from(props).rateLimitRules();

        assertEquals(2, rules.size());
        assertEquals(RateLimitAlgorithm.TOKEN_BUCKET, rules.get(0).algorithm());
        assertEquals(RateLimitAlgorithm.SLIDING_WINDOW, rules.get(1).algorithm());
        assertEquals(Duration.ofSeconds(60), rules.get(1).window());
    }

    @Test
    void unknownAlgorithmRejected() {
        MeshProperties.RateLimitRuleProperties rule = new MeshProperties.RateLimitRuleProperties();
        rule.setName("odd");
        rule.setAlgorithm("leaky_bucket");
        MeshProperties props = new MeshProperties();
        props.setRateLimitRules(List.of(rule));

        assertThrows(InvalidServiceConfigurationException.class, () -> MeshSettings.from(props));
    }

    @Test
    void duplicateRuleNamesRejected() {
        List<RateLimitRule> rules = List.of(
                RateLimitRule.tokenBucket("api", ".*", 10, 1),
                RateLimitRule.slidingWindow("api", ".*", 10, Duration.ofSeconds(1)));

        assertThrows(InvalidServiceConfigurationException.class,
                () -> MeshSettings.defaults().withRateLimitRules(rules));
    }

    @Test
    void bootstrapServicesConverted() {
        MeshProperties.EndpointDefinition endpoint = new MeshProperties.EndpointDefinition();
        endpoint.setHost("10.0.0.5");
        endpoint.setPort(9000);
        endpoint.setWeight(3);
        MeshProperties.ServiceDefinition service = new MeshProperties.ServiceDefinition();
        service.setServiceId("billing");
        service.setType("database");
        service.setEndpoints(List.of(endpoint));
        MeshProperties props = new MeshProperties();
        props.setServices(List.of(service));

        ServiceInfo info = MeshSettings.from(props).services().get(0);

        assertEquals("billing", info.serviceId());
        assertEquals(ServiceType.DATABASE, info.type());
        ServiceEndpoint converted = info.endpoints().get(0);
        assertEquals("http://10.0.0.5:9000", converted.endpointId());
        assertEquals(3, converted.weight());
        assertEquals("billing", converted.serviceId());
    }
}
