package com.meshcontrol.core.balancer;

import com.meshcontrol.core.MutableClock;
import com.meshcontrol.core.breaker.CircuitBreakerConfig;
import com.meshcontrol.core.breaker.CircuitBreakerRegistry;
import com.meshcontrol.core.breaker.CircuitState;
import com.meshcontrol.core.error.CircuitBreakerOpenException;
import com.meshcontrol.core.error.InvalidServiceConfigurationException;
import com.meshcontrol.core.error.LoadBalancingException;
import com.meshcontrol.core.error.ServiceNotFoundException;
import com.meshcontrol.core.error.ServiceUnavailableException;
import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceInfo;
import com.meshcontrol.core.registry.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoadBalancerTest {

    private static final ServiceEndpoint A = ServiceEndpoint.of("s1", "10.0.0.1", 8080);
    private static final ServiceEndpoint B = ServiceEndpoint.of("s1", "10.0.0.2", 8080);

    private MutableClock clock;
    private ServiceRegistry registry;
    private Set<String> unhealthy;
    private CircuitBreakerRegistry breakers;
    private LoadBalancer balancer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ServiceRegistry(clock, Duration.ofSeconds(30));
        unhealthy = new HashSet<>();
        breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.of(1, 1, Duration.ofSeconds(10)), clock, null);
        Random random = new Random(42);
        balancer = new LoadBalancer(registry, id -> !unhealthy.contains(id), breakers, StrategyType.ROUND_ROBIN,
                new InFlightTracker(), new LatencyTracker(), () -> random);
        registry.register(ServiceInfo.of("s1", List.of(A, B)), false);
    }

    private List<ServiceEndpoint> select(int times) {
        List<ServiceEndpoint> picks = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            ServiceEndpoint chosen = balancer.selectEndpoint("s1");
            picks.add(chosen);
            breakers.recordSuccess(chosen.endpointId());
        }
        return picks;
    }

    @Nested
    @DisplayName("Candidate set")
    class Candidates {

        @Test
        @DisplayName("Round robin over two healthy endpoints alternates")
        void roundRobinAlternates() {
            assertEquals(List.of(A, B, A, B), select(4));
        }

        @Test
        @DisplayName("Unhealthy endpoints are skipped")
        void skipsUnhealthy() {
            unhealthy.add(A.endpointId());
            assertEquals(List.of(B, B, B), select(3));
        }

        @Test
        @DisplayName("No healthy endpoint means service unavailable")
        void noHealthyEndpoints() {
            unhealthy.add(A.endpointId());
            unhealthy.add(B.endpointId());
            ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class,
                    () -> balancer.selectEndpoint("s1"));
            assertFalse(e instanceof CircuitBreakerOpenException);
            assertEquals("s1", e.getServiceId());
        }

        @Test
        @DisplayName("Open breakers are skipped")
        void skipsOpenBreakers() {
            breakers.recordFailure(A.endpointId());
            assertEquals(CircuitState.OPEN, breakers.getState(A.endpointId()));
            assertEquals(List.of(B, B), select(2));
        }

        @Test
        @DisplayName("All breakers open reports the shortest retry-after")
        void allBreakersOpen() {
            breakers.recordFailure(A.endpointId());
            clock.advance(Duration.ofSeconds(4));
            breakers.recordFailure(B.endpointId());

            CircuitBreakerOpenException e = assertThrows(CircuitBreakerOpenException.class,
                    () -> balancer.selectEndpoint("s1"));
            assertEquals(Duration.ofSeconds(6), e.getRetryAfter());
        }

        @Test
        @DisplayName("Selection takes the half-open probe permit")
        void takesProbePermit() {
            breakers.recordFailure(A.endpointId());
            breakers.recordFailure(B.endpointId());
            clock.advance(Duration.ofSeconds(10));

            ServiceEndpoint first = balancer.selectEndpoint("s1");
            ServiceEndpoint second = balancer.selectEndpoint("s1");
            assertNotEquals(first, second);
            assertThrows(CircuitBreakerOpenException.class, () -> balancer.selectEndpoint("s1"));
        }

        @Test
        @DisplayName("Breakers are ignored when circuit breaking is disabled")
        void breakersDisabled() {
            LoadBalancer plain = new LoadBalancer(registry, id -> true, null, StrategyType.ROUND_ROBIN);
            breakers.recordFailure(A.endpointId());
            assertEquals(A, plain.selectEndpoint("s1"));
            assertEquals(B, plain.selectEndpoint("s1"));
        }

        @Test
        @DisplayName("Unknown or unregistered services are not found")
        void unknownService() {
            assertThrows(ServiceNotFoundException.class, () -> balancer.selectEndpoint("nope"));
            registry.unregister("s1");
            assertThrows(ServiceNotFoundException.class, () -> balancer.selectEndpoint("s1"));
        }
    }

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        @DisplayName("Least connections picks the endpoint with fewest calls in flight")
        void leastConnections() {
            balancer.setStrategy(StrategyType.LEAST_CONNECTIONS);
            balancer.callStarted(A.endpointId());
            balancer.callStarted(A.endpointId());
            balancer.callStarted(B.endpointId());
            assertEquals(B, balancer.selectEndpoint("s1"));

            balancer.callFinished(A.endpointId(), 10, true);
            balancer.callFinished(A.endpointId(), 10, true);
            assertEquals(A, balancer.selectEndpoint("s1"));
            assertEquals(0, balancer.inFlight(A.endpointId()));
        }

        @Test
        @DisplayName("Least connections breaks ties by registration order")
        void leastConnectionsTies() {
            balancer.setStrategy(StrategyType.LEAST_CONNECTIONS);
            assertEquals(A, balancer.selectEndpoint("s1"));
        }

        @Test
        @DisplayName("Least response time prefers the faster endpoint")
        void leastResponseTime() {
            balancer.setStrategy(StrategyType.LEAST_RESPONSE_TIME);
            balancer.callStarted(A.endpointId());
            balancer.callFinished(A.endpointId(), 200, true);
            balancer.callStarted(B.endpointId());
            balancer.callFinished(B.endpointId(), 20, true);
            assertEquals(B, balancer.selectEndpoint("s1"));
        }

        @Test
        @DisplayName("Weighted round robin honours weights exactly over a cycle")
        void weightedRoundRobin() {
            ServiceEndpoint heavy = ServiceEndpoint.of("w", "10.1.0.1", 80, 3);
            ServiceEndpoint light = ServiceEndpoint.of("w", "10.1.0.2", 80, 1);
            ServiceEndpoint off = ServiceEndpoint.of("w", "10.1.0.3", 80, 0);
            registry.register(ServiceInfo.of("w", List.of(heavy, light, off)), false);
            balancer.setStrategy(StrategyType.WEIGHTED_ROUND_ROBIN);

            Map<ServiceEndpoint, Integer> counts = new HashMap<>();
            for (int i = 0; i < 8; i++) {
                counts.merge(balancer.selectEndpoint("w"), 1, Integer::sum);
            }
            assertEquals(6, counts.get(heavy));
            assertEquals(2, counts.get(light));
            assertNull(counts.get(off));
        }

        @Test
        @DisplayName("Weighted random never picks zero-weight endpoints")
        void weightedRandom() {
            ServiceEndpoint on = ServiceEndpoint.of("w", "10.1.0.1", 80, 5);
            ServiceEndpoint off = ServiceEndpoint.of("w", "10.1.0.2", 80, 0);
            registry.register(ServiceInfo.of("w", List.of(on, off)), false);
            balancer.setStrategy(StrategyType.WEIGHTED_RANDOM);
            for (int i = 0; i < 50; i++) {
                assertEquals(on, balancer.selectEndpoint("w"));
            }
        }

        @Test
        @DisplayName("Weighted strategies fail when every weight is zero")
        void allZeroWeights() {
            registry.register(ServiceInfo.of("w", List.of(ServiceEndpoint.of("w", "10.1.0.1", 80, 0))), false);
            balancer.setStrategy(StrategyType.WEIGHTED_RANDOM);
            assertThrows(ServiceUnavailableException.class, () -> balancer.selectEndpoint("w"));
            balancer.setStrategy(StrategyType.WEIGHTED_ROUND_ROBIN);
            assertThrows(ServiceUnavailableException.class, () -> balancer.selectEndpoint("w"));
        }

        @Test
        @DisplayName("Random picks among candidates only")
        void randomStaysInCandidates() {
            balancer.setStrategy(StrategyType.RANDOM);
            unhealthy.add(B.endpointId());
            for (int i = 0; i < 20; i++) {
                assertEquals(A, balancer.selectEndpoint("s1"));
            }
        }

        @Test
        @DisplayName("A strategy returning a non-candidate is a balancing error")
        void misbehavingStrategy() {
            ServiceEndpoint stranger = ServiceEndpoint.of("other", "192.168.0.1", 80);
            balancer.setStrategy(new LoadBalancingStrategy() {
                @Override
                public ServiceEndpoint select(String serviceId, List<ServiceEndpoint> candidates) {
                    return stranger;
                }

                @Override
                public StrategyType type() {
                    return StrategyType.RANDOM;
                }
            });
            assertThrows(LoadBalancingException.class, () -> balancer.selectEndpoint("s1"));
            assertEquals(StrategyType.RANDOM, balancer.getStrategyType());
        }

        @Test
        @DisplayName("Strategy names parse leniently")
        void parseNames() {
            assertEquals(StrategyType.LEAST_CONNECTIONS, StrategyType.from("least-connections"));
            assertEquals(StrategyType.ROUND_ROBIN, StrategyType.from(" Round_Robin "));
            assertThrows(InvalidServiceConfigurationException.class, () -> StrategyType.from("fastest"));
        }

        @Test
        @DisplayName("Switching strategy at runtime takes effect on the next selection")
        void switchAtRuntime() {
            balancer.callStarted(A.endpointId());
            assertEquals(A, balancer.selectEndpoint("s1"));
            balancer.setStrategy(StrategyType.LEAST_CONNECTIONS);
            assertEquals(StrategyType.LEAST_CONNECTIONS, balancer.getStrategyType());
            assertEquals(B, balancer.selectEndpoint("s1"));
        }
    }
}
