package rs.lukaj.restclient.client.circuitbreaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.restclient.connections.InvalidConfigException;

import java.time.Clock;
import java.time.Duration;

/**
 * Circuit breaker which opens after a number of consecutive failures, stays open for a fixed time, and then lets
 * a limited number of probe calls through. Enough successful probes close it again; any failed probe reopens it.
 * <br/>
 * Completions of calls admitted before the last state change are ignored, so a slow call started while the
 * breaker was closed can't close a breaker which has opened in the meantime.
 */
public class CountingCircuitBreaker implements CircuitBreaker {
    private static final Logger LOG = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    private final String name;
    private final Config config;
    private final Clock clock;

    private State state = State.CLOSED;
    private long generation = 0;
    private int consecutiveFailures = 0;
    private int probeSuccesses = 0;
    private int probesInFlight = 0;
    private long openedAt = 0;

    public CountingCircuitBreaker(String name, Config config) {
        this(name, config, Clock.systemUTC());
    }

    CountingCircuitBreaker(String name, Config config, Clock clock) {
        this.name = name;
        this.config = config.copy();
        this.clock = clock;
    }

    @Override
    public synchronized Completion allow() throws CircuitOpenException {
        if(state == State.OPEN) {
            long sinceOpen = clock.millis() - openedAt;
            long recovery = config.recoveryTimeout.toMillis();
            if(sinceOpen < recovery) {
                throw new CircuitOpenException("Circuit breaker " + name + " is open",
                        Duration.ofMillis(recovery - sinceOpen));
            }
            transition(State.HALF_OPEN);
        }
        if(state == State.HALF_OPEN) {
            if(probesInFlight >= config.halfOpenMaxCalls)
                throw new CircuitOpenException("Circuit breaker " + name + " is half-open and busy probing", Duration.ZERO);
            probesInFlight++;
        }
        long admittedIn = generation;
        return success -> complete(admittedIn, success);
    }

    private synchronized void complete(long admittedIn, boolean success) {
        if(admittedIn != generation) return;
        switch (state) {
            case CLOSED:
                if(success) {
                    consecutiveFailures = 0;
                } else if(++consecutiveFailures >= config.failureThreshold) {
                    LOG.warn("Circuit breaker {} opened after {} consecutive failures", name, consecutiveFailures);
                    transition(State.OPEN);
                }
                break;
            case HALF_OPEN:
                probesInFlight--;
                if(!success) {
                    LOG.warn("Circuit breaker {} reopened after a failed probe", name);
                    transition(State.OPEN);
                } else if(++probeSuccesses >= config.successThreshold) {
                    LOG.info("Circuit breaker {} closed after successful recovery", name);
                    transition(State.CLOSED);
                }
                break;
            case OPEN:
                break;
        }
    }

    //caller holds the lock
    private void transition(State to) {
        state = to;
        generation++;
        consecutiveFailures = 0;
        probeSuccesses = 0;
        probesInFlight = 0;
        if(to == State.OPEN) openedAt = clock.millis();
    }

    @Override
    public synchronized State getState() {
        return state;
    }

    public String getName() {
        return name;
    }

    public static class Config {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int successThreshold = 3;
        private int halfOpenMaxCalls = 3;

        public Config() {
        }

        public Config(int failureThreshold, Duration recoveryTimeout, int successThreshold) {
            setFailureThreshold(failureThreshold);
            setRecoveryTimeout(recoveryTimeout);
            setSuccessThreshold(successThreshold);
        }

        private Config copy() {
            Config copy = new Config();
            copy.failureThreshold = failureThreshold;
            copy.recoveryTimeout = recoveryTimeout;
            copy.successThreshold = successThreshold;
            copy.halfOpenMaxCalls = halfOpenMaxCalls;
            return copy;
        }

        /**
         * Sets number of consecutive failures after which the breaker opens.
         */
        public Config setFailureThreshold(int failureThreshold) {
            if(failureThreshold < 1) throw new InvalidConfigException("failureThreshold must be positive!");
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Sets how long the breaker stays open before letting probe calls through.
         */
        public Config setRecoveryTimeout(Duration recoveryTimeout) {
            if(recoveryTimeout == null || recoveryTimeout.isNegative())
                throw new InvalidConfigException("recoveryTimeout can't be negative!");
            this.recoveryTimeout = recoveryTimeout;
            return this;
        }

        /**
         * Sets number of successful probes needed to close the breaker.
         */
        public Config setSuccessThreshold(int successThreshold) {
            if(successThreshold < 1) throw new InvalidConfigException("successThreshold must be positive!");
            this.successThreshold = successThreshold;
            return this;
        }

        /**
         * Sets how many probe calls can be in progress at once while the breaker is half-open.
         */
        public Config setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            if(halfOpenMaxCalls < 1) throw new InvalidConfigException("halfOpenMaxCalls must be positive!");
            this.halfOpenMaxCalls = halfOpenMaxCalls;
            return this;
        }
    }
}
