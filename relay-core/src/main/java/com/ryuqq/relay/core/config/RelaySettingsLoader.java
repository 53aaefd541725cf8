package com.ryuqq.relay.core.config;

import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Properties + 환경 변수 기반 {@link RelaySettings} 로더.
 *
 * <p><strong>우선순위:</strong></p>
 * <ol>
 *   <li>Capability 전용 키 ({@code relay.capabilities.<capability>.retry|breaker.<key>})</li>
 *   <li>환경 변수 ({@code RELAY_RETRY_MAX_ATTEMPTS} 등)</li>
 *   <li>기본 키 ({@code relay.defaults.*}, {@code relay.health.*})</li>
 *   <li>내장 기본값</li>
 * </ol>
 *
 * <p>Capability 전용 설정은 지정하지 않은 키를 기본 설정에서 상속합니다.
 * 알 수 없는 키는 무시하며, 파싱할 수 없는 값이나 제약 위반 값은 키 이름을 포함한
 * {@link ConfigurationException}으로 보고합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RelaySettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(RelaySettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "relay.properties";

    private static final String DEFAULTS_PREFIX = "relay.defaults.";
    private static final String CAPABILITIES_PREFIX = "relay.capabilities.";
    private static final String HEALTH_PREFIX = "relay.health.";

    private static final String RETRY_SECTION = "retry";
    private static final String BREAKER_SECTION = "breaker";

    private static final Map<String, String> ENV_KEYS = Map.ofEntries(
        Map.entry("RELAY_RETRY_MAX_ATTEMPTS", DEFAULTS_PREFIX + "retry.max-attempts"),
        Map.entry("RELAY_RETRY_BASE_DELAY_MS", DEFAULTS_PREFIX + "retry.base-delay-ms"),
        Map.entry("RELAY_RETRY_MAX_DELAY_MS", DEFAULTS_PREFIX + "retry.max-delay-ms"),
        Map.entry("RELAY_RETRY_BACKOFF_MULTIPLIER", DEFAULTS_PREFIX + "retry.backoff-multiplier"),
        Map.entry("RELAY_RETRY_JITTER_FRACTION", DEFAULTS_PREFIX + "retry.jitter-fraction"),
        Map.entry("RELAY_RETRY_ATTEMPT_TIMEOUT_MS", DEFAULTS_PREFIX + "retry.attempt-timeout-ms"),
        Map.entry("RELAY_BREAKER_FAILURE_THRESHOLD", DEFAULTS_PREFIX + "breaker.failure-threshold"),
        Map.entry("RELAY_BREAKER_OPEN_TIMEOUT_MS", DEFAULTS_PREFIX + "breaker.open-timeout-ms"),
        Map.entry("RELAY_HEALTH_POLL_INTERVAL_MS", HEALTH_PREFIX + "poll-interval-ms"),
        Map.entry("RELAY_HEALTH_OPEN_GRACE_PERIOD_MS", HEALTH_PREFIX + "open-grace-period-ms"),
        Map.entry("RELAY_HEALTH_PROBE_ENABLED", HEALTH_PREFIX + "probe-enabled"),
        Map.entry("RELAY_HEALTH_PROBE_TIMEOUT_MS", HEALTH_PREFIX + "probe-timeout-ms")
    );

    private final Map<String, String> environment;

    /**
     * 프로세스 환경 변수를 사용하는 로더.
     */
    public RelaySettingsLoader() {
        this(System.getenv());
    }

    /**
     * 주어진 환경 변수 맵을 사용하는 로더.
     *
     * @param environment 환경 변수 맵
     */
    public RelaySettingsLoader(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = Map.copyOf(environment);
    }

    /**
     * 클래스패스 리소스에서 설정 로드.
     *
     * <p>리소스가 없으면 내장 기본값과 환경 변수만으로 설정을 구성합니다.</p>
     *
     * @param resourceName 리소스 이름 (예: {@code relay.properties})
     * @return 설정
     * @throws ConfigurationException 리소스를 읽을 수 없거나 값이 잘못된 경우
     */
    public RelaySettings loadResource(String resourceName) {
        if (resourceName == null || resourceName.isBlank()) {
            throw new IllegalArgumentException("resourceName cannot be null or blank");
        }
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = RelaySettingsLoader.class.getClassLoader();
        }
        Properties properties = new Properties();
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                log.info("Relay settings resource {} not found, using defaults", resourceName);
            } else {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings resource " + resourceName, e);
        }
        return load(properties);
    }

    /**
     * 파일에서 설정 로드.
     *
     * @param path properties 파일 경로
     * @return 설정
     * @throws ConfigurationException 파일을 읽을 수 없거나 값이 잘못된 경우
     */
    public RelaySettings loadFile(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings file " + path, e);
        }
        return load(properties);
    }

    /**
     * Properties에서 설정 로드 (환경 변수 적용 포함).
     *
     * @param properties 설정 properties
     * @return 설정
     * @throws ConfigurationException 값이 잘못된 경우
     */
    public RelaySettings load(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }

        // 1. 환경 변수를 기본 키 위에 덮어쓰기
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            values.put(key, properties.getProperty(key).trim());
        }
        ENV_KEYS.forEach((envName, key) -> {
            String value = environment.get(envName);
            if (value != null && !value.isBlank()) {
                values.put(key, value.trim());
            }
        });

        // 2. 기본 설정
        CapabilitySettings builtIn = new CapabilitySettings();
        CapabilitySettings defaults = new CapabilitySettings(
            retryConfig(values, DEFAULTS_PREFIX + RETRY_SECTION + ".", builtIn.retry()),
            breakerConfig(values, DEFAULTS_PREFIX + BREAKER_SECTION + ".", builtIn.breaker())
        );

        // 3. Capability 전용 설정 (기본 설정 상속)
        Map<String, CapabilitySettings> capabilities = new LinkedHashMap<>();
        for (String capability : capabilityNames(values)) {
            String prefix = CAPABILITIES_PREFIX + capability + ".";
            capabilities.put(capability, new CapabilitySettings(
                retryConfig(values, prefix + RETRY_SECTION + ".", defaults.retry()),
                breakerConfig(values, prefix + BREAKER_SECTION + ".", defaults.breaker())
            ));
        }

        // 4. Health 설정
        HealthSettings builtInHealth = new HealthSettings();
        HealthSettings health;
        try {
            health = new HealthSettings(
                durationMs(values, HEALTH_PREFIX + "poll-interval-ms", builtInHealth.pollInterval()),
                durationMs(values, HEALTH_PREFIX + "open-grace-period-ms", builtInHealth.openGracePeriod()),
                bool(values, HEALTH_PREFIX + "probe-enabled", builtInHealth.probeEnabled()),
                durationMs(values, HEALTH_PREFIX + "probe-timeout-ms", builtInHealth.probeTimeout())
            );
        } catch (ConfigurationException e) {
            throw invalidSection(HEALTH_PREFIX, e);
        }

        RelaySettings settings = new RelaySettings(defaults, capabilities, health);
        log.info("Relay settings loaded: defaults={}, capabilityOverrides={}, health={}",
            defaults, capabilities.keySet(), health);
        return settings;
    }

    private static RetryConfig retryConfig(Map<String, String> values, String prefix, RetryConfig fallback) {
        int maxAttempts = integer(values, prefix + "max-attempts", fallback.maxAttempts());
        Duration baseDelay = durationMs(values, prefix + "base-delay-ms", fallback.baseDelay());
        Duration maxDelay = durationMs(values, prefix + "max-delay-ms", fallback.maxDelay());
        double multiplier = decimal(values, prefix + "backoff-multiplier", fallback.backoffMultiplier());
        double jitter = decimal(values, prefix + "jitter-fraction", fallback.jitterFraction());
        Duration attemptTimeout = durationMs(values, prefix + "attempt-timeout-ms", fallback.attemptTimeout());
        try {
            return new RetryConfig(maxAttempts, baseDelay, maxDelay, multiplier, jitter, attemptTimeout);
        } catch (ConfigurationException e) {
            throw invalidSection(prefix, e);
        }
    }

    private static CircuitBreakerConfig breakerConfig(Map<String, String> values, String prefix,
                                                      CircuitBreakerConfig fallback) {
        int threshold = integer(values, prefix + "failure-threshold", fallback.failureThreshold());
        Duration openTimeout = durationMs(values, prefix + "open-timeout-ms", fallback.openTimeout());
        try {
            return new CircuitBreakerConfig(threshold, openTimeout);
        } catch (ConfigurationException e) {
            throw invalidSection(prefix, e);
        }
    }

    private static Set<String> capabilityNames(Map<String, String> values) {
        Set<String> names = new LinkedHashSet<>();
        for (String key : values.keySet()) {
            if (!key.startsWith(CAPABILITIES_PREFIX)) {
                continue;
            }
            // <capability>.<section>.<key>, capability 이름에 '.' 포함 가능
            String rest = key.substring(CAPABILITIES_PREFIX.length());
            int keyDot = rest.lastIndexOf('.');
            if (keyDot <= 0) {
                continue;
            }
            int sectionDot = rest.lastIndexOf('.', keyDot - 1);
            if (sectionDot <= 0) {
                continue;
            }
            String section = rest.substring(sectionDot + 1, keyDot);
            if (RETRY_SECTION.equals(section) || BREAKER_SECTION.equals(section)) {
                names.add(rest.substring(0, sectionDot));
            }
        }
        return names;
    }

    private static int integer(Map<String, String> values, String key, int fallback) {
        String value = values.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw invalidValue(key, value, e);
        }
    }

    private static double decimal(Map<String, String> values, String key, double fallback) {
        String value = values.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw invalidValue(key, value, e);
        }
    }

    private static Duration durationMs(Map<String, String> values, String key, Duration fallback) {
        String value = values.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw invalidValue(key, value, e);
        }
    }

    private static boolean bool(Map<String, String> values, String key, boolean fallback) {
        String value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw invalidValue(key, value, null);
    }

    private static ConfigurationException invalidValue(String key, String value, Throwable cause) {
        return new ConfigurationException("Invalid value for " + key + ": '" + value + "'", cause);
    }

    private static ConfigurationException invalidSection(String prefix, ConfigurationException cause) {
        return new ConfigurationException("Invalid settings under " + prefix + "*: " + cause.getMessage(), cause);
    }
}
