package com.ryuqq.relay.adapter.inmemory.registry;

import com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreaker;
import com.ryuqq.relay.core.config.RelaySettings;
import com.ryuqq.relay.core.exception.DuplicateProviderException;
import com.ryuqq.relay.core.exception.ProviderNotFoundException;
import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerFactory;
import com.ryuqq.relay.core.registry.ProviderDescriptor;
import com.ryuqq.relay.core.registry.ProviderRegistry;
import com.ryuqq.relay.core.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-Memory Provider Registry.
 *
 * <p>Descriptor 목록과 Provider별 Circuit Breaker를 프로세스 메모리에 보관합니다.</p>
 *
 * <p><strong>데이터 구조:</strong></p>
 * <ul>
 *   <li><strong>descriptors:</strong> CopyOnWriteArrayList - 등록 순서 보존, 읽기 위주 (등록은 시작 시점)</li>
 *   <li><strong>breakers:</strong> ConcurrentHashMap&lt;ProviderName, CircuitBreaker&gt; - Provider 이름당 1개</li>
 * </ul>
 *
 * <p><strong>Circuit Breaker 설정:</strong> Provider 이름이 처음 등록될 때, 해당 Descriptor의
 * Capability 설정({@link RelaySettings#settingsFor(Capability)})에서 가져옵니다.
 * 같은 이름을 다른 Capability에 추가 등록하면 기존 Circuit Breaker를 공유합니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 등록(중복 검사 + 추가)은 registry 단위로 직렬화되며,
 * 조회는 락 없이 스냅샷을 읽습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class InMemoryProviderRegistry implements ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProviderRegistry.class);

    private static final Comparator<ProviderDescriptor<?, ?>> BY_RANK =
        Comparator.comparingInt(ProviderDescriptor::rank);

    private final RelaySettings settings;
    private final CircuitBreakerFactory breakerFactory;
    private final List<ProviderDescriptor<?, ?>> descriptors = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<ProviderName, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();

    /**
     * {@link InMemoryCircuitBreaker}를 사용하는 Registry 생성.
     *
     * @param settings Relay 설정
     */
    public InMemoryProviderRegistry(RelaySettings settings) {
        this(settings, InMemoryCircuitBreaker::new);
    }

    /**
     * Circuit Breaker 팩토리를 지정하여 Registry 생성.
     *
     * @param settings Relay 설정
     * @param breakerFactory Circuit Breaker 팩토리
     */
    public InMemoryProviderRegistry(RelaySettings settings, CircuitBreakerFactory breakerFactory) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (breakerFactory == null) {
            throw new IllegalArgumentException("breakerFactory cannot be null");
        }
        this.settings = settings;
        this.breakerFactory = breakerFactory;
    }

    @Override
    public void register(ProviderDescriptor<?, ?> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }

        synchronized (registrationLock) {
            // 1. 중복 검사 (Capability + 이름)
            for (ProviderDescriptor<?, ?> existing : descriptors) {
                if (existing.capability().equals(descriptor.capability())
                    && existing.name().equals(descriptor.name())) {
                    throw new DuplicateProviderException(descriptor.capability(), descriptor.name());
                }
            }

            // 2. Provider 이름당 Circuit Breaker 1개
            boolean newBreaker = !breakers.containsKey(descriptor.name());
            if (newBreaker) {
                CircuitBreakerConfig breakerConfig = settings.settingsFor(descriptor.capability()).breaker();
                breakers.put(descriptor.name(), breakerFactory.create(descriptor.name(), breakerConfig));
            }

            // 3. 등록
            descriptors.add(descriptor);

            log.info("Registered provider {} for {} (rank={}, breaker={})",
                descriptor.name(), descriptor.capability(), descriptor.rank(), newBreaker ? "created" : "shared");
        }
    }

    @Override
    public <Q, R> List<ProviderDescriptor<Q, R>> listFor(Capability<Q, R> capability) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        List<ProviderDescriptor<?, ?>> chain = new ArrayList<>();
        for (ProviderDescriptor<?, ?> descriptor : descriptors) {
            if (descriptor.capability().equals(capability)) {
                chain.add(descriptor);
            }
        }
        // List.sort는 안정 정렬: 같은 rank는 등록 순서 유지
        chain.sort(BY_RANK);

        List<ProviderDescriptor<Q, R>> typed = new ArrayList<>(chain.size());
        for (ProviderDescriptor<?, ?> descriptor : chain) {
            typed.add(narrow(descriptor));
        }
        return Collections.unmodifiableList(typed);
    }

    @Override
    public ProviderDescriptor<?, ?> get(ProviderName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        for (ProviderDescriptor<?, ?> descriptor : descriptors) {
            if (descriptor.name().equals(name)) {
                return descriptor;
            }
        }
        throw new ProviderNotFoundException(name);
    }

    @Override
    public <Q, R> Optional<ProviderDescriptor<Q, R>> find(Capability<Q, R> capability, ProviderName name) {
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        for (ProviderDescriptor<?, ?> descriptor : descriptors) {
            if (descriptor.capability().equals(capability) && descriptor.name().equals(name)) {
                return Optional.of(narrow(descriptor));
            }
        }
        return Optional.empty();
    }

    @Override
    public CircuitBreaker circuitBreaker(ProviderName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new ProviderNotFoundException(name);
        }
        return breaker;
    }

    @Override
    public RetryConfig retryConfigFor(ProviderDescriptor<?, ?> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        return descriptor.retryOverride()
            .orElseGet(() -> settings.settingsFor(descriptor.capability()).retry());
    }

    @Override
    public List<ProviderDescriptor<?, ?>> descriptors() {
        return List.copyOf(descriptors);
    }

    @Override
    public Set<Capability<?, ?>> capabilities() {
        Set<Capability<?, ?>> capabilities = new LinkedHashSet<>();
        for (ProviderDescriptor<?, ?> descriptor : descriptors) {
            capabilities.add(descriptor.capability());
        }
        return Collections.unmodifiableSet(capabilities);
    }

    /**
     * Registry 설정 조회.
     *
     * @return Relay 설정
     */
    public RelaySettings getSettings() {
        return settings;
    }

    // capability 일치를 확인한 Descriptor만 전달됨
    private static <Q, R> ProviderDescriptor<Q, R> narrow(ProviderDescriptor<?, ?> descriptor) {
        return (ProviderDescriptor<Q, R>) descriptor;
    }
}
