package com.ryuqq.relay.core.registry;

import com.ryuqq.relay.core.exception.DuplicateProviderException;
import com.ryuqq.relay.core.exception.ProviderNotFoundException;
import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.retry.RetryConfig;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Provider catalog SPI.
 *
 * <p>Holds every registered {@link ProviderDescriptor} grouped by capability and owns
 * exactly one {@link CircuitBreaker} per provider name.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registration with duplicate detection (same capability and provider name)</li>
 *   <li>Ordered fallback chains per capability (ascending rank, ties by registration order)</li>
 *   <li>Circuit breaker ownership: created on the first registration of a provider name, never destroyed</li>
 *   <li>Effective retry configuration resolution (provider override, then capability settings)</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * 1. Integration code registers descriptors at startup
 * 2. FallbackInvoker reads chains via listFor() on every invocation
 * 3. HealthAggregator reads descriptors() and circuitBreaker() on every poll
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reads may run concurrently with late registrations</li>
 *   <li>Returned lists are immutable snapshots</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface ProviderRegistry {

    /**
     * Registers a provider for its capability.
     *
     * <p>If the provider name is new, a circuit breaker is created for it using the breaker
     * settings of the descriptor's capability. A provider name already known from another
     * capability keeps its existing breaker.</p>
     *
     * @param descriptor the provider descriptor
     * @throws IllegalArgumentException if descriptor is null
     * @throws DuplicateProviderException if the same name is already registered for the capability
     */
    void register(ProviderDescriptor<?, ?> descriptor);

    /**
     * Returns the fallback chain of a capability.
     *
     * @param capability the capability
     * @return descriptors in ascending rank, ties in registration order (empty if none)
     * @throws IllegalArgumentException if capability is null
     */
    <Q, R> List<ProviderDescriptor<Q, R>> listFor(Capability<Q, R> capability);

    /**
     * Looks up a provider by name.
     *
     * <p>When the name is registered under several capabilities, the first registered
     * descriptor is returned. Use {@link #find(Capability, ProviderName)} for an exact lookup.</p>
     *
     * @param name the provider name
     * @return the first registered descriptor with that name
     * @throws ProviderNotFoundException if no provider with that name is registered
     */
    ProviderDescriptor<?, ?> get(ProviderName name);

    /**
     * Looks up a provider of a specific capability.
     *
     * @param capability the capability
     * @param name the provider name
     * @return the descriptor, or empty if not registered for that capability
     */
    <Q, R> Optional<ProviderDescriptor<Q, R>> find(Capability<Q, R> capability, ProviderName name);

    /**
     * Returns the circuit breaker owned for a provider name.
     *
     * @param name the provider name
     * @return the breaker shared by every capability the provider serves
     * @throws ProviderNotFoundException if no provider with that name is registered
     */
    CircuitBreaker circuitBreaker(ProviderName name);

    /**
     * Resolves the effective retry configuration for a descriptor.
     *
     * @param descriptor the provider descriptor
     * @return the descriptor's override if present, otherwise the capability's retry settings
     */
    RetryConfig retryConfigFor(ProviderDescriptor<?, ?> descriptor);

    /**
     * Returns every registered descriptor.
     *
     * @return descriptors in registration order
     */
    List<ProviderDescriptor<?, ?>> descriptors();

    /**
     * Returns every capability that has at least one registered provider.
     *
     * @return capabilities in first-registration order
     */
    Set<Capability<?, ?>> capabilities();
}
