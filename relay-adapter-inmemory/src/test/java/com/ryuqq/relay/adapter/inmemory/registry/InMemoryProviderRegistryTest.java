package com.ryuqq.relay.adapter.inmemory.registry;

import com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreaker;
import com.ryuqq.relay.core.config.CapabilitySettings;
import com.ryuqq.relay.core.config.RelaySettings;
import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.exception.DuplicateProviderException;
import com.ryuqq.relay.core.exception.ProviderNotFoundException;
import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.registry.ProviderDescriptor;
import com.ryuqq.relay.core.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryProviderRegistry 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class InMemoryProviderRegistryTest {

    private static final Capability<String, String> QUICK = Capability.of("llm.quick");
    private static final Capability<String, String> DEEP = Capability.of("llm.deep-think");

    private InMemoryProviderRegistry registry;

    @BeforeEach
    void setUp() {
        RelaySettings settings = new RelaySettings()
            .withCapability("llm.quick", new CapabilitySettings()
                .withRetry(new RetryConfig().withMaxAttempts(2))
                .withBreaker(new CircuitBreakerConfig().withFailureThreshold(2)));
        registry = new InMemoryProviderRegistry(settings);
    }

    // ============================================================
    // 1. 체인 순서
    // ============================================================

    @Test
    void listFor_rank_오름차순_동률은_등록_순서() {
        // given
        registry.register(descriptor(QUICK, "glm", 2));
        registry.register(descriptor(QUICK, "kimi", 1));
        registry.register(descriptor(QUICK, "deepseek", 0));
        registry.register(descriptor(QUICK, "qwen", 1));
        registry.register(descriptor(DEEP, "claude", 0));

        // when
        List<ProviderDescriptor<String, String>> chain = registry.listFor(QUICK);

        // then
        assertThat(chain).extracting(d -> d.name().getValue())
            .containsExactly("deepseek", "kimi", "qwen", "glm");
    }

    @Test
    void listFor_등록되지_않은_Capability는_빈_목록() {
        assertThat(registry.listFor(Capability.<String, String>of("data.equity-quote"))).isEmpty();
    }

    // ============================================================
    // 2. 중복 / 조회
    // ============================================================

    @Test
    void register_같은_Capability에_같은_이름이면_DuplicateProviderException() {
        // given
        registry.register(descriptor(QUICK, "deepseek", 0));

        // when & then
        assertThatThrownBy(() -> registry.register(descriptor(QUICK, "deepseek", 5)))
            .isInstanceOf(DuplicateProviderException.class)
            .isInstanceOf(ConfigurationException.class);
        assertThat(registry.listFor(QUICK)).hasSize(1);
    }

    @Test
    void get_없는_이름이면_ProviderNotFoundException() {
        assertThatThrownBy(() -> registry.get(ProviderName.of("missing")))
            .isInstanceOf(ProviderNotFoundException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> registry.circuitBreaker(ProviderName.of("missing")))
            .isInstanceOf(ProviderNotFoundException.class);
    }

    @Test
    void get_여러_Capability에_등록된_이름이면_첫_등록을_반환하고_find는_정확히_조회() {
        // given
        ProviderDescriptor<String, String> quick = descriptor(QUICK, "deepseek", 0);
        ProviderDescriptor<String, String> deep = descriptor(DEEP, "deepseek", 3);
        registry.register(quick);
        registry.register(deep);

        // then
        assertThat(registry.get(ProviderName.of("deepseek"))).isSameAs(quick);
        assertThat(registry.find(DEEP, ProviderName.of("deepseek"))).containsSame(deep);
        assertThat(registry.find(DEEP, ProviderName.of("kimi"))).isEmpty();
    }

    @Test
    void listFor_와_find는_Capability의_요청_응답_타입으로_호출_가능() throws Exception {
        // given
        Capability<Integer, String> quote = Capability.of("data.equity-quote");
        registry.register(ProviderDescriptor.of(quote, ProviderName.of("krx"), 0, code -> "quote-" + code));
        registry.register(descriptor(QUICK, "krx", 0));

        // when
        List<ProviderDescriptor<Integer, String>> chain = registry.listFor(quote);
        ProviderDescriptor<Integer, String> found = registry.find(quote, ProviderName.of("krx")).orElseThrow();

        // then
        assertThat(chain).hasSize(1);
        assertThat(chain.get(0).function().call(5930)).isEqualTo("quote-5930");
        assertThat(found).isSameAs(chain.get(0));
        assertThat(registry.listFor(QUICK)).extracting(ProviderDescriptor::capability).containsOnly(QUICK);
    }

    // ============================================================
    // 3. Circuit Breaker 소유
    // ============================================================

    @Test
    void circuitBreaker_같은_이름은_Capability가_달라도_공유() {
        // given
        registry.register(descriptor(QUICK, "deepseek", 0));
        registry.register(descriptor(DEEP, "deepseek", 0));

        // when
        CircuitBreaker breaker = registry.circuitBreaker(ProviderName.of("deepseek"));

        // then
        assertThat(breaker).isSameAs(registry.circuitBreaker(ProviderName.of("deepseek")));
        assertThat(breaker.providerName()).isEqualTo(ProviderName.of("deepseek"));
    }

    @Test
    void circuitBreaker_설정은_첫_등록_Capability에서_가져옴() {
        // given
        registry.register(descriptor(QUICK, "deepseek", 0));
        registry.register(descriptor(DEEP, "claude", 0));

        // then
        InMemoryCircuitBreaker quickBreaker = (InMemoryCircuitBreaker) registry.circuitBreaker(ProviderName.of("deepseek"));
        InMemoryCircuitBreaker deepBreaker = (InMemoryCircuitBreaker) registry.circuitBreaker(ProviderName.of("claude"));
        assertThat(quickBreaker.getConfig().failureThreshold()).isEqualTo(2);
        assertThat(deepBreaker.getConfig().failureThreshold()).isEqualTo(5);
    }

    @Test
    void register_팩토리를_Provider_이름당_한_번만_호출() {
        // given
        int[] created = {0};
        InMemoryProviderRegistry counting = new InMemoryProviderRegistry(new RelaySettings(), (name, config) -> {
            created[0]++;
            return new InMemoryCircuitBreaker(name, config);
        });

        // when
        counting.register(descriptor(QUICK, "deepseek", 0));
        counting.register(descriptor(DEEP, "deepseek", 0));
        counting.register(descriptor(DEEP, "kimi", 1));

        // then
        assertThat(created[0]).isEqualTo(2);
    }

    // ============================================================
    // 4. 재시도 설정 / 목록
    // ============================================================

    @Test
    void retryConfigFor_Provider_override가_Capability_설정보다_우선() {
        // given
        ProviderDescriptor<String, String> plain = descriptor(QUICK, "deepseek", 0);
        ProviderDescriptor<String, String> overridden = descriptor(QUICK, "kimi", 1)
            .withRetryConfig(RetryConfig.noRetry());
        ProviderDescriptor<String, String> other = descriptor(DEEP, "claude", 0);

        // then
        assertThat(registry.retryConfigFor(plain).maxAttempts()).isEqualTo(2);
        assertThat(registry.retryConfigFor(overridden).maxAttempts()).isEqualTo(1);
        assertThat(registry.retryConfigFor(other)).isEqualTo(new RetryConfig());
    }

    @Test
    void descriptors_와_capabilities는_등록_순서() {
        // given
        registry.register(descriptor(DEEP, "claude", 0));
        registry.register(descriptor(QUICK, "deepseek", 0));
        registry.register(descriptor(DEEP, "kimi", 1));

        // then
        assertThat(registry.descriptors()).extracting(d -> d.name().getValue())
            .containsExactly("claude", "deepseek", "kimi");
        assertThat(registry.capabilities()).containsExactly(DEEP, QUICK);
    }

    private static ProviderDescriptor<String, String> descriptor(Capability<String, String> capability, String name, int rank) {
        return ProviderDescriptor.of(capability, ProviderName.of(name), rank, prompt -> name + ": " + prompt);
    }
}
