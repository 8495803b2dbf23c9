package me.golemcore.linkbay.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.domain.model.ProviderType;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class ProviderFactoryTest {

    private final ProviderFactory factory = new ProviderFactory(new ObjectMapper(),
            BackoffScheduler.DELAYED_EXECUTOR, OrchestrationEventPort.NOOP);

    @Test
    void create_localProvider() {
        LlmProvider provider = factory.create(ProviderConfig.builder().providerType(ProviderType.LOCAL).build());

        assertInstanceOf(LocalProvider.class, provider);
        assertEquals("local", provider.getName());
    }

    @Test
    void create_deepseekUsesOpenAiCompatibleBackend() {
        LlmProvider provider = factory.create(ProviderConfig.builder()
                .name("primary")
                .providerType(ProviderType.DEEPSEEK)
                .apiKey("sk-test")
                .build());

        assertInstanceOf(ResilientProvider.class, provider);
        assertInstanceOf(OpenAiCompatibleBackend.class, ReflectionTestUtils.getField(provider, "backend"));
        assertEquals("primary", provider.getName());
        assertEquals("deepseek-chat", provider.getDefaultModel());
        assertTrue(provider.isAvailable());
    }

    @Test
    void create_anthropicUsesAnthropicBackend() {
        LlmProvider provider = factory.create(ProviderConfig.builder()
                .providerType(ProviderType.ANTHROPIC)
                .build());

        assertInstanceOf(AnthropicBackend.class, ReflectionTestUtils.getField(provider, "backend"));
        assertFalse(provider.isAvailable());
    }

    @Test
    void create_rejectsMissingType() {
        ProviderConfig config = ProviderConfig.builder().name("nameless").build();

        assertThrows(IllegalArgumentException.class, () -> factory.create(config));
    }
}
