package me.golemcore.linkbay.adapter.outbound.llm;

import me.golemcore.linkbay.domain.model.AiResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.domain.model.ProviderType;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalProviderTest {

    private final LocalProvider provider = new LocalProvider(ProviderConfig.builder()
            .providerType(ProviderType.LOCAL)
            .priority(100)
            .build());

    @Test
    void chat_returnsNoticeWithoutTokens() throws Exception {
        AiResponse response = provider.chat(List.of(Message.user("Hi")), GenerationParams.defaults()).get();

        assertEquals(LocalProvider.NOTICE, response.getContent());
        assertEquals(0, response.getTokensUsed());
        assertEquals("local", response.getProvider());
        assertEquals("local", response.getModel());
    }

    @Test
    void stream_emitsNotice() {
        StepVerifier.create(provider.stream(List.of(Message.user("Hi")), GenerationParams.defaults()))
                .expectNext(LocalProvider.NOTICE)
                .verifyComplete();
    }

    @Test
    void getStats_countsRequests() throws Exception {
        provider.chat(List.of(Message.user("one")), null).get();
        provider.chat(List.of(Message.user("two")), null).get();

        assertTrue(provider.isAvailable());
        assertEquals(2, provider.getStats().getRequestCount());
        assertEquals(0, provider.getStats().getErrorCount());
        assertEquals(100, provider.getStats().getPriority());
    }
}
