package com.adlanda.phoneadvisor.config;

import com.adlanda.phoneadvisor.generation.AnswerRenderer;
import com.adlanda.phoneadvisor.generation.GenerationStrategy;
import com.adlanda.phoneadvisor.generation.TemplateAnswerRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationConfigTest {

    @Mock
    private ChatModel chatModel;

    @Mock
    private ObjectProvider<ChatModel> chatModelProvider;

    private final GenerationConfig config = new GenerationConfig();
    private AdvisorProperties properties;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new AdvisorProperties();
        executor = config.generationExecutor(properties);
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void answerRenderer_registersPrimaryThenSecondaryModel() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);

        AnswerRenderer renderer = render();

        assertThat(renderer.strategies()).extracting(GenerationStrategy::name)
                .containsExactly("primary:gpt-4o-mini", "secondary:gpt-3.5-turbo");
    }

    @Test
    void answerRenderer_blankSecondaryModel_registersOnlyPrimary() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        properties.getGeneration().setSecondaryModel("");

        assertThat(render().strategies()).extracting(GenerationStrategy::name)
                .containsExactly("primary:gpt-4o-mini");
    }

    @Test
    void answerRenderer_generationDisabled_usesTemplatesOnly() {
        properties.getGeneration().setEnabled(false);

        assertThat(render().strategies()).isEmpty();
    }

    @Test
    void answerRenderer_noChatModel_usesTemplatesOnly() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);

        assertThat(render().strategies()).isEmpty();
    }

    @Test
    void answerRenderer_placeholderApiKey_usesTemplatesOnly() {
        assertThat(render(GenerationConfig.UNCONFIGURED_API_KEY).strategies()).isEmpty();
        verifyNoInteractions(chatModelProvider);
    }

    @Test
    void answerRenderer_blankApiKey_usesTemplatesOnly() {
        assertThat(render("").strategies()).isEmpty();
        assertThat(render(null).strategies()).isEmpty();
        verifyNoInteractions(chatModelProvider);
    }

    @Test
    void generationExecutor_isBoundedByProperties() {
        AdvisorProperties custom = new AdvisorProperties();
        custom.getGeneration().setMaxConcurrentCalls(2);
        custom.getGeneration().setQueueCapacity(3);
        ThreadPoolTaskExecutor bounded = config.generationExecutor(custom);
        bounded.initialize();
        try {
            assertThat(bounded.getCorePoolSize()).isEqualTo(2);
            assertThat(bounded.getMaxPoolSize()).isEqualTo(2);
            assertThat(bounded.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(3);
            assertThat(bounded.getThreadNamePrefix()).isEqualTo("generation-");
        } finally {
            bounded.shutdown();
        }
    }

    private AnswerRenderer render() {
        return render("test-key");
    }

    private AnswerRenderer render(String apiKey) {
        return config.answerRenderer(properties, chatModelProvider, apiKey, executor, new TemplateAnswerRenderer());
    }
}
