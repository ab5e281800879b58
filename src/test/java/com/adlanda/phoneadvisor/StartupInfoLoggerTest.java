package com.adlanda.phoneadvisor;

import com.adlanda.phoneadvisor.generation.AnswerRenderer;
import com.adlanda.phoneadvisor.generation.GenerationStrategy;
import com.adlanda.phoneadvisor.generation.PromptContextBuilder;
import com.adlanda.phoneadvisor.generation.TemplateAnswerRenderer;
import com.adlanda.phoneadvisor.repository.InMemoryPhoneCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StartupInfoLoggerTest {

    @Test
    void answerChain_listsModelsBeforeTemplates() {
        GenerationStrategy primary = mock(GenerationStrategy.class);
        GenerationStrategy secondary = mock(GenerationStrategy.class);
        when(primary.name()).thenReturn("primary:gpt-4o-mini");
        when(secondary.name()).thenReturn("secondary:gpt-3.5-turbo");

        assertThat(StartupInfoLogger.answerChain(List.of(primary, secondary)))
                .isEqualTo("primary:gpt-4o-mini -> secondary:gpt-3.5-turbo -> templates");
    }

    @Test
    void answerChain_withoutModels_isTemplatesOnly() {
        assertThat(StartupInfoLogger.answerChain(List.of())).isEqualTo("templates");
    }

    @Test
    void run_emptyCatalog_doesNotFail() {
        StartupInfoLogger logger = new StartupInfoLogger(new InMemoryPhoneCatalog(List.of()),
                new AnswerRenderer(List.of(), new PromptContextBuilder(5), new TemplateAnswerRenderer()));

        assertThatCode(() -> logger.run(null)).doesNotThrowAnyException();
    }
}
