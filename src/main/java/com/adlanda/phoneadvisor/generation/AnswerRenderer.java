package com.adlanda.phoneadvisor.generation;

import com.adlanda.phoneadvisor.model.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a retrieval result into answer text.
 *
 * Generation strategies are tried in order; the first success wins. When there are no
 * strategies or all of them fail, the answer is rendered from templates, so rendering
 * always returns text.
 */
public class AnswerRenderer {

    private static final Logger log = LoggerFactory.getLogger(AnswerRenderer.class);

    private final List<GenerationStrategy> strategies;
    private final PromptContextBuilder promptBuilder;
    private final TemplateAnswerRenderer templates;

    public AnswerRenderer(List<GenerationStrategy> strategies,
                          PromptContextBuilder promptBuilder,
                          TemplateAnswerRenderer templates) {
        this.strategies = List.copyOf(strategies);
        this.promptBuilder = promptBuilder;
        this.templates = templates;
    }

    public String render(RetrievalResult result) {
        if (!result.hasRecords()) {
            return templates.noPhonesFound();
        }

        if (!strategies.isEmpty()) {
            String prompt = promptBuilder.build(result);
            for (GenerationStrategy strategy : strategies) {
                GenerationOutcome outcome = strategy.generate(prompt);
                if (outcome.isSuccess()) {
                    return outcome.text();
                }
                log.warn("Generation via {} failed ({}): {}",
                        strategy.name(), outcome.failureReason(), outcome.detail());
            }
            log.info("All {} generation strategies failed, using template answer", strategies.size());
        }

        return templates.render(result);
    }

    public List<GenerationStrategy> strategies() {
        return strategies;
    }
}
