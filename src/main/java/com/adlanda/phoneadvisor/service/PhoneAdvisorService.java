package com.adlanda.phoneadvisor.service;

import com.adlanda.phoneadvisor.generation.AnswerRenderer;
import com.adlanda.phoneadvisor.model.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers a natural-language question about the phone catalog.
 *
 * Holds no per-question state, so one instance serves concurrent requests.
 */
@Service
public class PhoneAdvisorService {

    private static final Logger log = LoggerFactory.getLogger(PhoneAdvisorService.class);

    private final RetrievalOrchestrator orchestrator;
    private final AnswerRenderer answerRenderer;

    public PhoneAdvisorService(RetrievalOrchestrator orchestrator, AnswerRenderer answerRenderer) {
        this.orchestrator = orchestrator;
        this.answerRenderer = answerRenderer;
    }

    /**
     * Answers the question. Always returns text for a non-blank question.
     *
     * @param question The user's question
     * @return Answer text
     * @throws IllegalArgumentException If the question is null or blank
     */
    public String answer(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        long startTime = System.currentTimeMillis();

        RetrievalResult result = orchestrator.retrieve(question.trim());
        String answer = answerRenderer.render(result);

        log.debug("Answered {} question with {} records in {}ms",
                result.intent().label(), result.records().size(), System.currentTimeMillis() - startTime);
        return answer;
    }
}
