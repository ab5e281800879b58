package com.adlanda.phoneadvisor.generation;

/**
 * One way of turning a prompt into an answer. Strategies are tried in order until one
 * succeeds.
 *
 * Implementations report every failure as a {@link GenerationOutcome} and never throw.
 */
public interface GenerationStrategy {

    /**
     * Short identifier used in logs.
     */
    String name();

    GenerationOutcome generate(String prompt);
}
