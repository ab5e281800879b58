package com.adlanda.phoneadvisor.model;

/**
 * A catalog model name matched against a question.
 *
 * @param modelName  Catalog model name
 * @param confidence Match strength; 100 is a verbatim full-name hit
 */
public record MatchCandidate(String modelName, int confidence) {}
