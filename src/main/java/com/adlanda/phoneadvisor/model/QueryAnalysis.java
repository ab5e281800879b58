package com.adlanda.phoneadvisor.model;

/**
 * Result of classifying a question: its intent and extracted criteria.
 */
public record QueryAnalysis(Intent intent, CriteriaSet criteria) {}
