package com.adlanda.phoneadvisor.model;

/**
 * A record with its recommendation score.
 */
public record ScoredCandidate(PhoneRecord record, double score) {}
