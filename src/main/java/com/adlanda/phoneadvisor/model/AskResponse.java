package com.adlanda.phoneadvisor.model;

/**
 * Response from the ask endpoint.
 */
public record AskResponse(String answer) {}
