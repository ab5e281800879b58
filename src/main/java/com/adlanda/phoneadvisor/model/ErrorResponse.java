package com.adlanda.phoneadvisor.model;

/**
 * Error body returned by the REST surface.
 */
public record ErrorResponse(int status, String error, String message) {}
