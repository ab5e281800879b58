package com.adlanda.phoneadvisor.model;

/**
 * One attribute whose text differs between the two compared records.
 */
public record AttributeDifference(PhoneAttribute attribute, String valueA, String valueB) {}
