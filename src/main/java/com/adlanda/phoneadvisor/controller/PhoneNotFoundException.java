package com.adlanda.phoneadvisor.controller;

/**
 * Thrown when a phone lookup by name finds nothing.
 */
public class PhoneNotFoundException extends RuntimeException {

    public PhoneNotFoundException(String modelName) {
        super("Phone '" + modelName + "' not found");
    }
}
