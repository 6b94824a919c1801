package com.questrail.axisticks.config;

/**
 * Indicates an inconsistent formatter/locator configuration, such as more than
 * one of values, number and spacing supplied at the same time.
 */
public final class TickConfigurationException extends RuntimeException
{
    public TickConfigurationException(String message) {
        super(message);
    }
}
