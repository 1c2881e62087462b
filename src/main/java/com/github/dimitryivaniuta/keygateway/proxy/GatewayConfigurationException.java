package com.github.dimitryivaniuta.keygateway.proxy;

/**
 * Raised while the application context starts when the gateway cannot be configured
 * (no API keys, missing or malformed target URL). The process never starts serving.
 */
public class GatewayConfigurationException extends RuntimeException {

    public GatewayConfigurationException(String message) {
        super(message);
    }

    public GatewayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
