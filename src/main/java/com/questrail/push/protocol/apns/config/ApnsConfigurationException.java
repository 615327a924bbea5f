package com.questrail.push.protocol.apns.config;

/**
 * Indicates configuration that cannot be used to reach the service, such as
 * unreadable or mismatched TLS credentials.
 *
 * <p>Raised while the client is being built, never from a running client.</p>
 */
public final class ApnsConfigurationException extends RuntimeException
{
    public ApnsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
