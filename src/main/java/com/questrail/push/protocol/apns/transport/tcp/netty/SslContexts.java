package com.questrail.push.protocol.apns.transport.tcp.netty;

import com.questrail.push.protocol.apns.config.ApnsConfigurationException;
import com.questrail.push.protocol.apns.config.ApnsCredentials;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;

/**
 * Builds the client TLS context from {@link ApnsCredentials}.
 *
 * <p>The context is immutable once built and is shared by every gateway and
 * feedback connection of a client.</p>
 */
public final class SslContexts
{
    private SslContexts() {}

    /**
     * @return a client context, or {@code null} when {@code credentials} is
     *         {@code null} (plaintext)
     * @throws ApnsConfigurationException if the key material cannot be loaded
     */
    public static SslContext forClient(ApnsCredentials credentials)
    {
        if (credentials == null) {
            return null;
        }

        try {
            SslContextBuilder builder = SslContextBuilder.forClient()
                    .keyManager(credentials.certificateChain().toFile(),
                                credentials.privateKey().toFile(),
                                credentials.keyPassword());

            if (credentials.trustedCertificates() != null) {
                builder.trustManager(credentials.trustedCertificates().toFile());
            }
            return builder.build();
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new ApnsConfigurationException("unusable TLS credentials: " + credentials, e);
        }
    }
}
