package com.questrail.push.protocol.apns.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * TLS client identity used for both the gateway and the feedback service.
 *
 * <p>The certificate chain and private key are PEM files. {@code keyPassword}
 * is {@code null} for an unencrypted key. {@code trustedCertificates} is
 * {@code null} to trust the JVM's default roots.</p>
 *
 * <p>Files are only referenced here; they are read once when the client is
 * built, and any problem surfaces as an {@link ApnsConfigurationException}.</p>
 */
public record ApnsCredentials(
        Path certificateChain,
        Path privateKey,
        String keyPassword,
        Path trustedCertificates
) {
    public ApnsCredentials {
        Objects.requireNonNull(certificateChain, "certificateChain");
        Objects.requireNonNull(privateKey, "privateKey");
    }

    public static ApnsCredentials of(Path certificateChain, Path privateKey) {
        return new ApnsCredentials(certificateChain, privateKey, null, null);
    }

    @Override
    public String toString() {
        return "ApnsCredentials[certificateChain=" + certificateChain
                + ", privateKey=" + privateKey
                + ", keyPassword=" + (keyPassword == null ? "none" : "****")
                + ", trustedCertificates=" + trustedCertificates + "]";
    }
}
