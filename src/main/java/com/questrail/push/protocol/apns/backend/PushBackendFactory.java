package com.questrail.push.protocol.apns.backend;

/**
 * Creates the backend for a client. {@code ThreadedPushBackend::new} is the
 * default.
 */
@FunctionalInterface
public interface PushBackendFactory
{
    PushBackend create(BackendContext context);
}
