package com.questrail.push.protocol.apns.transport;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;

/**
 * Creates a fresh, unconnected {@link StreamEndpoint} per connection attempt.
 */
@FunctionalInterface
public interface StreamEndpointFactory
{
    StreamEndpoint create(ApnsEndpoint remote);
}
