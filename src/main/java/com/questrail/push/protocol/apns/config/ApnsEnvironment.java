package com.questrail.push.protocol.apns.config;

/**
 * The two service environments operated by the vendor.
 *
 * <p>Device tokens are environment-specific: a token issued to a development
 * build is rejected by the production gateway and vice versa.</p>
 */
public enum ApnsEnvironment
{
    PRODUCTION(new ApnsEndpoint("gateway.push.apple.com", 2195),
               new ApnsEndpoint("feedback.push.apple.com", 2196)),
    SANDBOX(new ApnsEndpoint("gateway.sandbox.push.apple.com", 2195),
            new ApnsEndpoint("feedback.sandbox.push.apple.com", 2196));

    private final ApnsEndpoint gateway;
    private final ApnsEndpoint feedback;

    ApnsEnvironment(ApnsEndpoint gateway, ApnsEndpoint feedback)
    {
        this.gateway = gateway;
        this.feedback = feedback;
    }

    public ApnsEndpoint gateway()
    {
        return gateway;
    }

    public ApnsEndpoint feedback()
    {
        return feedback;
    }
}
