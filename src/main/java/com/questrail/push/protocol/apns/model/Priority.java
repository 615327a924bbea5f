package com.questrail.push.protocol.apns.model;

/**
 * Delivery priority carried in the priority item of a notification frame.
 */
public enum Priority
{
    /** Deliver immediately. */
    IMMEDIATE(10),

    /** Deliver at a time that conserves power on the device. */
    CONSERVE_POWER(5);

    private final int wireValue;

    Priority(int wireValue)
    {
        this.wireValue = wireValue;
    }

    public int wireValue()
    {
        return wireValue;
    }
}
