/**
 * Default implementations of the APNs codec boundary.
 *
 * <p>{@code ApnsWireFormat} holds the constants of the binary interface and is
 * package-private: no code outside the codec should need to know an item id or
 * a frame offset.</p>
 */
package com.questrail.push.protocol.apns.codec.impl;
