package com.beacon.notification.common.model;

/**
 * Raised when a stored or received channel value names no supported channel.
 */
public class UnsupportedChannelException extends RuntimeException {

    public UnsupportedChannelException(String channel) {
        super("Unsupported channel type: " + channel);
    }
}
