package com.playbackadvisor.api;

/**
 * Thrown when a request names a device id that has never been registered.
 */
public class UnknownClientException extends RuntimeException {

    public UnknownClientException(String deviceId) {
        super("unknown device_id: " + deviceId);
    }
}
