package org.dgov.net;

/**
 * Receives raw payloads from a {@link MessageTransport}. Delivery may repeat
 * and may arrive in any order.
 */
public interface MessageHandler {
    void onMessage(byte[] payload);
}
