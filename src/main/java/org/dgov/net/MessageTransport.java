package org.dgov.net;

/**
 * The messaging substrate between chains: at-least-once, unordered, no
 * deduplication. Retries, if any, are the transport's business.
 */
public interface MessageTransport {

    /**
     * Hands a payload to the transport for delivery to {@code destinationChain}.
     *
     * @throws TransportException if the transport did not accept the payload
     */
    TransportReceipt send(String destinationChain, String receiverAddress, byte[] payload) throws TransportException;

    void registerHandler(MessageHandler handler);
}
