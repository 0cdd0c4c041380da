package org.dgov.support;

import org.dgov.net.MessageHandler;
import org.dgov.net.MessageTransport;
import org.dgov.net.TransportException;
import org.dgov.net.TransportReceipt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for the cross-chain transport. Sent payloads are held
 * until the test delivers them, so delivery can be delayed, reordered or
 * repeated at will.
 */
public class LoopbackNetwork {

    private final Map<String, List<MessageHandler>> handlers = new ConcurrentHashMap<>();
    private final List<Delivery> inFlight = new CopyOnWriteArrayList<>();
    private volatile boolean down = false;

    public MessageTransport endpoint(String chainId) {
        return new MessageTransport() {
            @Override
            public TransportReceipt send(String destinationChain, String receiverAddress, byte[] payload)
                    throws TransportException {
                if (down) {
                    throw new TransportException("network is down");
                }
                inFlight.add(new Delivery(chainId, destinationChain, payload));
                return new TransportReceipt(destinationChain, receiverAddress, payload.length, System.currentTimeMillis());
            }

            @Override
            public void registerHandler(MessageHandler handler) {
                handlers.computeIfAbsent(chainId, k -> new CopyOnWriteArrayList<>()).add(handler);
            }
        };
    }

    public void setDown(boolean down) {
        this.down = down;
    }

    /**
     * Messages sent but not yet delivered, oldest first.
     */
    public List<Delivery> inFlight() {
        return new ArrayList<>(inFlight);
    }

    public void deliver(Delivery delivery) {
        for (MessageHandler handler : handlers.getOrDefault(delivery.destinationChain, List.of())) {
            handler.onMessage(delivery.payload.clone());
        }
    }

    /**
     * Delivers everything in flight in send order and empties the queue.
     */
    public List<Delivery> deliverAll() {
        List<Delivery> batch = inFlight();
        inFlight.removeAll(batch);
        for (Delivery delivery : batch) {
            deliver(delivery);
        }
        return batch;
    }

    public static final class Delivery {
        private final String sourceChain;
        private final String destinationChain;
        private final byte[] payload;

        Delivery(String sourceChain, String destinationChain, byte[] payload) {
            this.sourceChain = sourceChain;
            this.destinationChain = destinationChain;
            this.payload = payload.clone();
        }

        public String getSourceChain() {
            return sourceChain;
        }

        public String getDestinationChain() {
            return destinationChain;
        }

        public byte[] getPayload() {
            return payload.clone();
        }
    }
}
