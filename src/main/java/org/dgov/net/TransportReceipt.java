package org.dgov.net;

/**
 * Acknowledgement that the transport accepted a payload. It says nothing
 * about delivery or about the remote chain's verdict.
 */
public class TransportReceipt {
    private final String destinationChain;
    private final String receiverAddress;
    private final int size;
    private final long acceptedAtMillis;

    public TransportReceipt(String destinationChain, String receiverAddress, int size, long acceptedAtMillis) {
        this.destinationChain = destinationChain;
        this.receiverAddress = receiverAddress;
        this.size = size;
        this.acceptedAtMillis = acceptedAtMillis;
    }

    public String getDestinationChain() {
        return destinationChain;
    }

    public String getReceiverAddress() {
        return receiverAddress;
    }

    public int getSize() {
        return size;
    }

    public long getAcceptedAtMillis() {
        return acceptedAtMillis;
    }

    @Override
    public String toString() {
        return "TransportReceipt{" +
                "destinationChain='" + destinationChain + '\'' +
                ", receiverAddress='" + receiverAddress + '\'' +
                ", size=" + size +
                '}';
    }
}
