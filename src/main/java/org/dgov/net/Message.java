package org.dgov.net;

/**
 * Wire form of a cross-chain message. The kind tag and routing metadata sit
 * next to the body, which travels as a JSON string so it is only interpreted
 * after the tag has been read.
 */
public class Message {
    private final MessageType type;
    private final String messageId;
    private final String sourceChain;
    private final String destinationChain;
    private final String sender;
    private final String receiver;
    private final long sequence;
    private final String payload;
    private final String senderPublicKey; // Base64
    private final String signature; // Base64, over messageId

    public Message(MessageType type, String messageId, String sourceChain, String destinationChain,
                   String sender, String receiver, long sequence, String payload,
                   String senderPublicKey, String signature) {
        this.type = type;
        this.messageId = messageId;
        this.sourceChain = sourceChain;
        this.destinationChain = destinationChain;
        this.sender = sender;
        this.receiver = receiver;
        this.sequence = sequence;
        this.payload = payload;
        this.senderPublicKey = senderPublicKey;
        this.signature = signature;
    }

    /**
     * Canonical text the message id is derived from. Covers every field except
     * the id and the signature themselves.
     */
    public static String toHashString(MessageType type, String sourceChain, String destinationChain, String sender,
                                      String receiver, long sequence, String payload, String senderPublicKey) {
        return type + "|" + sourceChain + "|" + destinationChain + "|" + sender + "|" + receiver + "|"
                + sequence + "|" + payload + "|" + senderPublicKey;
    }

    public String toHashString() {
        return toHashString(type, sourceChain, destinationChain, sender, receiver, sequence, payload, senderPublicKey);
    }

    public MessageType getType() {
        return type;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getSourceChain() {
        return sourceChain;
    }

    public String getDestinationChain() {
        return destinationChain;
    }

    public String getSender() {
        return sender;
    }

    public String getReceiver() {
        return receiver;
    }

    public long getSequence() {
        return sequence;
    }

    public String getPayload() {
        return payload;
    }

    public String getSenderPublicKey() {
        return senderPublicKey;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", messageId='" + messageId + '\'' +
                ", sourceChain='" + sourceChain + '\'' +
                ", destinationChain='" + destinationChain + '\'' +
                ", sequence=" + sequence +
                '}';
    }
}
