package org.dgov.net;

/**
 * A decoded, signature-checked message together with its typed body.
 */
public class Envelope {
    private final Message message;
    private final CrossChainPayload body;

    public Envelope(Message message, CrossChainPayload body) {
        this.message = message;
        this.body = body;
    }

    public MessageType getType() {
        return message.getType();
    }

    public Message getMessage() {
        return message;
    }

    public CrossChainPayload getBody() {
        return body;
    }

    public <T extends CrossChainPayload> T bodyAs(Class<T> type) {
        return type.cast(body);
    }

    public String getMessageId() {
        return message.getMessageId();
    }

    public String getSourceChain() {
        return message.getSourceChain();
    }

    public String getDestinationChain() {
        return message.getDestinationChain();
    }

    public String getSender() {
        return message.getSender();
    }

    @Override
    public String toString() {
        return "Envelope{" + message + ", body=" + body + '}';
    }
}
