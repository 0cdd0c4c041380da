package org.dgov.net;

import com.google.gson.JsonParseException;
import org.dgov.bc.SignatureUtil;
import org.dgov.chain.Wallet;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.util.ConversionUtil;

import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Base64;
import java.util.Objects;

/**
 * Serializes cross-chain intents into signed transport payloads and back.
 * <p>
 * Encoding is deterministic apart from the signature: equal inputs produce
 * the same message id. Decoding reads the kind tag first and only then parses
 * the body into the class that tag names.
 */
public class EnvelopeCodec {

    private final String chainId;
    private final Wallet wallet;

    public EnvelopeCodec(String chainId, Wallet wallet) {
        this.chainId = Objects.requireNonNull(chainId, "chainId must not be null");
        this.wallet = Objects.requireNonNull(wallet, "wallet must not be null");
    }

    /**
     * Builds and signs an envelope originating from this chain.
     *
     * @throws IllegalArgumentException if the body does not match the kind
     */
    public Message seal(MessageType type, String destinationChain, String sender, String receiver,
                        long sequence, CrossChainPayload body) {
        Objects.requireNonNull(type, "type must not be null");
        if (!type.payloadClass().isInstance(body)) {
            throw new IllegalArgumentException(type + " requires a " + type.payloadClass().getSimpleName());
        }
        String payload = ConversionUtil.toJson(body);
        String publicKey = wallet.getEncodedPublicKey();
        String hashString = Message.toHashString(type, chainId, destinationChain, sender, receiver, sequence, payload, publicKey);
        String messageId = SignatureUtil.applySha256(hashString);
        String signature = Base64.getEncoder().encodeToString(wallet.sign(messageId));
        return new Message(type, messageId, chainId, destinationChain, sender, receiver, sequence, payload,
                publicKey, signature);
    }

    public byte[] encode(MessageType type, String destinationChain, String sender, String receiver,
                         long sequence, CrossChainPayload body) {
        return encode(seal(type, destinationChain, sender, receiver, sequence, body));
    }

    public byte[] encode(Message message) {
        return ConversionUtil.toJson(message).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses and authenticates a payload.
     *
     * @throws GovernanceException {@code MALFORMED_PAYLOAD} if the bytes are not
     *                             an envelope, the tag is unknown, a required field
     *                             is missing, or the id or signature do not match
     */
    public Envelope decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw malformed("empty payload");
        }
        Message message;
        try {
            message = ConversionUtil.fromJson(new String(payload, StandardCharsets.UTF_8), Message.class);
        } catch (JsonParseException e) {
            throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD, "not a JSON envelope", e);
        }
        if (message == null) {
            throw malformed("empty envelope");
        }
        if (message.getType() == null) {
            throw malformed("missing or unrecognized message kind");
        }
        requireHeader(message.getMessageId(), "messageId");
        requireHeader(message.getSourceChain(), "sourceChain");
        requireHeader(message.getDestinationChain(), "destinationChain");
        requireHeader(message.getSender(), "sender");
        requireHeader(message.getPayload(), "payload");
        requireHeader(message.getSenderPublicKey(), "senderPublicKey");
        requireHeader(message.getSignature(), "signature");
        if (message.getSequence() < 0) {
            throw malformed("negative sequence");
        }

        CrossChainPayload body;
        try {
            body = ConversionUtil.fromJson(message.getPayload(), message.getType().payloadClass());
        } catch (JsonParseException e) {
            throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD,
                    message.getType() + " body cannot be parsed", e);
        }
        if (body == null) {
            throw malformed(message.getType() + " body is empty");
        }
        String missing = body.missingField();
        if (missing != null) {
            throw malformed(message.getType() + " body is missing " + missing);
        }

        if (!SignatureUtil.applySha256(message.toHashString()).equals(message.getMessageId())) {
            throw malformed("message id does not match contents");
        }
        PublicKey senderKey;
        byte[] signature;
        try {
            senderKey = SignatureUtil.getPublicKeyFromString(message.getSenderPublicKey());
            signature = Base64.getDecoder().decode(message.getSignature());
        } catch (Exception e) {
            throw new GovernanceException(GovernanceError.MALFORMED_PAYLOAD, "unreadable key or signature", e);
        }
        if (!SignatureUtil.verify(senderKey, signature, message.getMessageId())) {
            throw malformed("signature does not verify");
        }
        return new Envelope(message, body);
    }

    public String getChainId() {
        return chainId;
    }

    private static void requireHeader(String value, String field) {
        if (value == null || value.isBlank()) {
            throw malformed("missing " + field);
        }
    }

    private static GovernanceException malformed(String reason) {
        return new GovernanceException(GovernanceError.MALFORMED_PAYLOAD, reason);
    }
}
