package org.dgov.net;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.dgov.chain.Wallet;
import org.dgov.governance.GovernanceError;
import org.dgov.governance.GovernanceException;
import org.dgov.support.Fixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.dgov.support.Fixtures.address;
import static org.dgov.support.Fixtures.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnvelopeCodecTest {

    private static final String SENDER = address(0xc1);

    private EnvelopeCodec codec;

    @BeforeAll
    static void installProvider() {
        Fixtures.installProvider();
    }

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec("chain-a", Fixtures.newWallet());
    }

    @Test
    void decodesWhatItEncodes() {
        CreateProposalPayload body = new CreateProposalPayload(id(1), id(10), "cross", 100, 200, 1000);
        byte[] bytes = codec.encode(MessageType.CREATE_PROPOSAL, "chain-b", SENDER, null, 7, body);

        Envelope envelope = codec.decode(bytes);

        assertEquals(MessageType.CREATE_PROPOSAL, envelope.getType());
        assertEquals("chain-a", envelope.getSourceChain());
        assertEquals("chain-b", envelope.getDestinationChain());
        assertEquals(SENDER, envelope.getSender());
        assertEquals(7L, envelope.getMessage().getSequence());
        assertEquals(body, envelope.getBody());
        assertInstanceOf(CreateProposalPayload.class, envelope.getBody());
    }

    @Test
    void equalInputsGiveEqualMessageIds() {
        VotePayload body = new VotePayload(id(10), 5, SENDER);

        Message first = codec.seal(MessageType.VOTE, "chain-b", SENDER, null, 3, body);
        Message second = codec.seal(MessageType.VOTE, "chain-b", SENDER, null, 3, body);
        Message nextSequence = codec.seal(MessageType.VOTE, "chain-b", SENDER, null, 4, body);

        assertEquals(first.getMessageId(), second.getMessageId());
        assertEquals(64, first.getMessageId().length());
        assertEquals(false, first.getMessageId().equals(nextSequence.getMessageId()));
    }

    @Test
    void bodyMustMatchKind() {
        assertThrows(IllegalArgumentException.class, () ->
                codec.seal(MessageType.VOTE, "chain-b", SENDER, null, 0, new FinalizePayload(id(10))));
    }

    @Test
    void rejectsNonJson() {
        assertMalformed("definitely not json".getBytes(StandardCharsets.UTF_8));
        assertMalformed(new byte[0]);
        assertMalformed("[1,2,3]".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void rejectsUnknownOrMissingTag() {
        JsonObject json = encodedJson(MessageType.FINALIZE, new FinalizePayload(id(10)));
        json.addProperty("type", "SELF_DESTRUCT");
        assertMalformed(json);

        json.remove("type");
        assertMalformed(json);
    }

    @Test
    void rejectsMissingHeaderOrBodyField() {
        JsonObject json = encodedJson(MessageType.FINALIZE, new FinalizePayload(id(10)));
        json.remove("sourceChain");
        assertMalformed(json);

        JsonObject vote = encodedJson(MessageType.VOTE, new VotePayload(id(10), 5, SENDER));
        vote.addProperty("payload", "{\"proposalId\":\"" + id(10) + "\",\"voter\":\"" + SENDER + "\"}");
        assertMalformed(vote);
    }

    @Test
    void rejectsUnparsableBody() {
        JsonObject json = encodedJson(MessageType.VOTE, new VotePayload(id(10), 5, SENDER));
        json.addProperty("payload", "{\"proposalId\":\"" + id(10) + "\",\"weight\":\"lots\",\"voter\":\"" + SENDER + "\"}");
        assertMalformed(json);
    }

    @Test
    void rejectsTamperedContent() {
        JsonObject json = encodedJson(MessageType.VOTE, new VotePayload(id(10), 5, SENDER));
        json.addProperty("payload", "{\"proposalId\":\"" + id(10) + "\",\"weight\":5000,\"voter\":\"" + SENDER + "\"}");
        assertMalformed(json);
    }

    @Test
    void rejectsForgedSignature() {
        Wallet forger = Fixtures.newWallet();
        Message genuine = codec.seal(MessageType.FINALIZE, "chain-b", SENDER, null, 0, new FinalizePayload(id(10)));
        EnvelopeCodec forgerCodec = new EnvelopeCodec("chain-a", forger);
        Message forged = forgerCodec.seal(MessageType.FINALIZE, "chain-b", SENDER, null, 0, new FinalizePayload(id(10)));

        JsonObject json = JsonParser.parseString(new String(codec.encode(genuine), StandardCharsets.UTF_8)).getAsJsonObject();
        json.addProperty("signature", forged.getSignature());
        assertMalformed(json);
    }

    private JsonObject encodedJson(MessageType type, CrossChainPayload body) {
        byte[] bytes = codec.encode(type, "chain-b", SENDER, null, 0, body);
        return JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8)).getAsJsonObject();
    }

    private void assertMalformed(JsonObject json) {
        assertMalformed(json.toString().getBytes(StandardCharsets.UTF_8));
    }

    private void assertMalformed(byte[] bytes) {
        GovernanceException e = assertThrows(GovernanceException.class, () -> codec.decode(bytes));
        assertEquals(GovernanceError.MALFORMED_PAYLOAD, e.getError());
    }
}
