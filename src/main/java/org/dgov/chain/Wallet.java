package org.dgov.chain;

import org.dgov.bc.SignatureUtil;
import org.dgov.constants.ConfigKey;
import org.dgov.db.GovernanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * A chain's cryptographic identity. Outbound cross-chain messages are signed
 * with this key; peers trust the matching public key.
 */
public class Wallet {

    private static final Logger log = LoggerFactory.getLogger(Wallet.class);

    private final KeyPair keyPair;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
    }

    /**
     * Loads the key pair kept in the store, generating and saving one on first start.
     */
    public static Wallet loadOrCreate(GovernanceStore store) {
        String publicKey = store.getConfig(ConfigKey.PUBLIC_KEY.key());
        String privateKey = store.getConfig(ConfigKey.PRIVATE_KEY.key());
        if (publicKey != null && privateKey != null) {
            try {
                PublicKey pub = SignatureUtil.getPublicKeyFromString(publicKey);
                PrivateKey priv = SignatureUtil.getPrivateKeyFromString(privateKey);
                return new Wallet(new KeyPair(pub, priv));
            } catch (Exception e) {
                throw new IllegalStateException("Stored chain key pair is unreadable", e);
            }
        }
        KeyPair generated = SignatureUtil.generateKeyPair();
        store.putConfig(ConfigKey.PUBLIC_KEY.key(), SignatureUtil.getStringFromKey(generated.getPublic()));
        store.putConfig(ConfigKey.PRIVATE_KEY.key(), SignatureUtil.getStringFromKey(generated.getPrivate()));
        log.info("[Wallet] Generated new chain key pair, address " + SignatureUtil.addressOf(generated.getPublic()));
        return new Wallet(generated);
    }

    public String getEncodedPublicKey() {
        return SignatureUtil.getStringFromKey(keyPair.getPublic());
    }

    public String getAddress() {
        return SignatureUtil.addressOf(keyPair.getPublic());
    }

    public byte[] sign(String data) {
        return SignatureUtil.sign(keyPair.getPrivate(), data);
    }
}
