package org.dgov.support;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.dgov.bc.SignatureUtil;
import org.dgov.chain.Wallet;

import java.security.Security;

public final class Fixtures {

    public static final String ADMIN = address(0xa1);
    public static final String TOKEN = "gov-token";

    private Fixtures() {
    }

    public static void installProvider() {
        if (Security.getProvider("BC") == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    /**
     * 32-byte identifier in lowercase hex.
     */
    public static String id(long n) {
        return String.format("%064x", n);
    }

    /**
     * 20-byte address in lowercase hex; {@code n} must be non-zero.
     */
    public static String address(long n) {
        return String.format("%040x", n);
    }

    /**
     * The JSON object a route handler's result renders to.
     */
    public static JsonObject json(Object routeResult) {
        return JsonParser.parseString(new Gson().toJson(routeResult)).getAsJsonObject();
    }

    public static Wallet newWallet() {
        installProvider();
        return new Wallet(SignatureUtil.generateKeyPair());
    }
}
