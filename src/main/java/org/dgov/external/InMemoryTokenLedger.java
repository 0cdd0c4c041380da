package org.dgov.external;

import com.google.gson.reflect.TypeToken;
import org.dgov.util.ConversionUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance table kept in memory, keyed by token then address. Can be seeded
 * from a JSON file of the form {@code {"token": {"address": "amount"}}}.
 */
public class InMemoryTokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTokenLedger.class);
    private static final Type SNAPSHOT_TYPE = new TypeToken<Map<String, Map<String, String>>>() {}.getType();

    private final Map<String, Map<String, BigInteger>> balances = new ConcurrentHashMap<>();

    public static InMemoryTokenLedger load(Path file) throws IOException {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        Map<String, Map<String, String>> snapshot =
                ConversionUtil.fromJson(Files.readString(file, StandardCharsets.UTF_8), SNAPSHOT_TYPE);
        if (snapshot == null) {
            return ledger;
        }
        snapshot.forEach((token, holders) ->
                holders.forEach((address, amount) -> ledger.setBalance(token, address, new BigInteger(amount))));
        log.info("[InMemoryTokenLedger] Loaded balances for " + snapshot.size() + " token(s) from " + file);
        return ledger;
    }

    public void setBalance(String token, String address, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("balance must not be negative");
        }
        balances.computeIfAbsent(token, t -> new ConcurrentHashMap<>()).put(address, amount);
    }

    @Override
    public BigInteger balanceOf(String token, String address) {
        Map<String, BigInteger> holders = balances.get(token);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        return holders.getOrDefault(address, BigInteger.ZERO);
    }
}
