package org.dgov.governance;

import java.util.regex.Pattern;

/**
 * Format checks for the fixed-size keys used throughout the registry.
 * <ul>
 *   <li>identifiers (DAO and proposal ids): 32 bytes as 64 lowercase hex characters</li>
 *   <li>addresses: 20 bytes as 40 lowercase hex characters, never all zeros</li>
 * </ul>
 */
public final class Identifiers {

    private static final Pattern ID = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern ADDRESS = Pattern.compile("[0-9a-f]{40}");
    private static final String ZERO_ADDRESS = "0".repeat(40);

    private Identifiers() {
    }

    public static boolean isValidId(String id) {
        return id != null && ID.matcher(id).matches();
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS.matcher(address).matches() && !ZERO_ADDRESS.equals(address);
    }

    public static String requireId(String id, String field) {
        if (!isValidId(id)) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, field + " must be 64 lowercase hex characters");
        }
        return id;
    }

    public static String requireAddress(String address, String field) {
        if (!isValidAddress(address)) {
            throw new GovernanceException(GovernanceError.INVALID_ARGUMENT, field + " must be a non-zero 40 character hex address");
        }
        return address;
    }
}
