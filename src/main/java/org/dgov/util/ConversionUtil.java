package org.dgov.util;

import com.google.gson.Gson;

import java.lang.reflect.Type;

/**
 * JSON helpers over one compact Gson instance, shared by the envelope codec,
 * the SQLite store (event attributes) and the token ledger loader.
 */
public final class ConversionUtil {

    private static final Gson gson = new Gson();

    private ConversionUtil() {
    }

    /**
     * @return the JSON text, or {@code null} for a {@code null} input
     */
    public static String toJson(Object object) {
        if (object == null) {
            return null;
        }
        return gson.toJson(object);
    }

    /**
     * @return the decoded value, or {@code null} for empty input
     * @throws com.google.gson.JsonParseException if the input is not valid JSON for the type
     */
    public static <T> T fromJson(String jsonString, Class<T> tClass) {
        if (jsonString == null || jsonString.isEmpty() || tClass == null) {
            return null;
        }
        return gson.fromJson(jsonString, tClass);
    }

    /**
     * Decodes into a parameterized type, e.g. {@code Map<String, Map<String, String>>} from a {@code TypeToken}.
     */
    public static <T> T fromJson(String jsonString, Type type) {
        if (jsonString == null || jsonString.isEmpty() || type == null) {
            return null;
        }
        return gson.fromJson(jsonString, type);
    }
}
