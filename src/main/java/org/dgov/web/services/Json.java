package org.dgov.web.services;

import com.google.gson.Gson;
import spark.Request;

public class Json {
    private static final Gson gson = new Gson();

    private Json() {
    }

    public static <T> T body(Request req, Class<T> cls) {
        T obj = gson.fromJson(req.body(), cls);
        if (obj == null) throw new IllegalArgumentException("Invalid JSON");
        return obj;
    }

    /**
     * Optional positive integer query parameter.
     */
    public static int intParam(Request req, String name, int defaultValue) {
        String value = req.queryParams(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) throw new IllegalArgumentException(name + " must be positive");
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value);
        }
    }
}
