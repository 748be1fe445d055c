package com.pokeme.store;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/** Request ids are 12 lowercase hex characters. Anything else is never looked up. */
public final class RequestIds {

    private static final Pattern VALID_ID = Pattern.compile("^[0-9a-f]{12}$");
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom random = new SecureRandom();

    public String next() {
        var bytes = new byte[6];
        random.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    public static boolean isValid(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }
}
