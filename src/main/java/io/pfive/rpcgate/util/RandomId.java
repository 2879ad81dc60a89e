// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import java.security.SecureRandom;
import java.util.HexFormat;

public abstract class RandomId {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int ID_BYTES = 16;

    /// 128 random bits rendered as 32 lowercase hex characters. Used for request IDs and device IDs
    /// that the client did not supply, so they must be unique across all calls but carry no meaning.
    public static String createRandomHexId () {
        byte[] bytes = new byte[ID_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static boolean validRandomHexId (String id) {
        if (id == null || id.length() != ID_BYTES * 2) return false;
        for (int i = 0; i < id.length(); i++) {
            if (!HexFormat.isHexDigit(id.charAt(i))) return false;
        }
        return true;
    }
}
