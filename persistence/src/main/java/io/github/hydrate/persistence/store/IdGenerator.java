package io.github.hydrate.persistence.store;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Random lowercase hex identifiers. User ids use 8 bytes, reminder ids 6.
 */
public class IdGenerator {

    static final int USER_ID_BYTES = 8;
    static final int REMINDER_ID_BYTES = 6;

    private final SecureRandom random = new SecureRandom();

    public String userId() {
        return hex(USER_ID_BYTES);
    }

    public String reminderId() {
        return hex(REMINDER_ID_BYTES);
    }

    private String hex(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }
}
