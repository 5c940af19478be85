package org.courier.manager.config;

import java.time.Duration;

public class ServiceConfig {

    /**
     * Upper bound for the serialized form of a single message record, attachments included.
     */
    public static final int MAX_SERIALIZED_MESSAGE = 16000;

    /**
     * Time after which received messages are erased from the inbox.
     */
    public static final Duration MESSAGE_LIFETIME = Duration.ofDays(7);

    public static final Duration EXPIRY_SWEEP_PERIOD = Duration.ofHours(1);

    public static final String HANDSHAKE_ARMOR_LABEL = "POND KEY EXCHANGE";

    public static final String SERVER_SCHEME = "pondserver";
    public static final int DEFAULT_SERVER_PORT = 16333;
    public static final int SERVER_ID_LENGTH = 32;

    public static final String DEFAULT_SERVER = "pondserver://ICYUHSAYGIXTKYKXSAHIBWEAQCTEF26WUWEPOVC764WYELCJMUPA@jb644zapje5dvgk3.onion";
    public static final String TESTING_SERVER = "pondserver://PXD4DDBLJD3YCC3EC3DGIYVYZYF5GVZC3T6JFHPUWU2WQ7W3CN5Q@127.0.0.1:16333";

    public static final int KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    public static final int STATE_SALT_LENGTH = 32;
    public static final int STATE_NONCE_LENGTH = 12;
    public static final int STATE_KEY_LENGTH = 32;

    public static String getDefaultServer(boolean testing) {
        return testing ? TESTING_SERVER : DEFAULT_SERVER;
    }
}
