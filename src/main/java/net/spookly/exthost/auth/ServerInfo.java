package net.spookly.exthost.auth;

import java.security.SecureRandom;
import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Address and per-process signing key of one running host instance.
 */
@Accessors(fluent = true)
public final class ServerInfo {
    static final int SIGNING_KEY_BYTES = 16;

    @Getter
    private final String host;
    @Getter
    private final int port;
    private final byte[] signingKey;

    private ServerInfo(String host, int port, byte[] signingKey) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.signingKey = signingKey.clone();
    }

    /**
     * Create server info with a fresh random signing key.
     */
    public static ServerInfo generate(String host, int port) {
        SecureRandom random = new SecureRandom();
        byte[] key = new byte[SIGNING_KEY_BYTES];
        random.nextBytes(key);
        return new ServerInfo(host, port, key);
    }

    public static ServerInfo of(String host, int port, byte[] signingKey) {
        if (signingKey == null || signingKey.length == 0) {
            throw new IllegalArgumentException("signing key is required");
        }
        return new ServerInfo(host, port, signingKey);
    }

    /**
     * {@code host:port}, also used as the token audience.
     */
    public String address() {
        return host + ":" + port;
    }

    public byte[] signingKey() {
        return signingKey.clone();
    }

    /**
     * Same signing key bound to the port the listener actually received.
     */
    public ServerInfo withPort(int boundPort) {
        return new ServerInfo(host, boundPort, signingKey);
    }

    @Override
    public String toString() {
        return "ServerInfo{address=" + address() + ", signingKey=" + TokenRedactor.redactKey(signingKey) + "}";
    }
}
