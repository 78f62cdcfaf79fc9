package net.spookly.exthost.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.auth.ServerInfo;
import net.spookly.exthost.auth.TokenCodec;
import net.spookly.exthost.error.AuthenticationException;
import net.spookly.exthost.extension.Capability;
import net.spookly.exthost.extension.ExtensionIdentity;
import org.junit.jupiter.api.Test;

class AuthInterceptorTest {
    private final TokenCodec codec = new TokenCodec();
    private final ServerInfo serverInfo = ServerInfo.generate("127.0.0.1", 50051);
    private final AuthInterceptor interceptor = new AuthInterceptor(codec, () -> serverInfo);
    private final ExtensionIdentity extension = new ExtensionIdentity("demo.extension", "demo", null, "1.0.0",
            List.of(Capability.PROVISIONING_PROVIDER), null);

    @Test
    void resolvesIdentityFromBearerToken() {
        RequestIdentity identity = interceptor.authenticate("Bearer " + codec.generate(extension, serverInfo));

        assertEquals("demo.extension", identity.extensionId());
        assertTrue(identity.capabilities().contains(Capability.PROVISIONING_PROVIDER));
    }

    @Test
    void acceptsLowercaseScheme() {
        RequestIdentity identity = interceptor.authenticate("bearer " + codec.generate(extension, serverInfo));

        assertEquals("demo.extension", identity.extensionId());
    }

    @Test
    void rejectsMissingOrForeignSchemes() {
        assertThrows(AuthenticationException.class, () -> interceptor.authenticate(null));
        assertThrows(AuthenticationException.class, () -> interceptor.authenticate("Basic abc"));
        assertThrows(AuthenticationException.class, () -> interceptor.authenticate("Bearer "));
    }

    @Test
    void rejectsCallsBeforeServerStarted() {
        AuthInterceptor notStarted = new AuthInterceptor(codec, () -> null);
        String token = codec.generate(extension, serverInfo);

        assertThrows(AuthenticationException.class, () -> notStarted.authenticate("Bearer " + token));
    }
}
