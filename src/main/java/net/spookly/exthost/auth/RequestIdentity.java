package net.spookly.exthost.auth;

import java.util.Set;

import io.grpc.Context;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.exthost.error.AuthenticationException;
import net.spookly.exthost.extension.Capability;

/**
 * Verified caller identity, resolved once by the auth interceptor and carried in the gRPC context.
 */
@Getter
@Accessors(fluent = true)
public final class RequestIdentity {
    public static final Context.Key<RequestIdentity> CONTEXT_KEY = Context.key("exthost.request-identity");

    private final String extensionId;
    private final Set<Capability> capabilities;
    private final ExtensionClaims claims;

    private RequestIdentity(String extensionId, Set<Capability> capabilities, ExtensionClaims claims) {
        this.extensionId = extensionId;
        this.capabilities = Set.copyOf(capabilities);
        this.claims = claims;
    }

    public static RequestIdentity fromClaims(ExtensionClaims claims) {
        return new RequestIdentity(claims.subject(), claims.capabilitySet(), claims);
    }

    /**
     * Identity attached to the current gRPC context.
     *
     * @throws AuthenticationException when the call did not pass the auth interceptor
     */
    public static RequestIdentity current() {
        return from(Context.current());
    }

    public static RequestIdentity from(Context context) {
        RequestIdentity identity = context == null ? null : CONTEXT_KEY.get(context);
        if (identity == null) {
            throw new AuthenticationException("request identity missing from context");
        }
        return identity;
    }
}
