package net.spookly.exthost.server;

import java.util.Locale;
import java.util.function.Supplier;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.ExtensionClaims;
import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.auth.ServerInfo;
import net.spookly.exthost.auth.TokenCodec;
import net.spookly.exthost.error.AuthenticationException;

/**
 * Verifies the bearer token of every call and attaches the caller's {@link RequestIdentity}
 * to the call context. Calls without a valid token are closed before any handler runs.
 */
@Slf4j
public final class AuthInterceptor implements ServerInterceptor {
    public static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    private static final String BEARER_PREFIX = "bearer ";

    private final TokenCodec tokenCodec;
    private final Supplier<ServerInfo> serverInfo;

    public AuthInterceptor(TokenCodec tokenCodec, Supplier<ServerInfo> serverInfo) {
        this.tokenCodec = tokenCodec;
        this.serverInfo = serverInfo;
    }

    @Override
    public <Q, R> ServerCall.Listener<Q> interceptCall(ServerCall<Q, R> call,
                                                      Metadata headers,
                                                      ServerCallHandler<Q, R> next) {
        RequestIdentity identity;
        try {
            identity = authenticate(headers.get(AUTHORIZATION));
        } catch (AuthenticationException e) {
            log.warn("Rejected {}: {}", call.getMethodDescriptor().getFullMethodName(), e.getMessage());
            call.close(Status.UNAUTHENTICATED.withDescription(e.getMessage()), new Metadata());
            return new ServerCall.Listener<>() {
            };
        }
        Context context = Context.current().withValue(RequestIdentity.CONTEXT_KEY, identity);
        return Contexts.interceptCall(context, call, headers, next);
    }

    RequestIdentity authenticate(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new AuthenticationException("missing authorization header");
        }
        String trimmed = authorization.trim();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            throw new AuthenticationException("authorization header must use the Bearer scheme");
        }
        String token = trimmed.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthenticationException("empty bearer token");
        }
        ServerInfo info = serverInfo.get();
        if (info == null) {
            throw new AuthenticationException("server is not accepting calls yet");
        }
        ExtensionClaims claims = tokenCodec.validate(token, info);
        return RequestIdentity.fromClaims(claims);
    }
}
