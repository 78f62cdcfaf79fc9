package net.spookly.exthost.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class RegistrationSessionTest {
    @Test
    void handshakeMovesForward() {
        RegistrationSession session = new RegistrationSession(ProviderKind.SERVICE_TARGET, "demo.target");
        assertEquals(RegistrationState.CONNECTED, session.state());

        session.awaitRegistration();
        assertEquals(RegistrationState.AWAITING_REGISTRATION, session.state());

        session.markRegistered();
        assertEquals(RegistrationState.REGISTERED, session.state());

        session.close();
        assertEquals(RegistrationState.CLOSED, session.state());
    }

    @Test
    void registeringBeforeCapabilityCheckIsRejected() {
        RegistrationSession session = new RegistrationSession(ProviderKind.SERVICE_TARGET, "demo.target");

        IllegalStateException failure = assertThrows(IllegalStateException.class, session::markRegistered);

        assertEquals("service-target stream for demo.target expected AWAITING_REGISTRATION but was CONNECTED",
                failure.getMessage());
    }

    @Test
    void closedSessionCannotRegister() {
        RegistrationSession session = new RegistrationSession(ProviderKind.FRAMEWORK_SERVICE, "demo.python");
        session.awaitRegistration();
        session.close();
        session.close();

        assertThrows(IllegalStateException.class, session::markRegistered);
        assertThrows(IllegalStateException.class, session::awaitRegistration);
        assertEquals(RegistrationState.CLOSED, session.state());
    }
}
