package net.spookly.exthost.provider;

import lombok.extern.slf4j.Slf4j;

/**
 * Default provider audit logger that emits one line per event.
 */
@Slf4j
public final class ProviderAuditLogger implements ProviderEventListener {
    public static final ProviderAuditLogger INSTANCE = new ProviderAuditLogger();

    private ProviderAuditLogger() {
    }

    @Override
    public void onEvent(ProviderEvent event) {
        StringBuilder builder = new StringBuilder("provider_event");
        append(builder, "type", event.type());
        append(builder, "kind", event.kind() == null ? null : event.kind().id());
        append(builder, "key", event.key());
        append(builder, "extensionId", event.extensionId());
        append(builder, "timestamp", event.timestamp());
        log.info(builder.toString());
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
