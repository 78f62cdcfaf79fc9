package net.spookly.exthost.auth;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;
import net.spookly.exthost.extension.Capability;

/**
 * Signed token payload binding an extension to one host instance.
 */
@Getter
@Accessors(fluent = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtensionClaims {
    @JsonProperty("sub")
    private String subject;
    @JsonProperty("iss")
    private String issuer;
    @JsonProperty("aud")
    private List<String> audience;
    /** Epoch seconds. */
    @JsonProperty("iat")
    private long issuedAt;
    /** Epoch seconds. */
    @JsonProperty("exp")
    private long expiresAt;
    @JsonProperty("capabilities")
    private List<String> capabilities;

    /**
     * Known capabilities among the claimed ids; unknown ids are skipped.
     */
    public Set<Capability> capabilitySet() {
        Set<Capability> resolved = EnumSet.noneOf(Capability.class);
        if (capabilities == null) {
            return resolved;
        }
        for (String id : capabilities) {
            Capability.find(id).ifPresent(resolved::add);
        }
        return resolved;
    }
}
