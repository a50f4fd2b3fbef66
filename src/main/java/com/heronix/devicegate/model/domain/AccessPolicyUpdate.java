package com.heronix.devicegate.model.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;

/**
 * Partial policy change. Null fields are left untouched.
 */
@Builder
public record AccessPolicyUpdate(
        Integer maxRegistrationAttempts,
        Duration registrationCooldown,
        Duration tokenExpiry,
        Boolean requireUniqueAddresses,
        Boolean enableWhitelist
) {

    /**
     * Names of the fields this update carries.
     */
    public List<String> presentFields() {
        List<String> fields = new ArrayList<>();
        if (maxRegistrationAttempts != null) {
            fields.add("maxRegistrationAttempts");
        }
        if (registrationCooldown != null) {
            fields.add("registrationCooldown");
        }
        if (tokenExpiry != null) {
            fields.add("tokenExpiry");
        }
        if (requireUniqueAddresses != null) {
            fields.add("requireUniqueAddresses");
        }
        if (enableWhitelist != null) {
            fields.add("enableWhitelist");
        }
        return fields;
    }

    public boolean isEmpty() {
        return presentFields().isEmpty();
    }
}
