package com.heronix.devicegate.model.dto;

import java.time.Duration;

import com.heronix.devicegate.model.domain.AccessPolicyUpdate;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a partial access configuration change.
 *
 * Only these five fields are recognized; anything else in the request body
 * is ignored. Durations use ISO-8601 notation (e.g., "PT5M").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessConfigUpdateDTO {

    @Min(value = 1, message = "maxRegistrationAttempts must be at least 1")
    private Integer maxRegistrationAttempts;

    private Duration registrationCooldown;

    private Duration tokenExpiry;

    private Boolean requireUniqueAddresses;

    private Boolean enableWhitelist;

    public AccessPolicyUpdate toPolicyUpdate() {
        return AccessPolicyUpdate.builder()
                .maxRegistrationAttempts(maxRegistrationAttempts)
                .registrationCooldown(registrationCooldown)
                .tokenExpiry(tokenExpiry)
                .requireUniqueAddresses(requireUniqueAddresses)
                .enableWhitelist(enableWhitelist)
                .build();
    }
}
