package com.heronix.devicegate.model.dto;

import com.heronix.devicegate.model.domain.DeviceEvent;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for blacklisting an address.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistRequestDTO {

    @NotBlank(message = "address is required")
    @Size(max = DeviceEvent.MAX_ADDRESS_LENGTH, message = "address must be at most 64 characters")
    private String address;

    /**
     * Free text, defaults to "Manual blacklist".
     */
    private String reason;
}
