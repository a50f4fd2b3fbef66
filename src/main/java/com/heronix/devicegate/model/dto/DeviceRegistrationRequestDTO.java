package com.heronix.devicegate.model.dto;

import java.util.Map;

import com.heronix.devicegate.model.domain.DeviceEvent;
import com.heronix.devicegate.model.domain.EndpointInfo;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceRegistrationRequestDTO {

    /**
     * Device identity (e.g., "esp32_sensor_01").
     */
    @NotBlank(message = "deviceId is required")
    @Size(max = DeviceEvent.MAX_DEVICE_ID_LENGTH, message = "deviceId must be at most 100 characters")
    private String deviceId;

    /**
     * Address the device can be reached on (e.g., "192.168.1.100").
     */
    @NotBlank(message = "address is required")
    @Size(max = DeviceEvent.MAX_ADDRESS_LENGTH, message = "address must be at most 64 characters")
    private String address;

    /**
     * Port the device listens on. Defaults to 80.
     */
    @Min(value = 1, message = "port must be between 1 and 65535")
    @Max(value = 65535, message = "port must be between 1 and 65535")
    private Integer port;

    /**
     * Optional descriptive attributes (type, location, firmware...).
     */
    private Map<String, Object> metadata;

    public EndpointInfo toEndpointInfo() {
        return EndpointInfo.of(address, port, metadata);
    }
}
