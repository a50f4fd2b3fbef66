package com.heronix.devicegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.heronix.devicegate.config.DeviceGateProperties;

/**
 * Heronix DeviceGate - registration and whitelist gateway for ESP32 devices.
 *
 * Devices register with an ID and the address they can be reached on; only
 * registered devices may submit data. Registration is protected by per-address
 * rate limiting and an address blacklist.
 */
@SpringBootApplication
@EnableConfigurationProperties(DeviceGateProperties.class)
@EnableScheduling
public class DeviceGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeviceGateApplication.class, args);
    }
}
