package com.heronix.devicegate.controller.api;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.devicegate.model.domain.DeviceEvent;
import com.heronix.devicegate.model.domain.DeviceRecord;
import com.heronix.devicegate.model.domain.RegistrationResult;
import com.heronix.devicegate.model.domain.SubmissionValidation;
import com.heronix.devicegate.model.dto.AccessStatsDTO;
import com.heronix.devicegate.model.dto.DeviceRegistrationRequestDTO;
import com.heronix.devicegate.model.dto.DeviceResponseDTO;
import com.heronix.devicegate.model.enums.AccessDenialReason;
import com.heronix.devicegate.model.enums.DeviceEventType;
import com.heronix.devicegate.service.DeviceAccessManager;
import com.heronix.devicegate.service.DeviceEventService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API used by devices: registration and data submission, plus the
 * device listing.
 *
 * Data submission requires the {@code X-Device-Id} header; only registered
 * devices get through while the whitelist is enabled.
 */
@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Devices", description = "Device registration and whitelisted data submission")
public class DeviceController {

    public static final String DEVICE_ID_HEADER = "X-Device-Id";

    private final DeviceAccessManager accessManager;
    private final DeviceEventService eventService;
    private final Clock clock;

    @PostMapping("/register")
    @Operation(summary = "Register a device",
               description = "Registers a new device or refreshes one registered from the same address")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device registered, auth token issued"),
        @ApiResponse(responseCode = "400", description = "deviceId or address missing"),
        @ApiResponse(responseCode = "403", description = "Caller address is blacklisted"),
        @ApiResponse(responseCode = "409", description = "Device ID bound to a different address"),
        @ApiResponse(responseCode = "429", description = "Too many failed attempts from this address")
    })
    public ResponseEntity<Map<String, Object>> register(
            @Valid @RequestBody DeviceRegistrationRequestDTO request,
            HttpServletRequest httpRequest) {

        String clientAddress = httpRequest.getRemoteAddr();
        log.info("DEVICE_API: Registration request for {} ({}) from {}", request.getDeviceId(), request.getAddress(), clientAddress);

        RegistrationResult result = accessManager.registerDevice(
                request.getDeviceId(), request.toEndpointInfo(), clientAddress);

        if (!result.success()) {
            eventService.rejected(DeviceEventType.DEVICE_REGISTRATION, request.getDeviceId(),
                    request.getAddress(), clientAddress, result.reason().name(), result.message());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", result.message());
            body.put("reason", result.reason());
            body.put("deviceId", request.getDeviceId());

            ResponseEntity.BodyBuilder response = ResponseEntity.status(statusFor(result.reason()));
            if (result.retryAfter() != null) {
                body.put("retryAfter", result.retryAfterSeconds());
                response.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
            }
            return response.body(body);
        }

        eventService.accepted(DeviceEventType.DEVICE_REGISTRATION, request.getDeviceId(),
                request.getAddress(), clientAddress,
                result.warnings().isEmpty() ? "new registration" : String.join("; ", result.warnings()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", result.message());
        body.put("device", toResponse(result.device(), clock.instant()));
        body.put("authToken", result.authToken());
        if (!result.warnings().isEmpty()) {
            body.put("warnings", result.warnings());
        }
        body.put("totalDevices", accessManager.stats().getTotalRegistered());

        return ResponseEntity.ok(body);
    }

    @PostMapping("/data")
    @Operation(summary = "Submit device data",
               description = "Accepts a JSON payload from a whitelisted device")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Data accepted"),
        @ApiResponse(responseCode = "400", description = "X-Device-Id header missing or too long"),
        @ApiResponse(responseCode = "403", description = "Device not registered or address mismatch")
    })
    public ResponseEntity<Map<String, Object>> submitData(
            @Parameter(description = "Identity of the submitting device")
            @RequestHeader(value = DEVICE_ID_HEADER, required = false) String deviceId,
            @RequestBody(required = false) String payload,
            HttpServletRequest httpRequest) {

        if (deviceId == null || deviceId.isBlank()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", "Missing " + DEVICE_ID_HEADER + " header");
            body.put("requiredHeader", DEVICE_ID_HEADER);
            return ResponseEntity.badRequest().body(body);
        }
        if (deviceId.length() > DeviceEvent.MAX_DEVICE_ID_LENGTH) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", DEVICE_ID_HEADER + " must be at most " + DeviceEvent.MAX_DEVICE_ID_LENGTH
                    + " characters");
            body.put("requiredHeader", DEVICE_ID_HEADER);
            return ResponseEntity.badRequest().body(body);
        }

        String clientAddress = httpRequest.getRemoteAddr();
        SubmissionValidation validation = accessManager.validateSubmission(deviceId, clientAddress);
        int payloadSize = payload == null ? 0 : payload.getBytes(StandardCharsets.UTF_8).length;

        if (!validation.allowed()) {
            log.warn("DEVICE_API: Rejected data from {} at {}: {}", deviceId, clientAddress, validation.reason());
            String boundAddress = accessManager.findDevice(deviceId).map(DeviceRecord::getAddress).orElse(null);
            eventService.rejected(DeviceEventType.DATA_RECEIVED, deviceId, boundAddress, clientAddress,
                    validation.reason().name(), validation.message());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", "Device not authorized");
            body.put("reason", validation.reason());
            body.put("message", validation.message());
            body.put("deviceId", deviceId);
            return ResponseEntity.status(statusFor(validation.reason())).body(body);
        }

        DeviceRecord device = validation.device();
        eventService.accepted(DeviceEventType.DATA_RECEIVED, deviceId,
                device != null ? device.getAddress() : null, clientAddress,
                "payload " + payloadSize + " bytes");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Data received and logged successfully");
        body.put("receivedAt", clock.instant().toString());
        body.put("deviceId", deviceId);
        body.put("deviceStatus", device != null ? device.getStatus() : null);
        body.put("submissionCount", device != null ? device.getSubmissionCount() : null);
        body.put("payloadSize", payloadSize);

        return ResponseEntity.ok(body);
    }

    @GetMapping
    @Operation(summary = "List registered devices", description = "All registered devices with online status")
    @ApiResponse(responseCode = "200", description = "Devices returned")
    public ResponseEntity<Map<String, Object>> listDevices() {
        Instant now = clock.instant();
        List<DeviceResponseDTO> devices = accessManager.listDevices().stream()
                .map(device -> toResponse(device, now))
                .collect(Collectors.toList());
        AccessStatsDTO stats = accessManager.stats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("totalDevices", devices.size());
        body.put("activeDevices", stats.getActiveDevices());
        body.put("devices", devices);
        body.put("authenticationStats", stats);

        return ResponseEntity.ok(body);
    }

    @GetMapping("/{deviceId}")
    @Operation(summary = "Get device details")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device found"),
        @ApiResponse(responseCode = "404", description = "Device not registered")
    })
    public ResponseEntity<DeviceResponseDTO> getDevice(@PathVariable String deviceId) {
        Instant now = clock.instant();
        return accessManager.findDevice(deviceId)
                .map(device -> toResponse(device, now))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{deviceId}")
    @Operation(summary = "Unregister a device", description = "Removes a device and its auth token from the whitelist")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Device unregistered"),
        @ApiResponse(responseCode = "404", description = "Device not found")
    })
    public ResponseEntity<Map<String, Object>> unregisterDevice(
            @PathVariable String deviceId,
            @RequestParam(required = false) String reason,
            HttpServletRequest httpRequest) {

        String effectiveReason = reason != null && !reason.isBlank() ? reason : "API request";
        boolean removed = accessManager.unregisterDevice(deviceId, effectiveReason);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deviceId", deviceId);

        if (!removed) {
            body.put("success", false);
            body.put("error", "Device not found");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }

        eventService.accepted(DeviceEventType.DEVICE_UNREGISTERED, deviceId, null,
                httpRequest.getRemoteAddr(), effectiveReason);

        body.put("success", true);
        body.put("message", "Device " + deviceId + " unregistered successfully");
        body.put("remainingDevices", accessManager.stats().getTotalRegistered());
        return ResponseEntity.ok(body);
    }

    private DeviceResponseDTO toResponse(DeviceRecord device, Instant now) {
        return DeviceResponseDTO.fromRecord(device, now, DeviceAccessManager.ACTIVE_WINDOW,
                accessManager.hasLiveToken(device.getDeviceId()));
    }

    static HttpStatus statusFor(AccessDenialReason reason) {
        switch (reason) {
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case IDENTITY_CONFLICT:
                return HttpStatus.CONFLICT;
            case BLACKLISTED:
            case NOT_REGISTERED:
            case ADDRESS_MISMATCH:
            default:
                return HttpStatus.FORBIDDEN;
        }
    }
}
