package com.heronix.devicegate.controller.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.devicegate.model.domain.AccessPolicy;
import com.heronix.devicegate.model.domain.AccessPolicyUpdate;
import com.heronix.devicegate.model.domain.DeviceEvent;
import com.heronix.devicegate.model.domain.DeviceRecord;
import com.heronix.devicegate.model.dto.AccessConfigUpdateDTO;
import com.heronix.devicegate.model.dto.AccessStatsDTO;
import com.heronix.devicegate.model.dto.BlacklistRequestDTO;
import com.heronix.devicegate.model.enums.DeviceEventType;
import com.heronix.devicegate.service.DeviceAccessManager;
import com.heronix.devicegate.service.DeviceEventService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for administering device access control: blacklist, runtime
 * configuration, status and the event log.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Access Administration", description = "Blacklist, configuration and status of device access control")
public class AccessAdminController {

    private static final int RECENT_DEVICE_COUNT = 5;

    private final DeviceAccessManager accessManager;
    private final DeviceEventService eventService;

    // ========================================================================
    // BLACKLIST
    // ========================================================================

    @PostMapping("/blacklist")
    @Operation(summary = "Blacklist an address", description = "Bar an address from registering devices")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Address blacklisted"),
        @ApiResponse(responseCode = "400", description = "Address missing")
    })
    public ResponseEntity<Map<String, Object>> blacklist(
            @Valid @RequestBody BlacklistRequestDTO request,
            HttpServletRequest httpRequest) {

        String reason = request.getReason() != null && !request.getReason().isBlank()
                ? request.getReason() : "Manual blacklist";
        accessManager.blacklistAddress(request.getAddress(), reason);
        eventService.accepted(DeviceEventType.ADDRESS_BLACKLISTED, null, request.getAddress(),
                httpRequest.getRemoteAddr(), reason);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Address " + request.getAddress() + " blacklisted successfully");
        body.put("address", request.getAddress());
        body.put("reason", reason);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/blacklist/{address}")
    @Operation(summary = "Remove an address from the blacklist")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Address removed"),
        @ApiResponse(responseCode = "404", description = "Address was not blacklisted")
    })
    public ResponseEntity<Map<String, Object>> unblacklist(
            @PathVariable String address,
            HttpServletRequest httpRequest) {

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("address", address);

        if (!accessManager.unblacklistAddress(address)) {
            body.put("success", false);
            body.put("error", "Address not found in blacklist");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }

        eventService.accepted(DeviceEventType.ADDRESS_UNBLACKLISTED, null, address,
                httpRequest.getRemoteAddr(), null);

        body.put("success", true);
        body.put("message", "Address " + address + " removed from blacklist");
        return ResponseEntity.ok(body);
    }

    // ========================================================================
    // CONFIGURATION
    // ========================================================================

    @PutMapping("/config")
    @Operation(summary = "Update access configuration",
               description = "Partial update of maxRegistrationAttempts, registrationCooldown, tokenExpiry, "
                       + "requireUniqueAddresses and enableWhitelist")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Configuration updated"),
        @ApiResponse(responseCode = "400", description = "No recognized field or invalid value")
    })
    public ResponseEntity<Map<String, Object>> updateConfig(
            @Valid @RequestBody AccessConfigUpdateDTO request,
            HttpServletRequest httpRequest) {

        AccessPolicyUpdate update = request.toPolicyUpdate();
        if (update.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", "No valid configuration fields provided");
            body.put("allowedFields", List.of("maxRegistrationAttempts", "registrationCooldown",
                    "tokenExpiry", "requireUniqueAddresses", "enableWhitelist"));
            return ResponseEntity.badRequest().body(body);
        }

        // IllegalArgumentException for out-of-range values is mapped to 400 by ApiExceptionAdvice
        AccessPolicy policy = accessManager.updateConfig(update);
        eventService.accepted(DeviceEventType.CONFIG_UPDATED, null, null,
                httpRequest.getRemoteAddr(), String.join(",", update.presentFields()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Authentication configuration updated");
        body.put("updatedFields", update.presentFields());
        body.put("newConfig", policy);
        return ResponseEntity.ok(body);
    }

    // ========================================================================
    // STATUS & MAINTENANCE
    // ========================================================================

    @GetMapping("/status")
    @Operation(summary = "Get access control status")
    @ApiResponse(responseCode = "200", description = "Status returned")
    public ResponseEntity<Map<String, Object>> status() {
        AccessStatsDTO stats = accessManager.stats();
        List<DeviceRecord> devices = accessManager.listDevices();
        List<DeviceRecord> recent = devices.subList(Math.max(0, devices.size() - RECENT_DEVICE_COUNT), devices.size());

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("whitelistActive", stats.getConfig().enableWhitelist());
        health.put("devicesRegistered", stats.getTotalRegistered());
        health.put("activeDevices", stats.getActiveDevices());
        health.put("blacklistedAddresses", stats.getBlacklistedAddresses());
        health.put("liveTokens", stats.getLiveTokens());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("authenticationEnabled", stats.getConfig().enableWhitelist());
        body.put("statistics", stats);
        body.put("recentDevices", recent);
        body.put("systemHealth", health);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Run the sweep now", description = "Drops expired tokens and stale attempt counters")
    @ApiResponse(responseCode = "200", description = "Sweep report returned")
    public ResponseEntity<DeviceAccessManager.SweepReport> cleanup() {
        log.info("DEVICE_API: Manual sweep requested");
        return ResponseEntity.ok(accessManager.cleanup());
    }

    @GetMapping("/events")
    @Operation(summary = "Recent device events", description = "Most recent entries of the device event log")
    @ApiResponse(responseCode = "200", description = "Events returned")
    public ResponseEntity<List<DeviceEvent>> events(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String deviceId) {

        if (deviceId != null && !deviceId.isBlank()) {
            return ResponseEntity.ok(eventService.eventsForDevice(deviceId));
        }
        return ResponseEntity.ok(eventService.recentEvents(limit));
    }
}
