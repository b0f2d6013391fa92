package com.adflux.services.adplatforms.controller;

import com.adflux.services.adplatforms.auth.AuthState;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.service.AdPlatformService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for platform registration and authentication state
 */
@RestController
@RequestMapping(AdPlatformConstants.API_V1 + "/platforms")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Platforms", description = "Registered platforms and their authentication")
public class PlatformAuthController {

    private final AdPlatformService adPlatformService;

    @GetMapping
    @Operation(summary = "List platforms with a registered adapter")
    public ResponseEntity<ApiResponse<List<Platform>>> getRegisteredPlatforms() {
        return ResponseEntity.ok(ApiResponse.success(adPlatformService.getRegisteredPlatforms(),
                "Registered platforms fetched"));
    }

    @PostMapping("/{platform}/initialize")
    @Operation(summary = "Authenticate and resolve account ids")
    public ResponseEntity<ApiResponse<Map<String, Object>>> initialize(@PathVariable Platform platform) {
        log.info("POST /platforms/{}/initialize", platform.getValue());
        return ResponseStatuses.toEntity(adPlatformService.initialize(platform), HttpStatus.OK);
    }

    @GetMapping("/{platform}/auth")
    @Operation(summary = "Get authentication state")
    public ResponseEntity<ApiResponse<AuthState>> getAuthStatus(@PathVariable Platform platform) {
        return ResponseEntity.ok(adPlatformService.getAuthStatus(platform));
    }

    @PostMapping("/{platform}/auth/refresh")
    @Operation(summary = "Refresh the platform token", description = "X tokens cannot be refreshed")
    public ResponseEntity<ApiResponse<AuthState>> refresh(@PathVariable Platform platform) {
        log.info("POST /platforms/{}/auth/refresh", platform.getValue());
        return ResponseStatuses.toEntity(adPlatformService.refreshAuth(platform), HttpStatus.OK);
    }

    @DeleteMapping("/{platform}/auth")
    @Operation(summary = "Log out", description = "Cancels the refresh timer and clears the stored token")
    public ResponseEntity<ApiResponse<Void>> logout(@PathVariable Platform platform) {
        log.info("DELETE /platforms/{}/auth", platform.getValue());
        return ResponseEntity.ok(adPlatformService.logout(platform));
    }
}
