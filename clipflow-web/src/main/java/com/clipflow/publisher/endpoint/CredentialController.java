package com.clipflow.publisher.endpoint;

import com.clipflow.publisher.dto.ApiResponse;
import com.clipflow.publisher.dto.ConnectedAccounts;
import com.clipflow.publisher.dto.CredentialStatus;
import com.clipflow.publisher.dto.TokenRefreshResult;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.service.AccountConnectionService;
import com.clipflow.publisher.service.CredentialManagerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialManagerRegistry registry;
    private final AccountConnectionService connectionService;

    @GetMapping("/{platform}/status")
    public ResponseEntity<ApiResponse<CredentialStatus>> status(@PathVariable String platform) {
        return ResponseEntity.ok(ApiResponse.ok(registry.forPlatform(Platform.fromValue(platform)).status()));
    }

    @PostMapping("/{platform}/refresh")
    public ResponseEntity<ApiResponse<TokenRefreshResult>> refresh(@PathVariable String platform) {
        TokenRefreshResult result = registry.forPlatform(Platform.fromValue(platform)).refresh();
        if (!result.success()) {
            return ResponseEntity.ok(new ApiResponse<>(false, result.error(), result));
        }
        return ResponseEntity.ok(ApiResponse.success("Token refreshed", result));
    }

    @GetMapping("/facebook/callback")
    public ResponseEntity<ApiResponse<ConnectedAccounts>> facebookCallback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String error) {
        if (error != null && !error.isBlank()) {
            log.warn("Facebook authorization was declined: {}", error);
            throw new ValidationException("Authorization failed: " + error);
        }
        if (code == null || code.isBlank()) {
            throw new ValidationException("No authorization code received");
        }
        return ResponseEntity.ok(ApiResponse.success("Accounts connected", connectionService.connect(code)));
    }
}
