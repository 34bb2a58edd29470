package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.controllers.dto.SecretRequest;
import com.jasmin.threatguard.models.SecretRotationRecord;
import com.jasmin.threatguard.services.secrets.RotationResult;
import com.jasmin.threatguard.services.secrets.RotationStatus;
import com.jasmin.threatguard.services.secrets.SecretStrength;
import com.jasmin.threatguard.services.secrets.SecretType;
import com.jasmin.threatguard.services.secrets.SecretsManagementService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/security/secrets")
public class SecretsController {
    private final SecretsManagementService secretsService;

    @PostMapping("/{type}/rotate")
    public RotationResult rotate(@PathVariable String type,
                                 @RequestBody(required = false) SecretRequest request,
                                 @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        String reason = request == null || request.getReason() == null ? "manual_rotation" : request.getReason();
        return secretsService.rotate(SecretType.fromValue(type), actor, reason);
    }

    @PostMapping("/rotate-all")
    public List<RotationResult> rotateAll(@RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return secretsService.rotateAll(actor);
    }

    @GetMapping("/rotation-status")
    public List<RotationStatus> getRotationStatus() {
        return secretsService.getRotationStatus();
    }

    @GetMapping("/history")
    public List<SecretRotationRecord> getHistory(@RequestParam(required = false) String type,
                                                 @RequestParam(defaultValue = "50") int limit) {
        return secretsService.getRotationHistory(type == null ? null : SecretType.fromValue(type), Params.checkLimit(limit));
    }

    @PostMapping("/strength")
    public SecretStrength checkStrength(@RequestBody SecretRequest request) {
        if (request.getSecret() == null) {
            throw new IllegalArgumentException("secret is required");
        }
        return secretsService.checkSecretStrength(request.getSecret());
    }
}
