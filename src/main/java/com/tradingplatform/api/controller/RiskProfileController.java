package com.tradingplatform.api.controller;

import com.tradingplatform.api.dto.request.RiskProfileRequest;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.risk.RiskManager;
import com.tradingplatform.risk.RiskProfile;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CRUD for risk profiles.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/profiles -- all profiles, sorted by id</li>
 *   <li>GET /api/risk/profiles/{id}</li>
 *   <li>POST /api/risk/profiles -- create; a duplicate id is a 400</li>
 *   <li>PUT /api/risk/profiles/{id} -- full replace, bumps the version</li>
 *   <li>DELETE /api/risk/profiles/{id}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk/profiles")
public class RiskProfileController {

    private static final Logger log = LoggerFactory.getLogger(RiskProfileController.class);

    private final RiskManager riskManager;

    public RiskProfileController(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @GetMapping
    public ResponseEntity<List<RiskProfile>> listProfiles() {
        return ResponseEntity.ok(riskManager.listRiskProfiles());
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<RiskProfile> getProfile(@PathVariable String profileId) {
        return ResponseEntity.ok(riskManager.getRiskProfile(profileId));
    }

    @PostMapping
    public ResponseEntity<RiskProfile> createProfile(@Valid @RequestBody RiskProfileRequest request) {
        RiskProfile created = riskManager.createRiskProfile(request.toProfile());
        log.info("Risk profile created: id={}, limits={}", created.getId(), created.getLimits().keySet());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{profileId}")
    public ResponseEntity<RiskProfile> updateProfile(
            @PathVariable String profileId, @Valid @RequestBody RiskProfileRequest request) {
        if (!profileId.equals(request.getId())) {
            throw OrderExecutionException.validation(
                    ErrorCode.INVALID_PARAMETER,
                    String.format("Profile ID %s in body does not match path %s", request.getId(), profileId),
                    "risk-profile-api");
        }
        RiskProfile updated = riskManager.updateRiskProfile(request.toProfile());
        log.info("Risk profile updated: id={}, version={}", updated.getId(), updated.getVersion());
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{profileId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable String profileId) {
        riskManager.deleteRiskProfile(profileId);
        log.info("Risk profile deleted: id={}", profileId);
        return ResponseEntity.noContent().build();
    }
}
