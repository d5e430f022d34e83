package com.basketgov.api;

import com.basketgov.error.ForbiddenException;
import com.basketgov.settings.GovernanceSettingsService;
import com.basketgov.settings.GovernanceStatus;
import com.basketgov.settings.ResolvedSettings;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/governance")
public class GovernanceSettingsController {

    private final GovernanceSettingsService settingsService;

    public GovernanceSettingsController(GovernanceSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/settings")
    public ResolvedSettings settings(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return settingsService.current(caller.workspaceId());
    }

    /**
     * Partial update; only the fields present in the body change. Admin role
     * required.
     */
    @PutMapping("/settings")
    public Map<String, Object> update(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                      @RequestBody Map<String, Object> body) {
        if (!caller.isAdmin()) {
            throw new ForbiddenException("Admin role required to update governance settings");
        }
        ResolvedSettings updated = settingsService.update(caller.workspaceId(), body, caller.userId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("settings", updated.settings());
        response.put("source", updated.source());
        return response;
    }

    @GetMapping("/status")
    public GovernanceStatus status(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
        return settingsService.status(caller.workspaceId());
    }
}
