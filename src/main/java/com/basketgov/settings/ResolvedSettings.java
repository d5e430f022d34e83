package com.basketgov.settings;

public record ResolvedSettings(GovernanceFlags settings, SettingsSource source) {
}
