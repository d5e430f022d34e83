package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SettingsSource {
    WORKSPACE_DATABASE("workspace_database"),
    ENVIRONMENT_DEFAULTS("environment_defaults");

    private final String value;

    SettingsSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
