package com.offy.competition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.Optional;

/**
 * What a challenge measures: either one named app or the sum of all apps.
 */
public final class TargetApp {

    public static final String ALL_SENTINEL = "ALL";

    private static final TargetApp ALL = new TargetApp(null);

    private final String appName;

    private TargetApp(String appName) {
        this.appName = appName;
    }

    public static TargetApp all() {
        return ALL;
    }

    public static TargetApp specific(String appName) {
        if (appName == null || appName.trim().isEmpty()) {
            throw new IllegalArgumentException("App name cannot be null or empty");
        }
        if (ALL_SENTINEL.equalsIgnoreCase(appName.trim())) {
            return ALL;
        }
        return new TargetApp(appName.trim());
    }

    @JsonCreator
    public static TargetApp fromStorageValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Target app cannot be null or empty");
        }
        return ALL_SENTINEL.equalsIgnoreCase(value.trim()) ? ALL : new TargetApp(value.trim());
    }

    public boolean isAll() {
        return appName == null;
    }

    public Optional<String> getAppName() {
        return Optional.ofNullable(appName);
    }

    /**
     * A log row counts toward this target when the target is ALL or names the row's app exactly.
     */
    public boolean matches(String logAppName) {
        if (isAll()) {
            return true;
        }
        return appName.equals(logAppName);
    }

    @JsonValue
    public String toStorageValue() {
        return isAll() ? ALL_SENTINEL : appName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetApp)) {
            return false;
        }
        return Objects.equals(appName, ((TargetApp) o).appName);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(appName);
    }

    @Override
    public String toString() {
        return toStorageValue();
    }
}
