package com.calcifer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunSettingsTest {

    @Test
    @DisplayName("minor version accepts a leading v and patch releases")
    void minorVersion() {
        assertEquals("v1.30", RunSettings.empty().k8sMinorVersion());
        assertEquals("v1.29", RunSettings.of(Map.of(RunSettings.K8S_VERSION, "v1.29.7")).k8sMinorVersion());
        assertEquals("v1", RunSettings.of(Map.of(RunSettings.K8S_VERSION, "1")).k8sMinorVersion());
    }

    @Test
    @DisplayName("with returns a copy and blank values remove the key")
    void with() {
        RunSettings base = RunSettings.of(Map.of(RunSettings.FLUX_BRANCH, "main"));

        RunSettings changed = base.with(RunSettings.FLUX_BRANCH, "release");
        RunSettings removed = base.with(RunSettings.FLUX_BRANCH, " ");

        assertEquals("main", base.get(RunSettings.FLUX_BRANCH).orElseThrow());
        assertEquals("release", changed.get(RunSettings.FLUX_BRANCH).orElseThrow());
        assertFalse(removed.has(RunSettings.FLUX_BRANCH));
    }

    @Test
    @DisplayName("toString shows keys but never values")
    void toStringHidesValues() {
        RunSettings settings = RunSettings.of(Map.of(RunSettings.AZURE_SUBSCRIPTION_ID, "0000-secret-sub"));

        assertFalse(settings.toString().contains("0000-secret-sub"));
        assertTrue(settings.toString().contains(RunSettings.AZURE_SUBSCRIPTION_ID));
    }
}
