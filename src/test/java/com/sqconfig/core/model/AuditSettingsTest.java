package com.sqconfig.core.model;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditSettingsTest {

    @Test
    void defaultsLoadedFromClasspath() {
        var settings = AuditSettings.defaults();
        assertEquals(8, settings.getInt("audit.qualitygates.maxConditions", 0));
        assertTrue(settings.isEnabled(ObjectType.PROJECT));
    }

    @Test
    void overridesReplaceSingleKeys() {
        var settings = AuditSettings.defaults().withOverrides(Map.of("audit.projects", "false",
                "audit.projects.maxLastAnalysisAge", "30"));
        assertFalse(settings.isEnabled(ObjectType.PROJECT));
        assertEquals(30, settings.getInt("audit.projects.maxLastAnalysisAge", 0));
        assertEquals(5, settings.getInt("audit.qualitygates.maxNumber", 0));
    }

    @Test
    void missingKeyUsesDefault() {
        var settings = AuditSettings.of(Map.of());
        assertEquals(7, settings.getInt("nope", 7));
        assertTrue(settings.getBoolean("nope", true));
    }

    @Test
    void nonIntegerValueIsArgumentError() {
        var settings = AuditSettings.of(Map.of("audit.users.maxLoginAge", "soon"));
        var e = assertThrows(SqConfigException.class, () -> settings.getInt("audit.users.maxLoginAge", 1));
        assertEquals(ErrorCode.ARGS_ERROR, e.errorCode());
    }
}
