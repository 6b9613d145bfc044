package com.sqconfig.core.model;

import com.sqconfig.core.client.FakeApiTransport;
import com.sqconfig.core.client.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Local payload updates after a successful remote change happen under the
 * object's monitor, like refreshes.
 */
class PayloadUpdateTest {

    private FakeApiTransport transport;
    private Platform platform;

    @BeforeEach
    void setUp() {
        transport = FakeApiTransport.withEdition("community");
        transport.onGet("projects/search", Map.of("components", List.of(
                Map.of("key", "app", "name", "app", "visibility", "private"))));
        transport.onGet("qualityprofiles/search", Map.of("profiles", List.of(
                Map.of("key", "qp1", "language", "java", "name", "Child"))));
        platform = transport.platform();
    }

    @Test
    @DisplayName("setVisibility waits for the project's monitor before updating the payload")
    void visibilityUpdateHoldsMonitor() throws Exception {
        var project = Project.search(platform).get("app");
        CompletableFuture<Void> update;
        synchronized (project) {
            update = CompletableFuture.runAsync(() -> project.setVisibility("public"));
            Thread.sleep(200);
            assertFalse(update.isDone());
        }
        update.get(5, TimeUnit.SECONDS);
        assertEquals("public", project.visibility());
        assertEquals(1, transport.posts("projects/update_visibility").size());
    }

    @Test
    @DisplayName("setParent waits for the profile's monitor before updating the payload")
    void parentUpdateHoldsMonitor() throws Exception {
        var profile = QualityProfile.search(platform).get(0);
        CompletableFuture<Void> update;
        synchronized (profile) {
            update = CompletableFuture.runAsync(() -> profile.setParent("Base"));
            Thread.sleep(200);
            assertFalse(update.isDone());
        }
        update.get(5, TimeUnit.SECONDS);
        assertEquals("Base", profile.parentName().orElseThrow());
    }
}
