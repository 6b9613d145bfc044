package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.error.UnsupportedFeatureException;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ConfigImporterTest {

    private static final Set<ObjectType> ALL = EnumSet.allOf(ObjectType.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ConfigImporter importer = new ConfigImporter(null);
    private ConcurrentTaskRunner runner;
    private InMemoryPlatform server;

    @BeforeEach
    void setUp() {
        runner = new ConcurrentTaskRunner(4, Duration.ofSeconds(10), null);
        server = new InMemoryPlatform("developer");
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private ImportReport importDocument(JsonNode document) {
        return importer.importConfig(server.platform(), document, ALL, false, null, runner);
    }

    @Nested
    @DisplayName("document checks")
    class DocumentChecks {

        @Test
        void migrationExportRefused() throws Exception {
            var doc = json("{\"platform\": {\"exportMode\": \"MIGRATION\"}, \"groups\": {\"g\": {}}}");
            var e = assertThrows(SqConfigException.class, () -> importDocument(doc));
            assertEquals(ErrorCode.ARGS_ERROR, e.errorCode());
            assertTrue(server.groups.isEmpty());
        }

        @Test
        void nonObjectRefused() throws Exception {
            var e = assertThrows(SqConfigException.class, () -> importDocument(json("[1, 2]")));
            assertEquals(ErrorCode.ARGS_ERROR, e.errorCode());
        }

        @Test
        void malformedConditionFailsOnlyItsGate() throws Exception {
            var doc = json("""
                    {"qualityGates": {
                       "Bad": {"conditions": ["coverage ~ 80"]},
                       "Good": {"conditions": ["new_coverage <= 80"]}}}
                    """);
            var report = importDocument(doc);
            assertEquals(ImportStatus.FAILED, report.statusOf(ObjectType.QUALITY_GATE, "Bad"));
            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.QUALITY_GATE, "Good"));
            assertEquals(1, report.failures().size());
        }
    }

    @Nested
    @DisplayName("groups and quality gates")
    class GroupsAndGates {

        private static final String DOC = """
                {"platform": {"exportMode": "CONFIG"},
                 "groups": {"devs": {"name": "devs", "description": "Developers"}, "ops": {"name": "ops"}},
                 "qualityGates": {
                   "Strict": {"name": "Strict", "isDefault": true,
                              "conditions": ["new_coverage <= 80", "new_security_rating >= A"]},
                   "Sonar way": {"name": "Sonar way", "isBuiltIn": true, "conditions": []}}}
                """;

        @Test
        @DisplayName("an unexpected failure creating one group fails only that group")
        void unexpectedCreationFailureIsolated() throws Exception {
            server.transport.onPost("user_groups/create", params -> {
                if ("ops".equals(params.get("name"))) {
                    throw new IllegalStateException("corrupted response");
                }
                synchronized (server) {
                    server.groups.put(params.get("name"), params.get("description"));
                }
                return "";
            });

            var report = importDocument(json(DOC));

            assertEquals(ImportStatus.FAILED, report.statusOf(ObjectType.GROUP, "ops"));
            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.GROUP, "devs"));
            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.QUALITY_GATE, "Strict"));
        }

        @Test
        void createsMissingObjects() throws Exception {
            var report = importDocument(json(DOC));

            assertEquals("Developers", server.groups.get("devs"));
            assertTrue(server.groups.containsKey("ops"));
            var strict = server.gates.get("Strict");
            assertEquals(2, strict.conditions().size());
            assertTrue(strict.isDefault()[0]);
            assertFalse(server.gates.containsKey("Sonar way"));

            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.GROUP, "devs"));
            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.QUALITY_GATE, "Strict"));
            assertEquals(ImportStatus.SKIPPED, report.statusOf(ObjectType.QUALITY_GATE, "Sonar way"));
        }

        @Test
        @DisplayName("importing the same document twice changes nothing the second time")
        void idempotent() throws Exception {
            importDocument(json(DOC));
            var conditionIds = server.gates.get("Strict").conditions().stream().map(c -> c.get("id")).toList();
            server.transport.clearCalls();

            var report = importDocument(json(DOC));

            assertEquals(ImportStatus.UPDATED, report.statusOf(ObjectType.GROUP, "devs"));
            assertEquals(ImportStatus.UPDATED, report.statusOf(ObjectType.QUALITY_GATE, "Strict"));
            assertTrue(server.transport.posts("user_groups/create").isEmpty());
            assertTrue(server.transport.posts("qualitygates/create").isEmpty());
            assertTrue(server.transport.posts("qualitygates/create_condition").isEmpty());
            assertTrue(server.transport.posts("qualitygates/delete_condition").isEmpty());
            assertTrue(server.transport.posts("qualitygates/set_as_default").isEmpty());
            assertEquals(conditionIds, server.gates.get("Strict").conditions().stream().map(c -> c.get("id")).toList());
        }

        @Test
        void existingGateConditionsReplaced() throws Exception {
            server.addGate("Strict", "coverage", "LT", "50", "new_coverage", "LT", "80");
            importDocument(json(DOC));
            var metrics = server.gates.get("Strict").conditions().stream().map(c -> c.get("metric")).sorted().toList();
            assertEquals(List.of("new_coverage", "new_security_rating"), metrics);
            assertEquals(1, server.transport.posts("qualitygates/delete_condition").size());
            assertEquals(1, server.transport.posts("qualitygates/create_condition").size());
        }

        @Test
        void keyPatternAndTypeSelection() throws Exception {
            var report = importer.importConfig(server.platform(), json(DOC), Set.of(ObjectType.GROUP), true,
                    Pattern.compile("dev.*"), runner);
            assertEquals(List.of("devs"), List.copyOf(server.groups.keySet()));
            assertTrue(server.gates.isEmpty());
            assertEquals(1, report.entries().size());
        }
    }

    @Nested
    @DisplayName("quality profiles")
    class Profiles {

        private static final String RULE_FMT = "{\"severity\": \"%s\", \"params\": {}}";

        private String rule(String severity) {
            return RULE_FMT.formatted(severity);
        }

        @Test
        @DisplayName("a three level inheritance chain is rebuilt with the right rules at each level")
        void threeLevels() throws Exception {
            var doc = json("""
                    {"qualityProfiles": {"java": {
                      "Base": {"name": "Base", "rules": {"r1": %s, "r2": %s}, "children": {
                        "Mid": {"name": "Mid", "addedRules": {"r3": %s}, "modifiedRules": {"r2": %s}, "children": {
                          "Leaf": {"name": "Leaf", "removedRules": ["r1"]}}}}}}}}
                    """.formatted(rule("MAJOR"), rule("MINOR"), rule("INFO"), rule("BLOCKER")));

            var report = importDocument(doc);

            assertEquals(Map.of(ImportStatus.CREATED, 3), report.counts());
            var base = server.profile("java", "Base");
            var mid = server.profile("java", "Mid");
            var leaf = server.profile("java", "Leaf");
            assertEquals(Map.of("r1", "MAJOR", "r2", "MINOR"), base.rules());
            assertEquals(Map.of("r1", "MAJOR", "r2", "BLOCKER", "r3", "INFO"), mid.rules());
            assertEquals(Map.of("r2", "BLOCKER", "r3", "INFO"), leaf.rules());
            assertNull(base.parent()[0]);
            assertEquals("Base", mid.parent()[0]);
            assertEquals("Mid", leaf.parent()[0]);
        }

        @Test
        @DisplayName("entries that are not objects are ignored and the other profiles still imported")
        void malformedEntriesIgnored() throws Exception {
            var doc = json("""
                    {"qualityProfiles": {"java": {
                      "Broken": "oops",
                      "Good": {"name": "Good", "rules": {"r1": %s}, "children": {"Bad child": 42}}}},
                     "qualityGates": {"G": {"name": "G", "conditions": ["new_coverage <= 80"]}}}
                    """.formatted(rule("MAJOR")));

            var report = importDocument(doc);

            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.QUALITY_PROFILE, "java:Good"));
            assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.QUALITY_GATE, "G"));
            assertEquals(1, server.profiles.size());
            assertEquals(Map.of("r1", "MAJOR"), server.profile("java", "Good").rules());
        }

        @Test
        void builtInProfileSkipped() throws Exception {
            var doc = json("""
                    {"qualityProfiles": {"java": {"Sonar way": {"name": "Sonar way", "isBuiltIn": true, "rules": {}}}}}
                    """);
            var report = importDocument(doc);
            assertEquals(ImportStatus.SKIPPED, report.statusOf(ObjectType.QUALITY_PROFILE, "java:Sonar way"));
            assertTrue(server.profiles.isEmpty());
        }
    }

    @Nested
    @DisplayName("edition support")
    class Editions {

        private static final String DOC = "{\"portfolios\": {\"PF\": {\"key\": \"PF\", \"name\": \"Portfolio\"}}}";

        @Test
        void unsupportedTypeSkippedWhenImplicit() throws Exception {
            var report = importDocument(json(DOC));
            assertEquals(List.of(ObjectType.PORTFOLIO), report.skippedTypes());
        }

        @Test
        void unsupportedTypeFailsWhenExplicit() {
            assertThrows(UnsupportedFeatureException.class, () -> importer.importConfig(server.platform(),
                    json(DOC), Set.of(ObjectType.PORTFOLIO), true, null, runner));
        }
    }
}
