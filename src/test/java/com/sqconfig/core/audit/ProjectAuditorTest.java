package com.sqconfig.core.audit;

import com.sqconfig.core.client.FakeApiTransport;
import com.sqconfig.core.client.HttpMethod;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.Project;
import com.sqconfig.core.model.RuleId;
import com.sqconfig.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProjectAuditorTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final ProjectAuditor auditor = new ProjectAuditor(NOW);
    private final AuditSettings settings = AuditSettings.defaults();
    private final List<Map<String, Object>> projects = new ArrayList<>();
    private final Map<String, Integer> ncloc = new HashMap<>();
    private final Set<String> withoutAdmin = new HashSet<>();
    private Platform platform;

    @BeforeEach
    void setUp() {
        var transport = FakeApiTransport.withEdition("community");
        transport.onGet("projects/search", Map.of("components", projects));
        transport.on(HttpMethod.GET, "measures/component", params -> Map.of("component", Map.of("measures",
                List.of(Map.of("metric", "ncloc", "value", String.valueOf(ncloc.getOrDefault(params.get("component"), 100)))))));
        transport.onGet("permissions/users", Map.of("users", List.of()));
        transport.on(HttpMethod.GET, "permissions/groups", params -> withoutAdmin.contains(params.get("projectKey"))
                ? Map.of("groups", List.of(Map.of("name", "devs", "permissions", List.of("user"))))
                : Map.of("groups", List.of(Map.of("name", "admins", "permissions", List.of("admin", "user")))));
        platform = transport.platform();
    }

    private void project(String key, String visibility, String lastAnalysis) {
        var data = new HashMap<String, Object>(Map.of("key", key, "name", key, "visibility", visibility));
        if (lastAnalysis != null) {
            data.put("lastAnalysisDate", lastAnalysis);
        }
        projects.add(data);
    }

    private List<AuditProblem> audit(String key) {
        return auditor.audit(Project.search(platform).get(key), settings);
    }

    @Nested
    @DisplayName("single project rules")
    class Single {

        @Test
        void healthyProject() {
            project("ok", "private", "2024-12-20T10:00:00+0000");
            assertEquals(List.of(), audit("ok"));
        }

        @Test
        void neverAnalyzed() {
            project("new", "private", null);
            assertEquals(List.of(RuleId.PROJ_NOT_ANALYZED), audit("new").stream().map(AuditProblem::ruleId).toList());
        }

        @Test
        @DisplayName("analysis older than a year is high severity")
        void staleAnalysis() {
            project("stale", "private", "2024-05-01T00:00:00+0000");
            project("ancient", "private", "2023-06-01T00:00:00+0000");
            var stale = audit("stale");
            assertEquals(RuleId.PROJ_LAST_ANALYSIS, stale.get(0).ruleId());
            assertEquals(Severity.MEDIUM, stale.get(0).severity());
            assertEquals(Severity.HIGH, audit("ancient").get(0).severity());
        }

        @Test
        void publicEmptyProjectWithoutAdmin() {
            project("leaky", "public", "2024-12-20T10:00:00+0000");
            ncloc.put("leaky", 0);
            withoutAdmin.add("leaky");
            assertEquals(List.of(RuleId.PROJ_ZERO_LOC, RuleId.PROJ_VISIBILITY, RuleId.OBJECT_WITH_NO_ADMIN_PERMISSION),
                    audit("leaky").stream().map(AuditProblem::ruleId).toList());
        }

        @Test
        void visibilityCheckCanBeDisabled() {
            project("pub", "public", "2024-12-20T10:00:00+0000");
            var relaxed = settings.withOverrides(Map.of("audit.projects.visibility", "false"));
            assertEquals(List.of(), auditor.audit(Project.search(platform).get("pub"), relaxed));
        }
    }

    @Nested
    @DisplayName("duplicates")
    class Duplicates {

        @Test
        void extendedKeysNeedSeparator() {
            var pairs = ProjectAuditor.extendedKeys(List.of("acme", "acme-copy", "acme2", "beta"), false);
            assertEquals(1, pairs.size());
            assertArrayEquals(new String[]{"acme", "acme-copy"}, pairs.get(0));
        }

        @Test
        @DisplayName("prefixed and suffixed copies are both reported")
        void prefixAndSuffix() {
            project("acme", "private", "2024-12-20T10:00:00+0000");
            project("acme-copy", "private", "2024-12-20T10:00:00+0000");
            project("copy_acme", "private", "2024-12-20T10:00:00+0000");
            project("other", "private", "2024-12-20T10:00:00+0000");
            var problems = auditor.auditAll(auditor.list(platform), settings);
            assertEquals(List.of("Project 'acme-copy'", "Project 'copy_acme'"),
                    problems.stream().map(AuditProblem::subject).sorted().toList());
            assertTrue(problems.stream().allMatch(p -> p.ruleId() == RuleId.PROJ_DUPLICATE));
        }
    }
}
