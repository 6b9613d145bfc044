package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqconfig.core.client.FakeApiTransport;
import com.sqconfig.core.client.HttpMethod;
import com.sqconfig.core.error.ObjectNotFoundException;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioImportTest {

    private static final String DOC = """
            {"portfolios": {
              "ALL": {"key": "ALL", "name": "All", "selectionMode": {"mode": "NONE"},
                      "subPortfolios": {
                        "ALL_TEAM": {"key": "ALL_TEAM", "name": "Team",
                                     "selectionMode": {"mode": "MANUAL", "projects": {"p1": []}}},
                        "BU": {"byReference": true}}},
              "BU": {"key": "BU", "name": "Business", "selectionMode": {"mode": "TAGS", "tags": ["bu"]}}}}
            """;

    /**
     * Portfolio state: key to {name, parent, mode, projects, references}.
     */
    private final Map<String, Map<String, Object>> portfolios = new LinkedHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();
    private FakeApiTransport transport;
    private ConcurrentTaskRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ConcurrentTaskRunner(2, Duration.ofSeconds(10), null);
        transport = FakeApiTransport.withEdition("enterprise");
        transport.on(HttpMethod.GET, "views/show", params -> show(params.get("key")));
        transport.onPost("views/create", params -> {
            synchronized (portfolios) {
                var state = new LinkedHashMap<String, Object>();
                state.put("name", params.get("name"));
                state.put("parent", params.get("parent"));
                state.put("mode", "NONE");
                state.put("projects", new ArrayList<String>());
                state.put("references", new ArrayList<String>());
                portfolios.put(params.get("key"), state);
                return "";
            }
        });
        transport.onPost("views/set_manual_mode", params -> setMode(params.get("portfolio"), "MANUAL"));
        transport.onPost("views/set_tags_mode", params -> setMode(params.get("portfolio"), "TAGS"));
        transport.onPost("views/add_project", params -> {
            synchronized (portfolios) {
                list(params.get("key"), "projects").add(params.get("project"));
                return "";
            }
        });
        transport.onPost("views/add_portfolio", params -> {
            synchronized (portfolios) {
                list(params.get("portfolio"), "references").add(params.get("reference"));
                return "";
            }
        });
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @SuppressWarnings("unchecked")
    private List<String> list(String key, String field) {
        return (List<String>) portfolios.get(key).get(field);
    }

    private Object setMode(String key, String mode) {
        synchronized (portfolios) {
            portfolios.get(key).put("mode", mode);
            return "";
        }
    }

    private Map<String, Object> show(String key) {
        synchronized (portfolios) {
            var state = portfolios.get(key);
            if (state == null) {
                throw new ObjectNotFoundException("No portfolio " + key);
            }
            var json = new LinkedHashMap<String, Object>();
            json.put("key", key);
            json.put("name", state.get("name"));
            json.put("qualifier", state.get("parent") == null ? "VW" : "SVW");
            json.put("selectionMode", state.get("mode"));
            var selected = new ArrayList<Map<String, Object>>();
            list(key, "projects").forEach(p -> selected.add(Map.of("projectKey", p, "selectedBranches", List.of())));
            json.put("selectedProjects", selected);
            var subViews = new ArrayList<Map<String, Object>>();
            portfolios.forEach((childKey, child) -> {
                if (key.equals(child.get("parent"))) {
                    subViews.add(show(childKey));
                }
            });
            list(key, "references").forEach(r -> subViews.add(Map.of("key", key + ":" + r, "originalKey", r,
                    "qualifier", "VW")));
            json.put("subViews", subViews);
            return json;
        }
    }

    private ImportReport importDocument() throws Exception {
        return new ConfigImporter(null).importConfig(transport.platform(), mapper.readTree(DOC),
                EnumSet.allOf(ObjectType.class), false, null, runner);
    }

    @Test
    @DisplayName("owned sub-portfolios are created under their parent and references linked")
    void createsTree() throws Exception {
        var report = importDocument();

        assertTrue(report.failures().isEmpty(), report.failures().toString());
        assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.PORTFOLIO, "ALL"));
        assertEquals(ImportStatus.CREATED, report.statusOf(ObjectType.PORTFOLIO, "BU"));
        assertEquals("ALL", portfolios.get("ALL_TEAM").get("parent"));
        assertNull(portfolios.get("BU").get("parent"));
        assertEquals(List.of("BU"), list("ALL", "references"));
        assertEquals("MANUAL", portfolios.get("ALL_TEAM").get("mode"));
        assertEquals(List.of("p1"), list("ALL_TEAM", "projects"));
        assertEquals("TAGS", portfolios.get("BU").get("mode"));
        assertEquals("bu", transport.posts("views/set_tags_mode").get(0).param("tags"));
        assertEquals(2, transport.posts("views/refresh").size());
    }

    @Test
    void secondImportCreatesNothing() throws Exception {
        importDocument();
        transport.clearCalls();

        var report = importDocument();

        assertEquals(ImportStatus.UPDATED, report.statusOf(ObjectType.PORTFOLIO, "ALL"));
        assertTrue(transport.posts("views/create").isEmpty());
        assertTrue(transport.posts("views/add_portfolio").isEmpty());
        assertTrue(transport.posts("views/add_project").isEmpty());
        assertTrue(transport.posts("views/set_manual_mode").isEmpty());
        assertEquals(List.of("BU"), list("ALL", "references"));
    }
}
