package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Edition;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;
import com.sqconfig.core.selection.SelectionMode;
import com.sqconfig.core.selection.SelectionModeEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A portfolio, identified by its key. Requires the enterprise edition or above.
 *
 * <p>Sub-portfolios are either owned ({@code SVW}, created under this portfolio) or
 * references to another top-level portfolio ({@code VW}). Both are exported under
 * {@code subPortfolios}, references flagged {@code byReference: true}.
 */
public class Portfolio extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    public static final String QUALIFIER_PORTFOLIO = "VW";
    public static final String QUALIFIER_SUB_PORTFOLIO = "SVW";

    private final String portfolioKey;
    private SelectionModeEngine selection;
    private ObjectNode permissions;

    private Portfolio(Platform platform, String key, JsonNode data) {
        super(platform, cacheKey(platform, key), data);
        this.portfolioKey = key;
    }

    public static CacheKey cacheKey(Platform platform, String key) {
        return CacheKey.of(platform.endpointId(), ObjectType.PORTFOLIO, key);
    }

    public static Portfolio get(Platform platform, String key) {
        platform.requireEdition(Edition.ENTERPRISE, "Portfolios");
        return platform.cache().getOrCreate(cacheKey(platform, key),
                () -> new Portfolio(platform, key, show(platform, key)));
    }

    public static boolean exists(Platform platform, String key) {
        try {
            get(platform, key);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    /**
     * Top-level portfolios. Listing returns summaries only, so each portfolio is
     * resolved through {@link #get} to obtain its full definition.
     */
    public static Map<String, Portfolio> search(Platform platform) {
        platform.requireEdition(Edition.ENTERPRISE, "Portfolios");
        var result = new LinkedHashMap<String, Portfolio>();
        for (JsonNode node : platform.searchAll("views/search", Params.of("qualifiers", QUALIFIER_PORTFOLIO), "components")) {
            var key = node.path("key").asText();
            result.put(key, get(platform, key));
        }
        return result;
    }

    /**
     * Creates a portfolio. With a non-null {@code parentKey} the new portfolio is a
     * sub-portfolio owned by that parent.
     */
    public static Portfolio create(Platform platform, String key, String name, String parentKey,
                                   String description, String visibility) {
        platform.requireEdition(Edition.ENTERPRISE, "Portfolios");
        platform.post("views/create", Params.of("key", key, "name", name, "parent", parentKey,
                "description", description, "visibility", parentKey == null ? visibility : null));
        log.info("Created portfolio '{}'{}", key, parentKey == null ? "" : " under '" + parentKey + "'");
        return get(platform, key);
    }

    @Override
    public ObjectType type() {
        return ObjectType.PORTFOLIO;
    }

    @Override
    public String key() {
        return portfolioKey;
    }

    @Override
    public String url() {
        return platform.link("/portfolio?id=" + URLEncoder.encode(portfolioKey, StandardCharsets.UTF_8));
    }

    public String qualifier() {
        return payload().path("qualifier").asText(QUALIFIER_PORTFOLIO);
    }

    public synchronized SelectionModeEngine selection() {
        if (selection == null) {
            selection = new SelectionModeEngine(platform, portfolioKey, () -> SelectionMode.fromPortfolio(payload()));
        }
        return selection;
    }

    /**
     * Direct sub-portfolios as returned by the platform.
     */
    public List<JsonNode> subPortfolios() {
        var subs = new ArrayList<JsonNode>();
        payload().path("subViews").forEach(subs::add);
        return subs;
    }

    public synchronized ObjectNode permissions() {
        if (permissions == null) {
            permissions = Permissions.fetch(platform, portfolioKey);
        }
        return permissions;
    }

    public void setPermissions(JsonNode wanted) {
        Permissions.apply(platform, portfolioKey, wanted);
        synchronized (this) {
            permissions = null;
        }
    }

    public void addReference(String referencedKey) {
        platform.post("views/add_portfolio", Params.of("portfolio", portfolioKey, "reference", referencedKey));
        log.debug("Portfolio '{}' now references '{}'", portfolioKey, referencedKey);
    }

    /**
     * Keys of the portfolios this one references directly.
     */
    public List<String> references() {
        var refs = new ArrayList<String>();
        for (JsonNode sub : subPortfolios()) {
            if (isReference(sub)) {
                refs.add(referenceKey(sub));
            }
        }
        return refs;
    }

    /**
     * Triggers recomputation of the portfolio after its composition changed.
     */
    public void recompute() {
        platform.post("views/refresh", Params.of("key", portfolioKey));
    }

    @Override
    protected JsonNode fetch() {
        return show(platform, portfolioKey);
    }

    @Override
    protected void resetDerived() {
        selection = null;
        permissions = null;
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = exportDefinition(payload(), selection().currentMode());
        node.put("visibility", payload().path("visibility").asText("public"));
        node.set("permissions", permissions().deepCopy());
        return node;
    }

    private ObjectNode exportDefinition(JsonNode data, SelectionMode mode) {
        var node = newNode();
        node.put("key", data.path("key").asText());
        node.put("name", data.path("name").asText());
        var description = data.path("desc").asText(data.path("description").asText(""));
        if (!description.isEmpty()) {
            node.put("description", description);
        }
        node.set("selectionMode", mode.toJson(platform.mapper()));
        var subs = data.path("subViews");
        if (subs.size() > 0) {
            var subsNode = node.putObject("subPortfolios");
            for (JsonNode sub : subs) {
                if (isReference(sub)) {
                    var ref = newNode();
                    ref.put("byReference", true);
                    subsNode.set(referenceKey(sub), ref);
                } else {
                    subsNode.set(sub.path("key").asText(), exportDefinition(sub, SelectionMode.fromPortfolio(sub)));
                }
            }
        }
        return node;
    }

    public static boolean isReference(JsonNode subView) {
        return QUALIFIER_PORTFOLIO.equals(subView.path("qualifier").asText());
    }

    private static String referenceKey(JsonNode subView) {
        return subView.path("originalKey").asText(subView.path("key").asText());
    }

    private static JsonNode show(Platform platform, String key) {
        return platform.get("views/show", Params.of("key", key));
    }
}
