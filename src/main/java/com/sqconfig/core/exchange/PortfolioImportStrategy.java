package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Edition;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.hierarchy.EdgeKind;
import com.sqconfig.core.hierarchy.Hierarchy;
import com.sqconfig.core.hierarchy.HierarchyReconciler;
import com.sqconfig.core.hierarchy.TreeFields;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.Portfolio;
import com.sqconfig.core.selection.SelectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Portfolios and their sub-portfolio trees.
 *
 * <p>The whole section is read into one {@link Hierarchy}: owned sub-portfolios
 * are owned edges, {@code byReference} entries are reference edges. Pass 1 creates
 * every top-level portfolio and its owned tree; pass 2, when every portfolio of the
 * document exists, links references, applies selection modes and permissions and
 * triggers a recomputation.
 *
 * <p>Holds the hierarchy of the section being imported: use one instance per import.
 */
class PortfolioImportStrategy implements ImportStrategy {

    private static final Logger log = LoggerFactory.getLogger(PortfolioImportStrategy.class);

    static final TreeFields FIELDS = TreeFields.childrenOnly("subPortfolios");

    private Hierarchy hierarchy = new Hierarchy();

    @Override
    public ObjectType type() {
        return ObjectType.PORTFOLIO;
    }

    @Override
    public void checkSupported(Platform platform) {
        platform.requireEdition(Edition.ENTERPRISE, "Portfolios");
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        hierarchy = HierarchyReconciler.fromTree(section, FIELDS);
        var items = new ArrayList<ImportItem>();
        section.fieldNames().forEachRemaining(key -> items.add(
                new ImportItem(type(), key, hierarchy.node(key).attributes())));
        return items;
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return Portfolio.exists(platform, item.key());
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        Portfolio.create(platform, item.key(), nameOf(item.key()), null,
                item.text("description"), item.text("visibility"));
    }

    @Override
    public void createOwned(Platform platform, ImportItem item) {
        var owned = hierarchy.subtree(item.key());
        for (var key : owned.subList(1, owned.size())) {
            if (!Portfolio.exists(platform, key)) {
                var description = hierarchy.node(key).attributes().path("description").asText(null);
                Portfolio.create(platform, key, nameOf(key), hierarchy.parentOf(key).orElseThrow(), description, null);
            }
        }
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        for (var key : hierarchy.subtree(item.key())) {
            var portfolio = Portfolio.get(platform, key);
            portfolio.refresh();
            var mode = hierarchy.node(key).attributes().path("selectionMode");
            if (mode.isObject()) {
                portfolio.selection().apply(SelectionMode.fromJson(mode));
            }
            var linked = portfolio.references();
            hierarchy.children(key).forEach((child, kind) -> {
                if (kind == EdgeKind.REFERENCE && !linked.contains(child)) {
                    portfolio.addReference(child);
                }
            });
        }
        var root = Portfolio.get(platform, item.key());
        if (item.data().has("permissions")) {
            root.setPermissions(item.data().path("permissions"));
        }
        root.recompute();
        log.debug("{} composed", item);
    }

    private String nameOf(String key) {
        return hierarchy.node(key).attributes().path("name").asText(key);
    }
}
