package com.sqconfig.core.selection;

import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Drives the project selection mode of one portfolio.
 *
 * <p>Every transition issues the remote call first and replaces the local state
 * only once the call has succeeded; a failed call leaves the previous mode in
 * place. The only automatic transition is {@link #addMember}, which switches the
 * portfolio to manual mode when needed.
 */
public class SelectionModeEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionModeEngine.class);

    private final Platform platform;
    private final String portfolioKey;
    private final Supplier<SelectionMode> loader;
    private SelectionMode current;

    /**
     * @param loader reads the mode from the platform, invoked at most once, on first access
     */
    public SelectionModeEngine(Platform platform, String portfolioKey, Supplier<SelectionMode> loader) {
        this.platform = platform;
        this.portfolioKey = portfolioKey;
        this.loader = loader;
    }

    public synchronized SelectionMode currentMode() {
        if (current == null) {
            current = loader.get();
        }
        return current;
    }

    public synchronized void setManual() {
        if (currentMode() instanceof SelectionMode.Manual) {
            return;
        }
        platform.post("views/set_manual_mode", Params.of("portfolio", portfolioKey));
        transition(SelectionMode.Manual.empty());
    }

    public synchronized void setRegexp(String pattern, String branch) {
        platform.post("views/set_regexp_mode", Params.of("portfolio", portfolioKey, "regexp", pattern, "branch", branch));
        transition(new SelectionMode.Regexp(pattern, branch));
    }

    public synchronized void setTags(List<String> tags, String branch) {
        platform.post("views/set_tags_mode",
                Params.of("portfolio", portfolioKey, "tags", String.join(",", tags), "branch", branch));
        transition(new SelectionMode.Tags(tags, branch));
    }

    public synchronized void setRemaining(String branch) {
        platform.post("views/set_remaining_projects_mode", Params.of("portfolio", portfolioKey, "branch", branch));
        transition(new SelectionMode.Rest(branch));
    }

    public synchronized void setNone() {
        platform.post("views/set_none_mode", Params.of("portfolio", portfolioKey));
        transition(new SelectionMode.None());
    }

    /**
     * Adds a project (and optionally one of its branches) to the manual selection,
     * switching to manual mode first if another mode is active. A null branch means
     * the project's main branch.
     */
    public synchronized void addMember(String projectKey, String branch) {
        setManual();
        var manual = (SelectionMode.Manual) current;
        var branches = manual.projects().get(projectKey);
        if (branches == null) {
            platform.post("views/add_project", Params.of("key", portfolioKey, "project", projectKey));
        }
        if (branch != null && (branches == null || !branches.contains(branch))) {
            platform.post("views/add_project_branch",
                    Params.of("key", portfolioKey, "project", projectKey, "branch", branch));
        }
        current = manual.with(projectKey, branch);
    }

    /**
     * Brings the portfolio to {@code wanted}. Manual members already selected are kept.
     */
    public synchronized void apply(SelectionMode wanted) {
        if (wanted instanceof SelectionMode.Manual manual) {
            setManual();
            for (Map.Entry<String, Set<String>> entry : manual.projects().entrySet()) {
                if (entry.getValue().isEmpty()) {
                    addMember(entry.getKey(), null);
                } else {
                    entry.getValue().forEach(b -> addMember(entry.getKey(), b));
                }
            }
        } else if (wanted instanceof SelectionMode.Regexp regexp) {
            setRegexp(regexp.pattern(), regexp.branch());
        } else if (wanted instanceof SelectionMode.Tags tags) {
            setTags(tags.tags(), tags.branch());
        } else if (wanted instanceof SelectionMode.Rest rest) {
            setRemaining(rest.branch());
        } else if (!(currentMode() instanceof SelectionMode.None)) {
            setNone();
        }
    }

    private void transition(SelectionMode next) {
        log.debug("Portfolio '{}' selection mode {} -> {}", portfolioKey,
                current == null ? "?" : current.modeName(), next.modeName());
        current = next;
    }
}
