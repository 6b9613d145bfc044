package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.UnsupportedFeatureException;
import com.sqconfig.core.model.ExportSettings;
import com.sqconfig.core.model.ObjectCatalog;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RemoteObject;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.runner.RunSummary;
import com.sqconfig.core.runner.TaskOutcome;
import com.sqconfig.core.writer.SectionEntry;
import com.sqconfig.core.writer.StreamingResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Exports a platform's configuration as one JSON document keyed by object type.
 *
 * <p>Objects are exported in parallel and streamed to the writer as soon as each
 * one is ready, except quality profiles which are buffered per language to be
 * written as inheritance trees.
 */
@Service
public class ConfigExporter {

    private static final Logger log = LoggerFactory.getLogger(ConfigExporter.class);

    public static final String PLATFORM_SECTION = "platform";

    static final List<ObjectType> EXPORT_ORDER = List.of(
            ObjectType.QUALITY_GATE,
            ObjectType.QUALITY_PROFILE,
            ObjectType.GROUP,
            ObjectType.USER,
            ObjectType.PROJECT,
            ObjectType.APPLICATION,
            ObjectType.PORTFOLIO);

    /**
     * @param explicit   whether the types were requested explicitly; if so a type
     *                   the platform does not support aborts the export
     * @param keyPattern only objects whose key matches are exported, null for all
     * @param writer     started writer receiving the document sections; finished by the caller
     */
    public ExportReport export(Platform platform, Set<ObjectType> types, boolean explicit, ExportSettings settings,
                               Pattern keyPattern, ConcurrentTaskRunner runner,
                               StreamingResultWriter<SectionEntry> writer) {
        writer.submit(SectionEntry.whole(PLATFORM_SECTION, header(platform, settings)));

        var runs = new LinkedHashMap<ObjectType, RunSummary>();
        var skipped = new ArrayList<ObjectType>();
        for (var type : EXPORT_ORDER) {
            if (!types.contains(type)) {
                continue;
            }
            try {
                var objects = ObjectCatalog.list(platform, type).stream()
                        .filter(o -> keyPattern == null || keyPattern.matcher(o.key()).matches())
                        .toList();
                log.info("Exporting {} {}", objects.size(), type.section());
                runs.put(type, type == ObjectType.QUALITY_PROFILE
                        ? exportProfiles(platform, objects, settings, runner, writer)
                        : exportType(type, objects, settings, runner, writer));
            } catch (UnsupportedFeatureException e) {
                if (explicit) {
                    throw e;
                }
                log.warn("Skipping export of {}: {}", type.section(), e.getMessage());
                skipped.add(type);
            }
        }
        return new ExportReport(runs, skipped);
    }

    private <T extends RemoteObject> RunSummary exportType(ObjectType type, List<T> objects, ExportSettings settings,
                                                           ConcurrentTaskRunner runner,
                                                           StreamingResultWriter<SectionEntry> writer) {
        return runner.run("export", objects, RemoteObject::toString,
                o -> o.export(settings),
                outcome -> {
                    if (outcome.isSuccess()) {
                        writer.submit(SectionEntry.of(type.section(), outcome.item().key(), outcome.result()));
                        return;
                    }
                    outcome.item().platform().cache().invalidateIfGone(outcome);
                    if (settings.isMigration()) {
                        writer.submit(SectionEntry.of(type.section(), outcome.item().key(), failedEntry(outcome)));
                    }
                });
    }

    private <T extends RemoteObject> RunSummary exportProfiles(Platform platform, List<T> profiles,
                                                               ExportSettings settings, ConcurrentTaskRunner runner,
                                                               StreamingResultWriter<SectionEntry> writer) {
        var exported = new ArrayList<ObjectNode>();
        var summary = runner.run("export", profiles, RemoteObject::toString,
                p -> p.export(settings),
                outcome -> {
                    if (outcome.isSuccess()) {
                        exported.add(outcome.result());
                    } else {
                        platform.cache().invalidateIfGone(outcome);
                    }
                });
        QualityProfileTrees.toSection(exported, platform.mapper()).forEach((language, tree) ->
                writer.submit(SectionEntry.of(ObjectType.QUALITY_PROFILE.section(), language, tree)));
        return summary;
    }

    /**
     * Placeholder of an object that could not be exported, so a migration document
     * still lists it.
     */
    private static ObjectNode failedEntry(TaskOutcome<? extends RemoteObject, ObjectNode> outcome) {
        var node = outcome.item().platform().mapper().createObjectNode();
        node.put("key", outcome.item().key());
        node.put("exportStatus", "FAILED/" + outcome.status());
        node.put("error", outcome.message());
        return node;
    }

    private ObjectNode header(Platform platform, ExportSettings settings) {
        var header = platform.describe();
        header.put("exportMode", settings.mode().name());
        return header;
    }
}
