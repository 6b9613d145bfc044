package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.error.UnsupportedFeatureException;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.ExportSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Imports an export document into a platform, one object type after the other
 * so that every type finds the objects it refers to: groups and quality gates and
 * profiles before the projects using them, projects before the applications and
 * portfolios selecting them.
 */
@Service
public class ConfigImporter {

    private static final Logger log = LoggerFactory.getLogger(ConfigImporter.class);

    static final List<ObjectType> IMPORT_ORDER = List.of(
            ObjectType.GROUP,
            ObjectType.QUALITY_GATE,
            ObjectType.QUALITY_PROFILE,
            ObjectType.PROJECT,
            ObjectType.APPLICATION,
            ObjectType.PORTFOLIO);

    private final SyncMetrics metrics;

    public ConfigImporter(SyncMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @param types      object types to import, sections of other types are ignored
     * @param explicit   whether the types were requested explicitly; if so a type
     *                   the platform does not support aborts the import
     * @param keyPattern only objects whose top-level key matches are imported, null for all
     * @throws SqConfigException with {@link ErrorCode#ARGS_ERROR} if the document is
     *                           not an export document or is a migration export
     */
    public ImportReport importConfig(Platform platform, JsonNode document, Set<ObjectType> types, boolean explicit,
                                     Pattern keyPattern, ConcurrentTaskRunner runner) {
        if (document == null || !document.isObject()) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR, "Import file is not a JSON object");
        }
        var mode = document.path("platform").path("exportMode").asText(ExportSettings.ExportMode.CONFIG.name());
        if (ExportSettings.ExportMode.MIGRATION.name().equals(mode)) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR,
                    "File is a migration export and cannot be imported, use a configuration export");
        }
        if (types.contains(ObjectType.USER) && document.has(ObjectType.USER.section())) {
            log.info("Users are exported for reference only, they are not imported");
        }

        var report = new ImportReport();
        var importer = new TwoPassImporter(metrics);
        for (var type : IMPORT_ORDER) {
            var section = document.get(type.section());
            if (!types.contains(type) || section == null || !section.isObject()) {
                continue;
            }
            var strategy = strategyFor(type);
            try {
                strategy.checkSupported(platform);
                importer.run(platform, strategy, section, keyPattern, runner, report);
            } catch (UnsupportedFeatureException e) {
                if (explicit) {
                    throw e;
                }
                log.warn("Skipping import of {}: {}", type.section(), e.getMessage());
                report.skipType(type);
            } catch (IllegalArgumentException e) {
                throw new SqConfigException(ErrorCode.ARGS_ERROR,
                        "Invalid %s section: %s".formatted(type.section(), e.getMessage()), e);
            }
        }
        log.info("Import done: {}", report.counts());
        return report;
    }

    static ImportStrategy strategyFor(ObjectType type) {
        return switch (type) {
            case GROUP -> new GroupImportStrategy();
            case QUALITY_GATE -> new QualityGateImportStrategy();
            case QUALITY_PROFILE -> new QualityProfileImportStrategy();
            case PROJECT -> new ProjectImportStrategy();
            case APPLICATION -> new ApplicationImportStrategy();
            case PORTFOLIO -> new PortfolioImportStrategy();
            case USER -> throw new UnsupportedFeatureException("Users cannot be imported");
        };
    }
}
