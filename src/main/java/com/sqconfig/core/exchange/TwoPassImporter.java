package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectAlreadyExistsException;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.logging.MdcContext;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.runner.OutcomeStatus;
import com.sqconfig.core.runner.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Imports one document section with a given {@link ImportStrategy}.
 *
 * <p>Pass 1 runs sequentially in item order so parents always exist before their
 * children: each item is created unless it already exists. Pass 2 applies
 * composition to every item that made it through pass 1, concurrently unless the
 * strategy asks for ordering. A failing item is recorded as FAILED with its reason
 * and the import moves on.
 */
public class TwoPassImporter {

    private static final Logger log = LoggerFactory.getLogger(TwoPassImporter.class);

    private static final String OPERATION = "import";

    private final SyncMetrics metrics;

    public TwoPassImporter(SyncMetrics metrics) {
        this.metrics = metrics;
    }

    public RunSummary run(Platform platform, ImportStrategy strategy, JsonNode section, Pattern keyPattern,
                          ConcurrentTaskRunner runner, ImportReport report) {
        var type = strategy.type();
        var items = strategy.items(section).stream()
                .filter(i -> keyPattern == null || keyPattern.matcher(i.key()).matches())
                .toList();
        log.info("Importing {} {}", items.size(), type.section());

        var ready = new ArrayList<ImportItem>();
        var created = new HashSet<String>();
        for (var item : items) {
            MdcContext.setObject(OPERATION, type.section(), item.key());
            try {
                var skip = strategy.skipReason(item);
                if (skip.isPresent()) {
                    log.info("Skipping {}: {}", item, skip.get());
                    record(report, item, ImportStatus.SKIPPED, skip.get());
                    continue;
                }
                if (ensureExists(platform, strategy, item)) {
                    created.add(item.key());
                }
                strategy.createOwned(platform, item);
                ready.add(item);
            } catch (SqConfigException e) {
                log.error("Creation of {} failed: {}", item, e.getMessage());
                record(report, item, ImportStatus.FAILED, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure creating {}", item, e);
                record(report, item, ImportStatus.FAILED, e.toString());
            } finally {
                MdcContext.clear();
            }
        }

        if (strategy.composeInOrder()) {
            return composeInOrder(platform, strategy, ready, created, report);
        }
        return runner.run(OPERATION, ready, ImportItem::toString,
                item -> {
                    strategy.compose(platform, item);
                    return item;
                },
                outcome -> {
                    var item = outcome.item();
                    if (outcome.isSuccess()) {
                        record(report, item, created.contains(item.key()) ? ImportStatus.CREATED : ImportStatus.UPDATED, null);
                    } else {
                        log.error("Composition of {} failed: {}", item, outcome.message());
                        record(report, item, ImportStatus.FAILED,
                                outcome.message() != null ? outcome.message() : outcome.status().name());
                    }
                });
    }

    /**
     * @return true if the item was created, false if it already existed
     */
    private boolean ensureExists(Platform platform, ImportStrategy strategy, ImportItem item) {
        if (strategy.exists(platform, item)) {
            log.debug("{} already exists", item);
            return false;
        }
        try {
            strategy.create(platform, item);
            return true;
        } catch (ObjectAlreadyExistsException e) {
            log.info("{} was created concurrently, using the existing one", item);
            if (!strategy.exists(platform, item)) {
                throw e;
            }
            return false;
        }
    }

    private RunSummary composeInOrder(Platform platform, ImportStrategy strategy, List<ImportItem> items,
                                      Set<String> created, ImportReport report) {
        var failures = new EnumMap<OutcomeStatus, Integer>(OutcomeStatus.class);
        int succeeded = 0;
        for (var item : items) {
            MdcContext.setObject(OPERATION, strategy.type().section(), item.key());
            long start = System.nanoTime();
            try {
                strategy.compose(platform, item);
                record(report, item, created.contains(item.key()) ? ImportStatus.CREATED : ImportStatus.UPDATED, null);
                succeeded++;
                recordTask("SUCCESS", start);
            } catch (SqConfigException e) {
                log.error("Composition of {} failed: {}", item, e.getMessage());
                record(report, item, ImportStatus.FAILED, e.getMessage());
                failures.merge(OutcomeStatus.DOMAIN_ERROR, 1, Integer::sum);
                recordTask(OutcomeStatus.DOMAIN_ERROR.name(), start);
            } catch (RuntimeException e) {
                log.error("Unexpected failure composing {}", item, e);
                record(report, item, ImportStatus.FAILED, e.toString());
                failures.merge(OutcomeStatus.UNEXPECTED_ERROR, 1, Integer::sum);
                recordTask(OutcomeStatus.UNEXPECTED_ERROR.name(), start);
            } finally {
                MdcContext.clear();
            }
        }
        var summary = new RunSummary(OPERATION, items.size(), succeeded, failures);
        log.info("{}", summary);
        if (metrics != null) {
            metrics.recordRun(OPERATION, summary.total(), summary.failed());
        }
        return summary;
    }

    private void recordTask(String outcome, long startNanos) {
        if (metrics != null) {
            metrics.recordTask(OPERATION, outcome, (System.nanoTime() - startNanos) / 1_000_000);
        }
    }

    private void record(ImportReport report, ImportItem item, ImportStatus status, String reason) {
        report.record(item.type(), item.key(), status, reason);
        if (metrics != null) {
            metrics.recordImport(item.type().section(), status.name());
        }
    }
}
