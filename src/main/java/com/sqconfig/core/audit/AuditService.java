package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.UnsupportedFeatureException;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RemoteObject;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.runner.RunSummary;
import com.sqconfig.core.writer.StreamingResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Audits a platform: for each requested object type, lists the objects, audits
 * them in parallel and streams the problems to a writer as they are found.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<ObjectAuditor<?>> auditors;
    private final SyncMetrics metrics;

    public AuditService(List<ObjectAuditor<?>> auditors, SyncMetrics metrics) {
        this.auditors = auditors.stream()
                .sorted(Comparator.comparing((ObjectAuditor<?> a) -> a.type()))
                .toList();
        this.metrics = metrics;
    }

    /**
     * @param types       object types to audit
     * @param explicit    whether the types were requested explicitly; if so an
     *                    unsupported type aborts the audit instead of being skipped
     * @param keyPattern  only objects whose key matches are audited, null for all
     * @param writer      started writer receiving the problems; finished by the caller
     */
    public AuditReport audit(Platform platform, Set<ObjectType> types, boolean explicit, AuditSettings settings,
                             Pattern keyPattern, ConcurrentTaskRunner runner, StreamingResultWriter<AuditProblem> writer) {
        var found = new AtomicLong();
        var runs = new LinkedHashMap<ObjectType, RunSummary>();
        var skipped = new ArrayList<ObjectType>();

        for (var auditor : auditors) {
            if (!types.contains(auditor.type())) {
                continue;
            }
            if (!settings.isEnabled(auditor.type())) {
                log.info("Audit of {} disabled by configuration", auditor.type().section());
                continue;
            }
            try {
                runs.put(auditor.type(), auditType(platform, auditor, settings, keyPattern, runner, writer, found));
            } catch (UnsupportedFeatureException e) {
                if (explicit) {
                    throw e;
                }
                log.warn("Skipping audit of {}: {}", auditor.type().section(), e.getMessage());
                skipped.add(auditor.type());
            }
        }
        return new AuditReport(found.get(), runs, skipped);
    }

    private <T extends RemoteObject> RunSummary auditType(Platform platform, ObjectAuditor<T> auditor,
                                                          AuditSettings settings, Pattern keyPattern,
                                                          ConcurrentTaskRunner runner,
                                                          StreamingResultWriter<AuditProblem> writer, AtomicLong found) {
        var objects = auditor.list(platform).stream()
                .filter(o -> keyPattern == null || keyPattern.matcher(o.key()).matches())
                .toList();
        log.info("Auditing {} {}", objects.size(), auditor.type().section());

        var summary = runner.run("audit", objects, RemoteObject::toString,
                o -> auditor.audit(o, settings),
                outcome -> {
                    if (outcome.isSuccess()) {
                        publish(outcome.result(), writer, found);
                    } else {
                        platform.cache().invalidateIfGone(outcome);
                    }
                });
        publish(auditor.auditAll(objects, settings), writer, found);
        return summary;
    }

    private void publish(List<AuditProblem> problems, StreamingResultWriter<AuditProblem> writer, AtomicLong found) {
        if (problems.isEmpty()) {
            return;
        }
        found.addAndGet(problems.size());
        problems.forEach(p -> metrics.recordAuditProblem(p.ruleId().name(), p.severity().name()));
        writer.submit(problems);
    }
}
