package com.sqconfig.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.writer.CsvRecordFormat;
import com.sqconfig.core.writer.JsonArrayRecordFormat;
import com.sqconfig.core.writer.RecordFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Output formats of audit problems.
 *
 * <p>CSV columns are {@code [Server Id,] Problem, Type, Severity, Message[, URL]};
 * JSON elements are {@code {problem, type, severity, message[, url][, serverId]}}.
 * The server id column is present when a server id is given.
 */
public final class AuditProblemFormats {

    private AuditProblemFormats() {}

    public static RecordFormat<AuditProblem> csv(char delimiter, boolean withUrl, String serverId) {
        var header = new ArrayList<String>();
        if (serverId != null) {
            header.add("Server Id");
        }
        header.addAll(List.of("Problem", "Type", "Severity", "Message"));
        if (withUrl) {
            header.add("URL");
        }
        return new CsvRecordFormat<>(header, delimiter, p -> {
            var row = new ArrayList<Object>();
            if (serverId != null) {
                row.add(serverId);
            }
            row.add(p.ruleId().name());
            row.add(p.type().name());
            row.add(p.severity().name());
            row.add(p.message());
            if (withUrl) {
                row.add(p.url() == null ? "" : p.url());
            }
            return row;
        });
    }

    public static RecordFormat<AuditProblem> json(ObjectMapper mapper, boolean withUrl, String serverId) {
        return new JsonArrayRecordFormat<>(mapper, p -> {
            var node = mapper.createObjectNode();
            node.put("problem", p.ruleId().name());
            node.put("type", p.type().name());
            node.put("severity", p.severity().name());
            node.put("message", p.message());
            if (withUrl && p.url() != null) {
                node.put("url", p.url());
            }
            if (serverId != null) {
                node.put("serverId", serverId);
            }
            return node;
        });
    }
}
