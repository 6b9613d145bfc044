package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.Application;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RuleId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ApplicationAuditor implements ObjectAuditor<Application> {

    @Override
    public ObjectType type() {
        return ObjectType.APPLICATION;
    }

    @Override
    public List<Application> list(Platform platform) {
        return new ArrayList<>(Application.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(Application application, AuditSettings settings) {
        var subject = application.toString();
        return switch (application.projects().size()) {
            case 0 -> List.of(AuditProblem.of(RuleId.APPLICATION_EMPTY, subject, application.url(), subject));
            case 1 -> List.of(AuditProblem.of(RuleId.APPLICATION_SINGLETON, subject, application.url(), subject));
            default -> List.of();
        };
    }
}
