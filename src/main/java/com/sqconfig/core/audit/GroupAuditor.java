package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.Group;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RuleId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class GroupAuditor implements ObjectAuditor<Group> {

    @Override
    public ObjectType type() {
        return ObjectType.GROUP;
    }

    @Override
    public List<Group> list(Platform platform) {
        return new ArrayList<>(Group.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(Group group, AuditSettings settings) {
        if (group.isDefault() || group.memberCount() > 0) {
            return List.of();
        }
        return List.of(AuditProblem.of(RuleId.GROUP_EMPTY, group.toString(), group.url(), group.toString()));
    }
}
