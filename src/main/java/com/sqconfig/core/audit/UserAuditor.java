package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RuleId;
import com.sqconfig.core.model.User;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class UserAuditor implements ObjectAuditor<User> {

    static final String MAX_LOGIN_AGE = "audit.users.maxLoginAge";

    private final Clock clock;

    public UserAuditor() {
        this(Clock.systemUTC());
    }

    UserAuditor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ObjectType type() {
        return ObjectType.USER;
    }

    @Override
    public List<User> list(Platform platform) {
        return new ArrayList<>(User.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(User user, AuditSettings settings) {
        int maxAge = settings.getInt(MAX_LOGIN_AGE, 180);
        var lastConnection = user.lastConnection();
        if (lastConnection.isEmpty()) {
            return List.of();
        }
        long age = Duration.between(lastConnection.get().toInstant(), clock.instant()).toDays();
        if (age <= maxAge) {
            return List.of();
        }
        return List.of(AuditProblem.of(RuleId.USER_UNUSED, user.toString(), user.url(), user.toString(), age));
    }
}
