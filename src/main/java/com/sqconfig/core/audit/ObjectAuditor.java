package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.RemoteObject;

import java.util.List;

/**
 * Audit rules for one object type.
 */
public interface ObjectAuditor<T extends RemoteObject> {

    ObjectType type();

    /**
     * Lists the objects to audit.
     *
     * @throws com.sqconfig.core.error.UnsupportedFeatureException if the edition lacks the type
     */
    List<T> list(Platform platform);

    /**
     * Rules applying to a single object. Called concurrently for different objects.
     */
    List<AuditProblem> audit(T object, AuditSettings settings);

    /**
     * Rules spanning all objects of the type, such as counts or duplicates.
     */
    default List<AuditProblem> auditAll(List<T> objects, AuditSettings settings) {
        return List.of();
    }
}
