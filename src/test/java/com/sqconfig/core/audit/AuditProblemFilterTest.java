package com.sqconfig.core.audit;

import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.ProblemType;
import com.sqconfig.core.model.RuleId;
import com.sqconfig.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class AuditProblemFilterTest {

    private final AuditProblem visibility = AuditProblem.of(RuleId.PROJ_VISIBILITY, "Project 'a'", null, "Project 'a'");
    private final AuditProblem emptyGroup = AuditProblem.of(RuleId.GROUP_EMPTY, "Group 'g'", null, "Group 'g'");

    @Test
    void acceptAllAcceptsEverything() {
        assertTrue(AuditProblemFilter.acceptAll().test(visibility));
        assertTrue(AuditProblemFilter.acceptAll().test(emptyGroup));
    }

    @Test
    void severityAndTypeSets() {
        var high = new AuditProblemFilter(Set.of(Severity.HIGH, Severity.CRITICAL), null, null);
        assertTrue(high.test(visibility));
        assertFalse(high.test(emptyGroup));
        var operations = new AuditProblemFilter(null, Set.of(ProblemType.OPERATIONS), null);
        assertFalse(operations.test(visibility));
        assertTrue(operations.test(emptyGroup));
    }

    @Test
    void rulePatternMatchesWholeId() {
        var filter = new AuditProblemFilter(Set.of(), Set.of(), Pattern.compile("PROJ_.*"));
        assertTrue(filter.test(visibility));
        assertFalse(filter.test(emptyGroup));
        assertFalse(new AuditProblemFilter(Set.of(), Set.of(), Pattern.compile("PROJ")).test(visibility));
    }
}
