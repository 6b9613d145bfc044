package com.sqconfig.core.model;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateConditionTest {

    @Test
    void decodesCompactForm() {
        var c = QualityGateCondition.decode("new_coverage <= 80");
        assertEquals("new_coverage", c.metric());
        assertEquals("LT", c.op());
        assertEquals("80", c.error());
        assertNull(c.id());
    }

    @Test
    @DisplayName("rating letters are converted both ways")
    void ratingsUseLetters() {
        var c = QualityGateCondition.decode("new_security_rating >= B");
        assertEquals("2", c.error());
        assertEquals("GT", c.op());
        assertEquals("new_security_rating >= B", c.encode());
        assertEquals("new_reliability_rating >= A",
                new QualityGateCondition("12", "new_reliability_rating", "GT", "1").encode());
    }

    @Test
    void sameAsIgnoresIdAndNumberFormat() {
        var remote = new QualityGateCondition("AX1", "new_coverage", "LT", "80.0");
        assertTrue(remote.sameAs(QualityGateCondition.decode("new_coverage <= 80")));
        assertFalse(remote.sameAs(QualityGateCondition.decode("new_coverage >= 80")));
    }

    @Test
    void malformedConditionsRejected() {
        var e = assertThrows(SqConfigException.class, () -> QualityGateCondition.decode("coverage 80"));
        assertEquals(ErrorCode.ARGS_ERROR, e.errorCode());
        assertThrows(SqConfigException.class, () -> QualityGateCondition.decode("coverage == 80"));
    }

    @Test
    void nonNumericThresholdIsNaN() {
        assertTrue(Double.isNaN(new QualityGateCondition(null, "m", "GT", "x").threshold()));
    }
}
