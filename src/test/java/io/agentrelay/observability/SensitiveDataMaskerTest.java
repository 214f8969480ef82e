package io.agentrelay.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksAssignmentsOfSensitiveKeys() {
        Assertions.assertEquals(
                "login failed password=*** for user ops",
                SensitiveDataMasker.maskText("login failed password=hunter2 for user ops")
        );
        Assertions.assertEquals(
                "call rejected api_key: ***",
                SensitiveDataMasker.maskText("call rejected api_key: \"k-1\"")
        );
    }

    @Test
    void masksBearerAndOpaqueTokens() {
        String bearer = SensitiveDataMasker.maskText("upstream said Bearer abc.def-ghi");
        String opaque = SensitiveDataMasker.maskText("replay id abcdefghijklmnop1234567890XYZ rejected");

        Assertions.assertFalse(bearer.contains("abc.def-ghi"), bearer);
        Assertions.assertEquals("replay id *** rejected", opaque);
    }

    @Test
    void leavesOrdinaryTextAlone() {
        Assertions.assertEquals("Agent risk_assessment_agent failed step assess_risks",
                SensitiveDataMasker.maskText("Agent risk_assessment_agent failed step assess_risks"));
        Assertions.assertNull(SensitiveDataMasker.maskText(null));
        Assertions.assertEquals("", SensitiveDataMasker.maskText(""));
    }
}
