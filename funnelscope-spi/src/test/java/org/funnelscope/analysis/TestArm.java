package org.funnelscope.analysis;

import com.google.common.collect.ImmutableMap;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TestArm {
    @DataProvider(name = "groupCodes")
    public static Object[][] groupCodes() {
        return new Object[][] {
                {"TRAVEL-A", Arm.CONTROL},
                {"TRAVEL-A2", Arm.CONTROL},
                {"TRAVEL-B", Arm.TEST},
                {"TRAVEL-B-mobile", Arm.TEST},
                {"TRAVEL-C", Arm.UNASSIGNED},
                {"OTHER-A", Arm.UNASSIGNED},
                {"TRAVELX-A", Arm.UNASSIGNED},
                {null, Arm.UNASSIGNED}
        };
    }

    @Test(dataProvider = "groupCodes")
    public void testFromGroupCode(String groupCode, Arm expected) {
        assertEquals(Arm.fromGroupCode("TRAVEL", groupCode), expected);
    }

    @Test
    public void testInMemoryAssignment() {
        ABTestConfig config = new ABTestConfig("project.dataset.ab_tests", "TRAVEL", "googleID");
        ArmAssignment assignment = new InMemoryArmAssignment(ImmutableMap.of("u1", "TRAVEL-A", "u2", "TRAVEL-B"));

        assertEquals(assignment.resolve(config, "u1"), Arm.CONTROL);
        assertEquals(assignment.resolve(config, "u2"), Arm.TEST);
        assertEquals(assignment.resolve(config, "u3"), Arm.UNASSIGNED);
        assertEquals(config.getGroupCodeColumn(), ABTestConfig.DEFAULT_GROUP_CODE_COLUMN);
    }
}
