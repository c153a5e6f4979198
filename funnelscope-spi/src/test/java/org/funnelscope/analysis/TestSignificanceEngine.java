package org.funnelscope.analysis;

import com.google.common.collect.ImmutableList;
import org.funnelscope.analysis.SignificanceReport.Recommendation;
import org.funnelscope.util.InsufficientDataException;
import org.funnelscope.util.StepNotFoundException;
import org.funnelscope.util.ValidationException;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestSignificanceEngine {
    private static final List<String> STEPS = ImmutableList.of("view", "cart", "buy");

    private final SignificanceEngine engine = new SignificanceEngine();

    private static FunnelResult arm(long entered, long converted) {
        return FunnelResult.of(STEPS, entered, (entered + converted) / 2, converted);
    }

    @Test
    public void testSignificantLift() {
        SignificanceReport report = engine.evaluate(arm(1000, 100), arm(1000, 130), "view", "buy", 0.95);

        assertEquals(report.getControlConversion(), 10.0, 1e-9);
        assertEquals(report.getTestConversion(), 13.0, 1e-9);
        assertEquals(report.getAbsoluteDifference(), 3.0, 1e-9);
        assertEquals(report.getRelativeLift(), 0.30, 1e-9);
        assertEquals(report.getZScore(), 2.10, 0.01);
        assertEquals(report.getPValue(), 0.0355, 0.001);
        assertTrue(report.isSignificant());
        assertEquals(report.getRecommendation(), Recommendation.ADOPT);
    }

    @Test
    public void testSwappedArms() {
        SignificanceReport forward = engine.evaluate(arm(1000, 100), arm(1000, 130), 0.95);
        SignificanceReport backward = engine.evaluate(arm(1000, 130), arm(1000, 100), 0.95);

        assertEquals(backward.getRelativeLift(), -0.2308, 0.0001);
        assertEquals(backward.getZScore(), -forward.getZScore(), 1e-9);
        assertEquals(backward.getPValue(), forward.getPValue(), 1e-9);
        assertTrue(backward.isSignificant());
        assertEquals(backward.getRecommendation(), Recommendation.REJECT);
    }

    @Test
    public void testStricterConfidence() {
        SignificanceReport report = engine.evaluate(arm(1000, 100), arm(1000, 130), "view", "buy", 0.99);

        assertFalse(report.isSignificant());
        assertEquals(report.getRecommendation(), Recommendation.CONTINUE);
    }

    @Test
    public void testIntermediateSteps() {
        SignificanceReport report = engine.evaluate(arm(1000, 100), arm(1000, 130), "view", "cart", 0.95);

        assertEquals(report.getControlConversion(), 55.0, 1e-9);
        assertEquals(report.getTestConversion(), 56.5, 1e-9);
    }

    @Test
    public void testIdenticalArmsAtFullConversion() {
        SignificanceReport report = engine.evaluate(FunnelResult.of(STEPS, 10, 10, 10), FunnelResult.of(STEPS, 20, 20, 20), 0.95);

        assertEquals(report.getZScore(), 0.0);
        assertEquals(report.getPValue(), 1.0);
        assertFalse(report.isSignificant());
    }

    @Test(expectedExceptions = InsufficientDataException.class)
    public void testEmptyControl() {
        engine.evaluate(FunnelResult.of(STEPS, 0, 0, 0), arm(1000, 130), 0.95);
    }

    @Test(expectedExceptions = InsufficientDataException.class)
    public void testEmptyTest() {
        engine.evaluate(arm(1000, 100), FunnelResult.of(STEPS, 0, 0, 0), 0.95);
    }

    @Test(expectedExceptions = InsufficientDataException.class)
    public void testZeroControlConversion() {
        engine.evaluate(arm(1000, 0), arm(1000, 130), 0.95);
    }

    @Test(expectedExceptions = StepNotFoundException.class)
    public void testUnknownStep() {
        engine.evaluate(arm(1000, 100), arm(1000, 130), "view", "refund", 0.95);
    }

    @Test(expectedExceptions = ValidationException.class)
    public void testConfidenceOutOfRange() {
        engine.evaluate(arm(1000, 100), arm(1000, 130), 1.0);
    }
}
