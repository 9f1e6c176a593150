package org.janelia.oct.surface;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SurfaceFocusAnalyzer} class.
 *
 * @author Eric Trautman
 */
public class SurfaceFocusAnalyzerTest {

    @Test
    public void testSurfaceInFocus() {

        final SurfaceMap surfaceMap = toMap(buildPositions(100, 100, 0.0));

        final FocusAssessment assessment = new SurfaceFocusAnalyzer().assess(surfaceMap);

        Assert.assertTrue("flat surface at focus should be in focus", assessment.isSurfaceInFocus());
        Assert.assertEquals("invalid offset", 0.0, assessment.getZOffsetCorrection_mm(), 1.0e-12);
    }

    @Test
    public void testOnlyPartOfTissueIsInFocus() {

        // small raised block barely moves the median
        final Double[][] smallBlock = buildPositions(100, 100, 0.0);
        setBlock(smallBlock, 10, 10, 1.0);
        Assert.assertTrue("small raised block should not matter",
                          new SurfaceFocusAnalyzer().assess(toMap(smallBlock)).isSurfaceInFocus());

        // half the tissue raised
        final Double[][] halfRaised = buildPositions(100, 100, 0.0);
        setBlock(halfRaised, 50, 100, 1.0);
        final SurfaceFocusException.Reason reason = assertFailure(new SurfaceFocusAnalyzer(), toMap(halfRaised));
        Assert.assertTrue("invalid reason " + reason,
                          (reason == SurfaceFocusException.Reason.OUT_OF_FOCUS) ||
                          (reason == SurfaceFocusException.Reason.CANNOT_BE_IN_FOCUS));
    }

    @Test
    public void testUndefinedSurface() {

        final SurfaceMap surfaceMap = new SurfaceMap(new Double[10][10], buildAxis(10), buildAxis(10));
        Assert.assertEquals("undefined surface should not be estimated",
                            SurfaceFocusException.Reason.CANNOT_BE_ESTIMATED,
                            assertFailure(new SurfaceFocusAnalyzer(), surfaceMap));

        final Double[][] partlyDefined = buildPositions(10, 10, 0.0);
        for (int x = 0; x < 10; x++) {
            partlyDefined[0][x] = null;
            partlyDefined[1][x] = null;
        }
        Assert.assertEquals("20% undefined surface should not be estimated",
                            SurfaceFocusException.Reason.CANNOT_BE_ESTIMATED,
                            assertFailure(new SurfaceFocusAnalyzer(), toMap(partlyDefined)));
    }

    @Test
    public void testTiltedSurfaceCannotBeInFocus() {

        final int size = 50;
        final double[] axis = buildAxis(size);
        final Double[][] positions = new Double[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                positions[y][x] = axis[x] * axis[y];
            }
        }

        Assert.assertEquals("tilted surface should not be in focus",
                            SurfaceFocusException.Reason.CANNOT_BE_IN_FOCUS,
                            assertFailure(new SurfaceFocusAnalyzer(), new SurfaceMap(positions, axis, axis)));
    }

    @Test
    public void testSurfaceOutOfFocus() {

        for (final double offset : new double[] { 0.050, -0.050 }) {

            final SurfaceMap surfaceMap = toMap(buildPositions(20, 20, offset));

            Assert.assertEquals("surface offset by " + offset + " should be out of focus",
                                SurfaceFocusException.Reason.OUT_OF_FOCUS,
                                assertFailure(new SurfaceFocusAnalyzer(), surfaceMap));

            final FocusAssessment assessment =
                    new SurfaceFocusAnalyzer(SurfaceFocusAnalyzer.DEFAULT_ACCEPTABLE_RANGE_MM, null, false)
                            .assess(surfaceMap);
            Assert.assertFalse("surface offset by " + offset + " should be reported out of focus",
                               assessment.isSurfaceInFocus());
            Assert.assertEquals("invalid offset", offset, assessment.getZOffsetCorrection_mm(), 1.0e-12);
            Assert.assertTrue("instructions should give direction",
                              assessment.getInstructions().contains(offset > 0 ? "increase" : "decrease"));
        }
    }

    @Test
    public void testRegionOfInterest() {

        final Double[][] positions = buildPositions(20, 20, 0.0);
        final double[] axis = buildAxis(20);
        // raise everything outside x in [0.5, 0.9]
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 20; x++) {
                if ((axis[x] < 0.5) || (axis[x] > 0.9)) {
                    positions[y][x] = 0.2;
                }
            }
        }
        final SurfaceMap surfaceMap = toMap(positions);

        Assert.assertEquals("full map should not be in focus",
                            SurfaceFocusException.Reason.CANNOT_BE_IN_FOCUS,
                            assertFailure(new SurfaceFocusAnalyzer(), surfaceMap));

        final double[] roi = { 0.5, 0.0, 0.4, 1.0 };
        final FocusAssessment assessment =
                new SurfaceFocusAnalyzer(SurfaceFocusAnalyzer.DEFAULT_ACCEPTABLE_RANGE_MM, roi, true)
                        .assess(surfaceMap);
        Assert.assertTrue("region of interest should be in focus", assessment.isSurfaceInFocus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRegionOfInterest() {
        new SurfaceFocusAnalyzer(0.025, new double[] { 0.0, 0.0, -1.0, 1.0 }, true);
    }

    @Test
    public void testPercentile() {
        final double[] values = { 4.0, 1.0, 3.0, 2.0 };
        Assert.assertEquals("invalid median", 2.5, SurfaceFocusAnalyzer.percentile(values, 50.0), 1.0e-12);
        Assert.assertEquals("invalid 80th percentile", 3.7, SurfaceFocusAnalyzer.percentile(values, 80.0), 1.0e-12);
        Assert.assertEquals("invalid low percentile", 1.0, SurfaceFocusAnalyzer.percentile(values, 5.0), 1.0e-12);
        Assert.assertEquals("invalid high percentile", 4.0, SurfaceFocusAnalyzer.percentile(values, 99.0), 1.0e-12);
    }

    private static SurfaceFocusException.Reason assertFailure(final SurfaceFocusAnalyzer analyzer,
                                                              final SurfaceMap surfaceMap) {
        try {
            analyzer.assess(surfaceMap);
            Assert.fail("assessment should have failed");
        } catch (final SurfaceFocusException e) {
            return e.getReason();
        }
        return null;
    }

    private static double[] buildAxis(final int size) {
        final double[] axis = new double[size];
        for (int i = 0; i < size; i++) {
            axis[i] = (double) i / size;
        }
        return axis;
    }

    private static Double[][] buildPositions(final int xCount,
                                             final int yCount,
                                             final double position) {
        final Double[][] positions = new Double[yCount][xCount];
        for (int y = 0; y < yCount; y++) {
            for (int x = 0; x < xCount; x++) {
                positions[y][x] = position;
            }
        }
        return positions;
    }

    private static SurfaceMap toMap(final Double[][] positions) {
        return new SurfaceMap(positions, buildAxis(positions[0].length), buildAxis(positions.length));
    }

    private static void setBlock(final Double[][] positions,
                                 final int rows,
                                 final int columns,
                                 final double position) {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                positions[y][x] = position;
            }
        }
    }
}
