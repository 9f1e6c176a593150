package org.janelia.oct.simulation;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.spectral.RawFrame;

/**
 * Simulated interferogram values stored lambda fastest, then x, then y,
 * along with the dimensions that describe them.
 *
 * @author Eric Trautman
 */
public class SimulatedInterferogram {

    private final int lambdaCount;
    private final int xCount;
    private final int yCount;
    private final double[] values;
    private final DimensionSet dimensions;

    public SimulatedInterferogram(final int lambdaCount,
                                  final int xCount,
                                  final int yCount,
                                  final double[] values,
                                  final DimensionSet dimensions) {
        this.lambdaCount = lambdaCount;
        this.xCount = xCount;
        this.yCount = yCount;
        this.values = values;
        this.dimensions = dimensions;
    }

    public int getLambdaCount() {
        return lambdaCount;
    }

    public int getXCount() {
        return xCount;
    }

    public int getYCount() {
        return yCount;
    }

    public DimensionSet getDimensions() {
        return dimensions;
    }

    public double getValue(final int lambdaIndex,
                           final int xIndex,
                           final int yIndex) {
        return values[lambdaIndex + lambdaCount * (xIndex + xCount * yIndex)];
    }

    /**
     * @return frame (without averaging repeats) for the specified y position.
     */
    public RawFrame getFrame(final int yIndex) {
        final int frameSize = lambdaCount * xCount;
        final double[] frameValues = new double[frameSize];
        System.arraycopy(values, frameSize * yIndex, frameValues, 0, frameSize);
        return new RawFrame(lambdaCount, xCount, 1, frameValues, true);
    }

}
