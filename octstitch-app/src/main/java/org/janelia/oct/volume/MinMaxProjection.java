package org.janelia.oct.volume;

/**
 * Sliding window minimum or maximum projection of a volume along one axis.
 * Output voxel {@code i} along the projection axis holds the extreme of the defined input voxels
 * in {@code [round(i + 1 - nSlices/2) - 1, round(i + 1 + nSlices/2) - 1]} (clamped to the volume).
 * Output voxels whose window holds no defined value are undefined.
 *
 * @author Eric Trautman
 */
public class MinMaxProjection {

    public static final int DEFAULT_SLICE_COUNT = 5;

    public enum Mode {
        MIN, MAX
    }

    public enum Axis {
        Z, X, Y
    }

    private final Mode mode;
    private final int nSlices;
    private final Axis axis;

    public MinMaxProjection() {
        this(Mode.MIN, DEFAULT_SLICE_COUNT, Axis.Z);
    }

    public MinMaxProjection(final Mode mode,
                            final int nSlices,
                            final Axis axis)
            throws IllegalArgumentException {
        if (nSlices < 1) {
            throw new IllegalArgumentException("nSlices must be positive but is " + nSlices);
        }
        this.mode = mode;
        this.nSlices = nSlices;
        this.axis = axis;
    }

    public ReconstructedVolume project(final ReconstructedVolume volume) {

        final int depthCount = volume.getDepthCount();
        final int xCount = volume.getXCount();
        final int yCount = volume.getYCount();
        final int axisLength = getAxisLength(volume);

        final ReconstructedVolume projected = new ReconstructedVolume(depthCount, xCount, yCount);
        final int[] voxel = new int[3];

        for (int y = 0; y < yCount; y++) {
            for (int x = 0; x < xCount; x++) {
                for (int z = 0; z < depthCount; z++) {

                    voxel[0] = z;
                    voxel[1] = x;
                    voxel[2] = y;
                    final int a = voxel[axis.ordinal()];
                    final int from = (int) Math.max(Math.round(a + 1 - nSlices / 2.0) - 1, 0);
                    final int to = (int) Math.min(Math.round(a + 1 + nSlices / 2.0) - 1, axisLength - 1);

                    boolean found = false;
                    float extreme = 0;
                    for (int i = from; i <= to; i++) {
                        voxel[axis.ordinal()] = i;
                        if (volume.isDefined(voxel[0], voxel[1], voxel[2])) {
                            final float value = volume.getRawValue(voxel[0], voxel[1], voxel[2]);
                            if ((! found) || ((mode == Mode.MIN) ? (value < extreme) : (value > extreme))) {
                                extreme = value;
                                found = true;
                            }
                        }
                    }

                    if (found) {
                        projected.setValue(z, x, y, extreme);
                    }
                }
            }
        }

        return projected;
    }

    private int getAxisLength(final ReconstructedVolume volume) {
        switch (axis) {
            case X:
                return volume.getXCount();
            case Y:
                return volume.getYCount();
            default:
                return volume.getDepthCount();
        }
    }

    @Override
    public String toString() {
        return "{mode: " + mode + ", nSlices: " + nSlices + ", axis: " + axis + "}";
    }
}
