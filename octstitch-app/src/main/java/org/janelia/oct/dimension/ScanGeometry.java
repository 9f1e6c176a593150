package org.janelia.oct.dimension;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Auxiliary scan geometry metadata carried along with a {@link DimensionSet}.
 *
 * @author Eric Trautman
 */
public class ScanGeometry
        implements Serializable {

    private int aScanAvgCount;
    private int bScanAvgCount;
    private int interferogramLength;

    public ScanGeometry() {
        this(1, 1, 0);
    }

    /**
     * @param  interferogramLength  number of spectral samples per A-scan (0 when unknown).
     */
    public ScanGeometry(final int aScanAvgCount,
                        final int bScanAvgCount,
                        final int interferogramLength) {
        if ((aScanAvgCount < 1) || (bScanAvgCount < 1)) {
            throw new IllegalArgumentException("averaging counts must be positive but are " +
                                               aScanAvgCount + " and " + bScanAvgCount);
        }
        this.aScanAvgCount = aScanAvgCount;
        this.bScanAvgCount = bScanAvgCount;
        this.interferogramLength = interferogramLength;
    }

    public int getAScanAvgCount() {
        return aScanAvgCount;
    }

    public int getBScanAvgCount() {
        return bScanAvgCount;
    }

    public int getInterferogramLength() {
        return interferogramLength;
    }

    public ScanGeometry withInterferogramLength(final int length) {
        return new ScanGeometry(aScanAvgCount, bScanAvgCount, length);
    }

    /**
     * @return number of spectra recorded for each lateral (x) position of a frame.
     */
    @JsonIgnore
    public int getAveragingCount() {
        return aScanAvgCount * bScanAvgCount;
    }

    @Override
    public String toString() {
        return "{aScanAvgCount: " + aScanAvgCount + ", bScanAvgCount: " + bScanAvgCount +
               ", interferogramLength: " + interferogramLength + "}";
    }
}
