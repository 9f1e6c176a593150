package org.janelia.oct.tile;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.json.JsonUtils;

/**
 * Tiled scan description as recorded in a scan folder's {@value #FILE_NAME}.
 * All lateral values and depths are in mm.
 *
 * Raw data folders are ordered depth fastest, then x, then y.
 *
 * @author Eric Trautman
 */
public class ScanConfiguration
        implements Serializable {

    public static final String FILE_NAME = "ScanInfo.json";

    public static final String DEFAULT_FOLDER_FORMAT = "Data%02d";

    private double[] xCenters_mm;
    private double[] yCenters_mm;
    private double[] zDepths;
    private int nXPixels;
    private int nYPixels;
    private double tileRangeX_mm;
    private double tileRangeY_mm;
    private double xOffset;
    private double yOffset;
    private double tissueRefractiveIndex;
    private List<String> octFolders;

    /** [xIndex, yIndex] pairs of lateral positions that were not scanned. */
    private int[][] disabledTiles;

    private Double defaultDispersionQuadraticTerm;
    private Double octProbeFOV_mm;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ScanConfiguration() {
        this.tissueRefractiveIndex = 1.33;
    }

    public ScanConfiguration(final double[] xCenters_mm,
                             final double[] yCenters_mm,
                             final double[] zDepths,
                             final int nXPixels,
                             final int nYPixels,
                             final double tileRangeX_mm,
                             final double tileRangeY_mm) {
        this.xCenters_mm = xCenters_mm;
        this.yCenters_mm = yCenters_mm;
        this.zDepths = zDepths;
        this.nXPixels = nXPixels;
        this.nYPixels = nYPixels;
        this.tileRangeX_mm = tileRangeX_mm;
        this.tileRangeY_mm = tileRangeY_mm;
        this.xOffset = 0.0;
        this.yOffset = 0.0;
        this.tissueRefractiveIndex = 1.33;
    }

    public double[] getXCenters_mm() {
        return xCenters_mm.clone();
    }

    public double[] getYCenters_mm() {
        return yCenters_mm.clone();
    }

    public double[] getZDepths() {
        return zDepths.clone();
    }

    public int getNXPixels() {
        return nXPixels;
    }

    public int getNYPixels() {
        return nYPixels;
    }

    public double getTileRangeX_mm() {
        return tileRangeX_mm;
    }

    public double getTileRangeY_mm() {
        return tileRangeY_mm;
    }

    public double getXOffset() {
        return xOffset;
    }

    public double getYOffset() {
        return yOffset;
    }

    public void setOffsets(final double xOffset,
                           final double yOffset) {
        this.xOffset = xOffset;
        this.yOffset = yOffset;
    }

    public double getTissueRefractiveIndex() {
        return tissueRefractiveIndex;
    }

    public void setTissueRefractiveIndex(final double tissueRefractiveIndex) {
        this.tissueRefractiveIndex = tissueRefractiveIndex;
    }

    public Double getDefaultDispersionQuadraticTerm() {
        return defaultDispersionQuadraticTerm;
    }

    public void setDefaultDispersionQuadraticTerm(final Double defaultDispersionQuadraticTerm) {
        this.defaultDispersionQuadraticTerm = defaultDispersionQuadraticTerm;
    }

    public Double getOctProbeFOV_mm() {
        return octProbeFOV_mm;
    }

    public void setOctProbeFOV_mm(final Double octProbeFOV_mm) {
        this.octProbeFOV_mm = octProbeFOV_mm;
    }

    public void setOctFolders(final List<String> octFolders) {
        this.octFolders = octFolders == null ? null : new ArrayList<>(octFolders);
    }

    public void setDisabledTiles(final int[][] disabledTiles) {
        this.disabledTiles = disabledTiles;
    }

    /**
     * @return flat index of the tile in the folder ordering (depth fastest, then x, then y).
     */
    public int getTileNumber(final int xIndex,
                             final int yIndex,
                             final int zIndex) {
        return zIndex + zDepths.length * (xIndex + xCenters_mm.length * yIndex);
    }

    /**
     * @return raw data folder for the specified tile, defaulting to
     *         {@value #DEFAULT_FOLDER_FORMAT} numbered from 1 when no folders are listed.
     */
    public String getOctFolder(final int xIndex,
                               final int yIndex,
                               final int zIndex) {
        final int tileNumber = getTileNumber(xIndex, yIndex, zIndex);
        if (octFolders == null) {
            return String.format(DEFAULT_FOLDER_FORMAT, tileNumber + 1);
        }
        return octFolders.get(tileNumber);
    }

    public boolean isDisabled(final int xIndex,
                              final int yIndex) {
        if (disabledTiles != null) {
            for (final int[] pair : disabledTiles) {
                if ((pair[0] == xIndex) && (pair[1] == yIndex)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @throws ConfigurationException
     *   if any required value is missing or inconsistent.
     */
    public void validate()
            throws ConfigurationException {

        if ((xCenters_mm == null) || (xCenters_mm.length == 0)) {
            throw new ConfigurationException(FILE_NAME + " does not include valid xCenters_mm");
        }
        if ((yCenters_mm == null) || (yCenters_mm.length == 0)) {
            throw new ConfigurationException(FILE_NAME + " does not include valid yCenters_mm");
        }
        if ((zDepths == null) || (zDepths.length == 0)) {
            throw new ConfigurationException(FILE_NAME + " does not include valid zDepths");
        }
        if (nXPixels < 2) {
            throw new ConfigurationException("nXPixels must be at least 2 but is " + nXPixels);
        }
        if (nYPixels < 1) {
            throw new ConfigurationException("nYPixels must be positive but is " + nYPixels);
        }
        if ((yCenters_mm.length > 1) && (nYPixels < 2)) {
            throw new ConfigurationException("nYPixels must be at least 2 when scanning " + yCenters_mm.length +
                                             " y positions");
        }
        if (! (tileRangeX_mm > 0)) {
            throw new ConfigurationException("tileRangeX_mm must be positive but is " + tileRangeX_mm);
        }
        if ((nYPixels > 1) && (! (tileRangeY_mm > 0))) {
            throw new ConfigurationException("tileRangeY_mm must be positive but is " + tileRangeY_mm);
        }
        if (! (tissueRefractiveIndex > 0)) {
            throw new ConfigurationException("tissueRefractiveIndex must be positive but is " +
                                             tissueRefractiveIndex);
        }

        final int tileCount = xCenters_mm.length * yCenters_mm.length * zDepths.length;
        if ((octFolders != null) && (octFolders.size() != tileCount)) {
            throw new ConfigurationException(FILE_NAME + " lists " + octFolders.size() + " octFolders but " +
                                             tileCount + " tiles were scanned");
        }
        if (disabledTiles != null) {
            for (final int[] pair : disabledTiles) {
                if ((pair == null) || (pair.length != 2) ||
                    (pair[0] < 0) || (pair[0] >= xCenters_mm.length) ||
                    (pair[1] < 0) || (pair[1] >= yCenters_mm.length)) {
                    throw new ConfigurationException("invalid disabledTiles entry " + Arrays.toString(pair));
                }
            }
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static ScanConfiguration fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static ScanConfiguration fromScanFolder(final File scanFolder)
            throws IOException {
        return JSON_HELPER.fromJsonFile(new File(scanFolder, FILE_NAME));
    }

    private static final JsonUtils.Helper<ScanConfiguration> JSON_HELPER =
            new JsonUtils.Helper<>(ScanConfiguration.class);
}
