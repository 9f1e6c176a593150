package org.janelia.oct.stitch;

import java.io.File;
import java.io.IOException;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.spectral.SpectralTransform;
import org.janelia.oct.spectral.SpectralTransformParameters;
import org.janelia.oct.tile.LatticeParameters;
import org.janelia.oct.tile.RawFrameLoader;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.tile.ScanGrid;
import org.janelia.oct.tile.Tile;
import org.janelia.oct.tile.TileFrameBuilder;
import org.janelia.oct.tile.TileFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a stitching run needs, validated and derived once before any row is processed.
 * Instances are immutable and shared by all row workers.
 *
 * @author Eric Trautman
 */
public class StitchContext {

    private final ScanConfiguration scanConfiguration;
    private final ScanGrid scanGrid;
    private final TileFrames tileFrames;
    private final SpectralTransform spectralTransform;
    private final LatticeParameters latticeParameters;
    private final StitchParameters stitchParameters;
    private final RawFrameLoader frameLoader;
    private final OpticalPathCorrector pathCorrector;
    private final YPlaneWriter yPlaneWriter;

    public StitchContext(final ScanConfiguration scanConfiguration,
                         final ScanGrid scanGrid,
                         final TileFrames tileFrames,
                         final SpectralTransform spectralTransform,
                         final LatticeParameters latticeParameters,
                         final StitchParameters stitchParameters,
                         final RawFrameLoader frameLoader,
                         final OpticalPathCorrector pathCorrector,
                         final YPlaneWriter yPlaneWriter) {
        this.scanConfiguration = scanConfiguration;
        this.scanGrid = scanGrid;
        this.tileFrames = tileFrames;
        this.spectralTransform = spectralTransform;
        this.latticeParameters = latticeParameters;
        this.stitchParameters = stitchParameters;
        this.frameLoader = frameLoader;
        this.pathCorrector = pathCorrector;
        this.yPlaneWriter = yPlaneWriter;
    }

    /**
     * Validates all inputs and derives the tile and output lattices.
     *
     * The scan's tissue refractive index is used for the depth axis and the scan's default
     * dispersion term is used when the spectral parameters do not specify one.
     *
     * @param  pathCorrector  optional corrector (null when the probe has no correction data).
     *
     * @throws ConfigurationException
     *   if any configuration is invalid.
     *
     * @throws IOException
     *   if the first tile's dimensions cannot be loaded or the y plane folder cannot be created.
     */
    public static StitchContext build(final ScanConfiguration scanConfiguration,
                                      final SpectralTransformParameters spectralParameters,
                                      final LatticeParameters latticeParameters,
                                      final StitchParameters stitchParameters,
                                      final RawFrameLoader frameLoader,
                                      final OpticalPathCorrector pathCorrector)
            throws ConfigurationException, IOException {

        LOG.info("build: entry, stitchParameters={}", stitchParameters);

        stitchParameters.validate();

        final ScanGrid scanGrid = new ScanGrid(scanConfiguration);
        if (scanGrid.getTiles().isEmpty()) {
            throw new ConfigurationException("all tiles of the scan are disabled");
        }

        Double dispersion = spectralParameters.hasDispersionQuadraticTerm() ?
                            spectralParameters.getDispersionQuadraticTerm() : null;
        if (dispersion == null) {
            dispersion = scanConfiguration.getDefaultDispersionQuadraticTerm();
            LOG.info("build: using scan default dispersionQuadraticTerm {}", dispersion);
        }
        final SpectralTransform spectralTransform = new SpectralTransform(
                spectralParameters.withScanValues(dispersion, scanConfiguration.getTissueRefractiveIndex()));

        final Tile firstTile = scanGrid.getTiles().get(0);
        final DimensionSet probeDimensions =
                spectralTransform.computeDepthDimensions(frameLoader.loadDimensions(firstTile));

        final TileFrames tileFrames = new TileFrameBuilder(scanConfiguration, latticeParameters).build(probeDimensions);

        YPlaneWriter yPlaneWriter = null;
        if (stitchParameters.isSaveSomeYPlanes()) {
            yPlaneWriter = new YPlaneWriter(new File(stitchParameters.getYPlanesOutputFolder()),
                                            tileFrames.getOutputDimensions().getY().size(),
                                            stitchParameters.getHowManyYPlanes());
        }

        OpticalPathCorrector corrector = null;
        if (stitchParameters.isApplyPathLengthCorrection()) {
            corrector = pathCorrector;
        }

        return new StitchContext(scanConfiguration,
                                 scanGrid,
                                 tileFrames,
                                 spectralTransform,
                                 latticeParameters,
                                 stitchParameters,
                                 frameLoader,
                                 corrector,
                                 yPlaneWriter);
    }

    public ScanConfiguration getScanConfiguration() {
        return scanConfiguration;
    }

    public ScanGrid getScanGrid() {
        return scanGrid;
    }

    public TileFrames getTileFrames() {
        return tileFrames;
    }

    public DimensionSet getOutputDimensions() {
        return tileFrames.getOutputDimensions();
    }

    public SpectralTransform getSpectralTransform() {
        return spectralTransform;
    }

    public LatticeParameters getLatticeParameters() {
        return latticeParameters;
    }

    public StitchParameters getStitchParameters() {
        return stitchParameters;
    }

    public RawFrameLoader getFrameLoader() {
        return frameLoader;
    }

    /**
     * @return corrector to apply or null if no correction should be applied.
     */
    public OpticalPathCorrector getPathCorrector() {
        return pathCorrector;
    }

    /**
     * @return debug writer or null if no y planes should be saved.
     */
    public YPlaneWriter getYPlaneWriter() {
        return yPlaneWriter;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StitchContext.class);
}
