package org.janelia.oct.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;

import org.janelia.oct.client.parameter.CommandLineParameters;
import org.janelia.oct.client.parameter.SurfaceParameters;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.surface.FocusAssessment;
import org.janelia.oct.surface.SurfaceEstimator;
import org.janelia.oct.surface.SurfaceEstimatorParameters;
import org.janelia.oct.surface.SurfaceFocusException;
import org.janelia.oct.surface.SurfaceMap;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.util.FileUtil;
import org.janelia.oct.volume.ReconstructedVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for estimating the tissue surface of a stitched volume
 * and (optionally) checking that it is in focus.
 *
 * @author Eric Trautman
 */
public class TissueSurfaceClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--volumeFolder",
                description = "Folder of a stitched volume (decibel scaled)",
                required = true)
        public String volumeFolder;

        @Parameter(
                names = "--surfaceFile",
                description = "Path for the surface map JSON file",
                required = true)
        public String surfaceFile;

        @Parameter(
                names = "--assessmentFile",
                description = "Path for the focus assessment JSON file (omit to only log it)")
        public String assessmentFile;

        @Parameter(
                names = "--scanFolder",
                description = "Scan folder whose " + ScanConfiguration.FILE_NAME +
                              " provides octProbeFOV_mm when it is not specified")
        public String scanFolder;

        @ParametersDelegate
        public SurfaceParameters surface = new SurfaceParameters();
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final TissueSurfaceClient client = new TissueSurfaceClient(parameters);
                final SurfaceMap surfaceMap = client.estimateSurface();
                if (parameters.surface.assessFocus) {
                    client.assessFocus(surfaceMap);
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public TissueSurfaceClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public SurfaceMap estimateSurface()
            throws IOException {

        final DirectoryVolumeReader reader = new DirectoryVolumeReader(new File(parameters.volumeFolder));
        final DimensionSet dimensions = reader.readDimensions();
        final ReconstructedVolume volume = reader.readVolume();

        final SurfaceEstimator estimator = new SurfaceEstimator(buildEstimatorParameters());
        final SurfaceMap surfaceMap = estimator.estimate(volume, dimensions);

        FileUtil.saveJsonFile(parameters.surfaceFile, surfaceMap);

        LOG.info("estimateSurface: saved {}, mean surface position is {} mm",
                 parameters.surfaceFile, surfaceMap.getMeanPosition());

        return surfaceMap;
    }

    public FocusAssessment assessFocus(final SurfaceMap surfaceMap)
            throws IOException, SurfaceFocusException {

        final FocusAssessment assessment = parameters.surface.buildFocusAnalyzer().assess(surfaceMap);

        LOG.info("assessFocus: {}", assessment);

        if (parameters.assessmentFile != null) {
            FileUtil.saveJsonFile(parameters.assessmentFile, assessment);
        }

        return assessment;
    }

    private SurfaceEstimatorParameters buildEstimatorParameters()
            throws IOException {

        final SurfaceParameters surface = parameters.surface;
        if ((surface.octProbeFOV_mm == null) && (parameters.scanFolder != null)) {
            final ScanConfiguration scanConfiguration =
                    ScanConfiguration.fromScanFolder(new File(parameters.scanFolder));
            LOG.info("buildEstimatorParameters: using scan octProbeFOV_mm {}", scanConfiguration.getOctProbeFOV_mm());
            return new SurfaceEstimatorParameters(surface.constantThreshold, scanConfiguration.getOctProbeFOV_mm());
        }

        return surface.buildEstimatorParameters();
    }

    private static final Logger LOG = LoggerFactory.getLogger(TissueSurfaceClient.class);
}
