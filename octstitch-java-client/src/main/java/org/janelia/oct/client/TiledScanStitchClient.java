package org.janelia.oct.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;

import org.janelia.oct.client.parameter.CommandLineParameters;
import org.janelia.oct.client.parameter.OutputLatticeParameters;
import org.janelia.oct.client.parameter.ReconstructionParameters;
import org.janelia.oct.client.parameter.StitchRunParameters;
import org.janelia.oct.stitch.StitchContext;
import org.janelia.oct.stitch.TiledScanStitcher;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.volume.VolumeHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for reconstructing and stitching all tiles of a scan folder into one volume.
 *
 * @author Eric Trautman
 */
public class TiledScanStitchClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--scanFolder",
                description = "Folder containing " + ScanConfiguration.FILE_NAME + " and the tile data folders",
                required = true)
        public String scanFolder;

        @Parameter(
                names = "--outputFolder",
                description = "Folder for the stitched volume",
                required = true)
        public String outputFolder;

        @ParametersDelegate
        public ReconstructionParameters reconstruction = new ReconstructionParameters();

        @ParametersDelegate
        public OutputLatticeParameters lattice = new OutputLatticeParameters();

        @ParametersDelegate
        public StitchRunParameters stitch = new StitchRunParameters();
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final TiledScanStitchClient client = new TiledScanStitchClient(parameters);
                client.stitch();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public TiledScanStitchClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return handle of the finalized volume.
     */
    public VolumeHandle stitch()
            throws IOException {

        final File scanFolder = new File(parameters.scanFolder).getAbsoluteFile();
        final ScanConfiguration scanConfiguration = ScanConfiguration.fromScanFolder(scanFolder);

        LOG.info("stitch: loaded {} from {}", ScanConfiguration.FILE_NAME, scanFolder);

        // no correction data is available for simulated probes
        final StitchContext context = StitchContext.build(scanConfiguration,
                                                          parameters.reconstruction.buildTransformParameters(),
                                                          parameters.lattice.buildLatticeParameters(),
                                                          parameters.stitch.buildStitchParameters(),
                                                          new SimulatedRawFrameLoader(scanFolder),
                                                          null);

        final TiledScanStitcher stitcher = new TiledScanStitcher(context);
        final VolumeHandle handle = stitcher.stitch(new DirectoryVolumeSink(new File(parameters.outputFolder)));

        LOG.info("stitch: saved volume to {}", handle.getLocation());

        return handle;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiledScanStitchClient.class);
}
