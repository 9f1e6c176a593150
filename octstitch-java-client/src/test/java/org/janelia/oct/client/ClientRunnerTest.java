package org.janelia.oct.client;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.stitch.RowCountMismatchException;
import org.janelia.oct.stitch.RowProcessingException;
import org.janelia.oct.surface.SurfaceFocusException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 *
 * @author Eric Trautman
 */
public class ClientRunnerTest {

    @Test
    public void testSuccessfulRun() {
        final String[] runArgs = {"--scanFolder", "/tmp/scan"};
        final String[][] receivedArgs = new String[1][];
        final ClientRunner runner = new ClientRunner(runArgs) {
            @Override
            public void runClient(final String[] args) {
                receivedArgs[0] = args;
            }
        };

        Assert.assertEquals("invalid status", ClientRunner.ExitStatus.SUCCESS, runner.execute());
        Assert.assertSame("client should receive command line arguments", runArgs, receivedArgs[0]);
        Assert.assertEquals("invalid success code", 0, ClientRunner.ExitStatus.SUCCESS.getCode());
    }

    @Test
    public void testFailedRowStatus() {
        final RowProcessingException failure =
                new RowProcessingException(17, new UncheckedIOException(new IOException("disk full")));

        Assert.assertEquals("invalid status",
                            ClientRunner.ExitStatus.ROW_FAILED, buildFailingRunner(failure).execute());

        final String description = ClientRunner.describeFailure(failure);
        Assert.assertTrue("description should name the row, description is " + description,
                          description.startsWith("row 17 failed with UncheckedIOException"));
        Assert.assertTrue("description should include the cause, description is " + description,
                          description.contains("disk full"));
    }

    @Test
    public void testIncompleteVolumeStatus() {
        final RowCountMismatchException failure = new RowCountMismatchException("/data/volume", 10, 9, 8);

        Assert.assertEquals("invalid status",
                            ClientRunner.ExitStatus.INCOMPLETE_VOLUME, buildFailingRunner(failure).execute());
        Assert.assertEquals("invalid description",
                            "volume /data/volume is incomplete, expected 10 rows but counted 9 and listed 8",
                            ClientRunner.describeFailure(failure));
    }

    @Test
    public void testWrappedFailureStatus() {
        final Exception wrapped = new IllegalStateException(
                "run aborted", new SurfaceFocusException(SurfaceFocusException.Reason.OUT_OF_FOCUS, "too deep"));

        Assert.assertEquals("cause chain should be searched",
                            ClientRunner.ExitStatus.SURFACE_NOT_IN_FOCUS, buildFailingRunner(wrapped).execute());
        Assert.assertEquals("invalid description",
                            "surface check failed with reason OUT_OF_FOCUS: too deep",
                            ClientRunner.describeFailure(wrapped));
    }

    @Test
    public void testConfigurationAndUnexpectedStatus() {
        Assert.assertEquals("invalid configuration status",
                            ClientRunner.ExitStatus.INVALID_CONFIGURATION,
                            buildFailingRunner(new ConfigurationException("bad lattice")).execute());
        Assert.assertEquals("invalid unexpected status",
                            ClientRunner.ExitStatus.FAILED,
                            buildFailingRunner(new IOException("missing scan")).execute());
        Assert.assertEquals("invalid unexpected description",
                            "unexpected IOException",
                            ClientRunner.describeFailure(new IOException("missing scan")));
    }

    private static ClientRunner buildFailingRunner(final Exception failure) {
        return new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                throw failure;
            }
        };
    }
}
