package org.janelia.oct.client;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.stitch.RowCountMismatchException;
import org.janelia.oct.stitch.RowProcessingException;
import org.janelia.oct.surface.SurfaceFocusException;
import org.janelia.oct.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs process completion and maps known failures
 * to distinct process exit codes.
 *
 * A missing exit log message means the client was terminated abnormally (e.g. by a cluster scheduler).
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    public enum ExitStatus {
        SUCCESS(0),
        FAILED(1),
        INVALID_CONFIGURATION(2),
        ROW_FAILED(3),
        INCOMPLETE_VOLUME(4),
        SURFACE_NOT_IN_FOCUS(5);

        private final int code;

        ExitStatus(final int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Executes the client and exits the JVM with the resulting status code.
     */
    public void run() {
        System.exit(execute().getCode());
    }

    /**
     * Wraps a client run with consistent log statements.
     *
     * @return status of the run.
     */
    public ExitStatus execute() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        ExitStatus exitStatus;
        try {
            runClient(args);
            exitStatus = ExitStatus.SUCCESS;
            LOG.info("run: exit, processing completed in {}, status {}", processTimer, exitStatus);
        } catch (final Throwable t) {
            exitStatus = getExitStatus(t);
            LOG.error("run: caught exception, " + describeFailure(t), t);
            LOG.info("run: exit, processing failed after {}, status {} ({})",
                     processTimer, exitStatus, exitStatus.getCode());
        }

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception ;

    /**
     * @return status for the first recognized failure in the specified throwable's cause chain.
     */
    public static ExitStatus getExitStatus(final Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof RowCountMismatchException) {
                return ExitStatus.INCOMPLETE_VOLUME;
            } else if (t instanceof RowProcessingException) {
                return ExitStatus.ROW_FAILED;
            } else if (t instanceof SurfaceFocusException) {
                return ExitStatus.SURFACE_NOT_IN_FOCUS;
            } else if (t instanceof ConfigurationException) {
                return ExitStatus.INVALID_CONFIGURATION;
            }
        }
        return ExitStatus.FAILED;
    }

    /**
     * @return summary of the context carried by the specified failure.
     */
    public static String describeFailure(final Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof RowCountMismatchException) {
                final RowCountMismatchException e = (RowCountMismatchException) t;
                return "volume " + e.getLocation() + " is incomplete, expected " + e.getExpectedCount() +
                       " rows but counted " + e.getCountedCount() + " and listed " + e.getListedCount();
            } else if (t instanceof RowProcessingException) {
                final Throwable cause = t.getCause();
                return "row " + ((RowProcessingException) t).getRowIndex() + " failed with " +
                       (cause == null ? "unknown cause" : cause.getClass().getSimpleName() + ": " +
                                                          cause.getMessage());
            } else if (t instanceof SurfaceFocusException) {
                return "surface check failed with reason " + ((SurfaceFocusException) t).getReason() +
                       ": " + t.getMessage();
            } else if (t instanceof ConfigurationException) {
                return "invalid configuration: " + t.getMessage();
            }
        }
        return "unexpected " + throwable.getClass().getSimpleName();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
