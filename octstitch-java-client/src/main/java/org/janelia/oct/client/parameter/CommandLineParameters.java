package org.janelia.oct.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.oct.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all command line tools.
 *
 * @author Eric Trautman
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @param  exitOnHelpOrFailure  if false, parse failures are thrown as
     *                              {@link IllegalArgumentException}s instead of exiting.
     */
    public void parse(final String[] args,
                      final Class programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp octstitch-java-client-standalone.jar " + programClass.getName());

        String failureMessage = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            failureMessage = pe.getMessage();
            JCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + failureMessage);
        } catch (final Throwable t) {
            failureMessage = t.getMessage();
            LOG.error("failed to parse command line arguments", t);
        }

        if (help || (failureMessage != null)) {
            JCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            } else if (failureMessage != null) {
                throw new IllegalArgumentException("failed to parse command line arguments: " + failureMessage);
            }
        }
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
