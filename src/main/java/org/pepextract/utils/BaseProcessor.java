/**
 *
 */
package org.pepextract.utils;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the commands.  The subclass declares its parameters as args4j-annotated
 * fields, sets their defaults in {@link #setDefaults()}, checks them in {@link #validateParms()}, and does
 * its work in {@link #runCommand()}.  The base class handles the help and debug options, timing, error
 * reporting and the process exit code.
 *
 * Relative file names are resolved against the working directory, which defaults to the current directory.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the parameters parsed and validated successfully */
    private boolean parsed;
    /** exit code of the command */
    private int exitCode;
    /** start time of the command, in milliseconds */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed log messages")
    private boolean debug;

    /** working directory */
    @Option(name = "-w", aliases = { "--workDir" }, metaVar = "workDir", usage = "working directory for relative file names")
    private File workDir;

    /**
     * Construct a command processor.
     */
    public BaseProcessor() {
        this.parsed = false;
        this.exitCode = 0;
    }

    /**
     * Parse the command-line parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        this.help = false;
        this.debug = false;
        this.workDir = new File(System.getProperty("user.dir"));
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                if (this.debug)
                    setRootLevel(Level.DEBUG);
                if (! this.workDir.isDirectory())
                    throw new ConfigurationException("Working directory " + this.workDir + " does not exist.");
                this.parsed = this.validateParms();
            }
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.exitCode = 2;
        } catch (PipelineException e) {
            log.error("Invalid parameters: {}", e.getMessage());
            this.exitCode = e.getExitCode();
        } catch (IOException e) {
            log.error("Error validating parameters: {}", e.toString());
            this.exitCode = 2;
        }
        return this.parsed;
    }

    /**
     * Run the command.  If the parameters were not parsed successfully, nothing happens.
     */
    public void run() {
        if (this.parsed) {
            this.startTime = System.currentTimeMillis();
            try {
                this.runCommand();
                if (log.isInfoEnabled()) {
                    Duration d = Duration.ofMillis(System.currentTimeMillis() - this.startTime);
                    log.info("{} to run command.", d);
                }
            } catch (PipelineException e) {
                log.error("{}: {}", e.getClass().getSimpleName(), e.getMessage());
                this.exitCode = e.getExitCode();
            } catch (Exception e) {
                log.error("Command failed.", e);
                this.exitCode = 1;
            }
        }
    }

    /**
     * Set the logging level of the root logger.
     *
     * @param level		new logging level
     */
    public static void setRootLevel(Level level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    /**
     * @return a file name resolved against the working directory
     *
     * @param file	file name to resolve (may be NULL)
     */
    protected File resolve(File file) {
        File retVal = file;
        if (file != null && ! file.isAbsolute())
            retVal = new File(this.workDir, file.getPath());
        return retVal;
    }

    /**
     * @return the working directory
     */
    public File getWorkDir() {
        return this.workDir;
    }

    /**
     * @return the exit code of the command (0 for success)
     */
    public int getExitCode() {
        return this.exitCode;
    }

    /**
     * Set the defaults for the command-line parameters.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line parameters.
     *
     * @return TRUE if the command should proceed, FALSE if it should exit without running
     *
     * @throws IOException
     * @throws PipelineException
     */
    protected abstract boolean validateParms() throws IOException, PipelineException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
