package org.ls8.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.ls8.cli.rendering.TracePrinter;
import org.ls8.config.ConfigLoader;
import org.ls8.config.LoggingConfigurator;
import org.ls8.config.MachineSettings;
import org.ls8.loader.ProgramLoadException;
import org.ls8.loader.ProgramLoader;
import org.ls8.runtime.ExecutionEngine;
import org.ls8.runtime.api.DisassembledInstruction;
import org.ls8.runtime.api.MachineFault;
import org.ls8.runtime.internal.services.RuntimeDisassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "ls8",
    mixinStandardHelpOptions = true,
    version = "LS-8 1.0",
    description = "Loads an LS-8 program file and runs it until it halts."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_LOAD_FAILURE = 1;
    public static final int EXIT_MACHINE_FAULT = 2;

    @Parameters(index = "0", paramLabel = "PROGRAM", description = "The program file (one binary byte literal per line).")
    private Path program;

    @Option(names = {"-t", "--trace"}, description = "Print a trace line for every executed instruction to stderr.")
    private boolean trace;

    @Option(names = {"-d", "--disassemble"}, description = "Print the disassembled program instead of running it.")
    private boolean disassemble;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a custom HOCON configuration file."
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final ProgramLoader loader;

    public CommandLineInterface() {
        this(new ProgramLoader());
    }

    public CommandLineInterface(ProgramLoader loader) {
        this.loader = loader;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (configFile != null && !configFile.isFile()) {
            LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
            return EXIT_LOAD_FAILURE;
        }

        final MachineSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            settings = MachineSettings.fromConfig(config);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return EXIT_LOAD_FAILURE;
        }

        final int[] image;
        try {
            image = loader.load(program);
        } catch (ProgramLoadException e) {
            LOG.error("Failed to load program: {}", e.getMessage());
            return EXIT_LOAD_FAILURE;
        }

        final PrintWriter out = spec.commandLine().getOut();
        final ExecutionEngine engine = new ExecutionEngine(out, settings.getInitialStackPointer());
        engine.load(image);

        if (disassemble) {
            for (DisassembledInstruction instruction : RuntimeDisassembler.INSTANCE.disassembleRange(engine.getMemory(), 0, image.length)) {
                out.println(instruction);
            }
            out.flush();
            return EXIT_OK;
        }

        if (trace || settings.isTrace()) {
            engine.setTraceListener(new TracePrinter(spec.commandLine().getErr()));
        }

        try {
            final long executed = engine.runToHalt();
            LOG.info("Program {} halted after {} instructions", program, executed);
            return EXIT_OK;
        } catch (MachineFault e) {
            // The engine has already logged the fault at ERROR.
            LOG.debug("Execution of {} aborted", program, e);
            return EXIT_MACHINE_FAULT;
        }
    }
}
