package im.arun.rptsearch.cli;

import im.arun.rptsearch.binary.ArchiveFormatException;
import im.arun.rptsearch.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.nio.file.NoSuchFileException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for rptsearch using Picocli.
 * Exit codes: 0 when a command ran to completion, 1 when an archive file is
 * missing or unreadable, 2 for invalid usage.
 */
@Command(
    name = "rptsearch",
    description = "Search indexed report archives by field value",
    mixinStandardHelpOptions = true,
    version = "rptsearch 1.0",
    subcommands = {SearchCommand.class, FieldsCommand.class, AuditCommand.class}
)
public class RptSearchCLI implements Callable<Integer> {
    static final int EXIT_FILE_ERROR = 1;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return spec.exitCodeOnInvalidInput();
    }

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new RptSearchCLI());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            if (e instanceof NoSuchFileException) {
                cmd.getErr().println("Error: file not found: " + e.getMessage());
            } else if (e instanceof ArchiveFormatException) {
                cmd.getErr().println("Error: unreadable archive: " + e.getMessage());
            } else {
                cmd.getErr().println("Error: " + e);
            }
            cmd.getErr().flush();
            return EXIT_FILE_ERROR;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        try {
            int exitCode = commandLine().execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
