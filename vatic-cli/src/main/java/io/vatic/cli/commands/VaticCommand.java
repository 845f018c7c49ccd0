package io.vatic.cli.commands;

import io.vatic.core.template.TemplateEngine;
import io.vatic.core.template.TemplateException;
import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;

/// Minimal abstract base for all Vatic CLI commands.
///
/// Owns the {@link #call()} / {@link #execute()} contract: failures raised by
/// {@link #execute()} are reported as a ` [FAIL]` line on stderr and turned into exit
/// code 1, so subcommands only handle their happy path.
///
/// @see RenderCommand
/// @see CheckCommand
public abstract class VaticCommand implements Callable<Integer> {

    static final int OK = 0;
    static final int FAILED = 1;

    private static final Logger rootLogger = Logger.getLogger("io.vatic");

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Log engine activity to stderr")
    private boolean verbose;

    protected TemplateEngine engine = TemplateEngine.create();

    @Override
    public final Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        try {
            return execute();
        } catch (TemplateException e) {
            System.err.println(" [FAIL] " + failureLabel() + ": " + e.getMessage());
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot read input: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.err.println(" [FAIL] Invalid input: " + e.getMessage());
        }
        return FAILED;
    }

    /// Runs the command.
    ///
    /// @return the process exit code
    /// @throws TemplateException if a template cannot be parsed or rendered
    /// @throws IOException if an input or output file cannot be accessed
    protected abstract int execute() throws TemplateException, IOException;

    /// Prefix of the ` [FAIL]` line printed for a {@link TemplateException}.
    protected abstract String failureLabel();

    /// Routes `io.vatic` records at `FINE` and above to one console handler. Repeated calls
    /// reuse the handler already installed.
    static synchronized void enableVerboseLogging() {
        rootLogger.setLevel(Level.FINE);
        rootLogger.setUseParentHandlers(false);
        for (Handler existing : rootLogger.getHandlers()) {
            if (existing instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        rootLogger.addHandler(handler);
    }
}
