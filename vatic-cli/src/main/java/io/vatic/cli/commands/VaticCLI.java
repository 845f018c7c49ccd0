package io.vatic.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Vatic template CLI.
///
/// Registers the available subcommands:
/// - `render` - Render a template against dictionary, secrets and a context snapshot
/// - `check` - Validate template syntax and loop nesting without rendering
///
/// @see RenderCommand
/// @see CheckCommand
@Command(
        name = "vatic",
        description = "Render and validate agent prompt templates",
        mixinStandardHelpOptions = true,
        version = "vatic 0.1.0",
        subcommands = {RenderCommand.class, CheckCommand.class})
public class VaticCLI {

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return a command line wired with all subcommands, never null
    static CommandLine commandLine() {
        return new CommandLine(new VaticCLI());
    }
}
