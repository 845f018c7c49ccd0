package io.vatic.cli.commands;

import io.vatic.core.context.Dictionary;
import io.vatic.core.context.RenderContext;
import io.vatic.core.context.Secrets;
import io.vatic.core.template.TemplateException;
import io.vatic.serialization.ContextSerializer;
import io.vatic.serialization.DictionaryLoader;
import io.vatic.serialization.SecretsLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command for rendering a template file.
///
/// The rendered text goes to stdout unless `--output` names a file. Dictionary and secrets
/// files that do not exist are treated as empty, as the engine would treat a job with no
/// configuration.
///
/// ### Usage
/// ```bash
/// vatic render [-D dictionary.toml] [-s secrets.toml] [-c context.json] [-o out.txt] <template>
/// ```
@CommandLine.Command(name = "render", description = "Render a template")
class RenderCommand extends VaticCommand {

    @CommandLine.Parameters(index = "0", description = "Template file")
    private Path template;

    @CommandLine.Option(
            names = {"-D", "--dictionary"},
            description = "Dictionary TOML file")
    private Path dictionaryFile;

    @CommandLine.Option(
            names = {"-s", "--secrets"},
            description = "Secrets TOML file")
    private Path secretsFile;

    @CommandLine.Option(
            names = {"-c", "--context"},
            description = "Context JSON with result, message, sender and memories")
    private Path contextFile;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the rendered text to this file instead of stdout")
    private Path output;

    @Override
    protected int execute() throws TemplateException, IOException {
        Dictionary dictionary =
                dictionaryFile != null ? DictionaryLoader.load(dictionaryFile) : Dictionary.empty();
        Secrets secrets = secretsFile != null ? SecretsLoader.load(secretsFile) : Secrets.empty();
        RenderContext context =
                contextFile != null
                        ? ContextSerializer.fromJson(
                                Files.readString(contextFile), dictionary, secrets)
                        : RenderContext.builder().dictionary(dictionary).secrets(secrets).build();

        String rendered = engine.render(Files.readString(template), context);

        if (output == null) {
            System.out.print(rendered);
            System.out.flush();
        } else {
            Files.writeString(output, rendered);
            System.out.println(" [OK] Rendered " + template.getFileName() + " to " + output);
        }
        return OK;
    }

    @Override
    protected String failureLabel() {
        return "Rendering " + template.getFileName() + " failed";
    }
}
