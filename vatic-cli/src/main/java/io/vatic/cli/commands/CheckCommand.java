package io.vatic.cli.commands;

import io.vatic.core.template.TemplateException;
import io.vatic.core.template.Token;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import picocli.CommandLine;

/// CLI command for validating templates without rendering them.
///
/// Checks tag syntax and for/endfor nesting. Tag names, dictionary keys and secrets are
/// only known at render time and are not checked, except that pipes missing from the
/// engine's registry are reported as warnings.
///
/// ### Usage
/// ```bash
/// vatic check <template>...
/// ```
@CommandLine.Command(name = "check", description = "Validate template syntax")
class CheckCommand extends VaticCommand {

    @CommandLine.Parameters(arity = "1..*", description = "Template files")
    private List<Path> templates = new ArrayList<>();

    @Override
    protected int execute() {
        int failures = 0;
        for (Path template : templates) {
            if (!check(template)) {
                failures++;
            }
        }

        if (templates.size() > 1) {
            System.out.println(
                    "   Checked: " + templates.size() + ", failed: " + failures);
        }
        return failures == 0 ? OK : FAILED;
    }

    private boolean check(Path template) {
        String name = template.getFileName().toString();
        List<Token> tokens;
        try {
            tokens = engine.validate(Files.readString(template));
        } catch (TemplateException e) {
            System.err.println(" [FAIL] " + name + ": " + e.getMessage());
            return false;
        } catch (IOException e) {
            System.err.println(" [FAIL] " + name + ": cannot read file: " + e.getMessage());
            return false;
        }

        System.out.println(" [OK] " + name + " (" + tokens.size() + " tokens)");
        Set<String> unknownPipes = unknownPipes(tokens);
        if (!unknownPipes.isEmpty()) {
            System.out.println(" [WARN] Unknown pipes: " + String.join(", ", unknownPipes));
        }
        return true;
    }

    private Set<String> unknownPipes(List<Token> tokens) {
        Set<String> unknown = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (token instanceof Token.Tag tag
                    && tag.content().hasPipe()
                    && !engine.pipes().contains(tag.content().pipe())) {
                unknown.add(tag.content().pipe());
            }
        }
        return unknown;
    }

    @Override
    protected String failureLabel() {
        return "Check failed";
    }
}
