package com.apimock.cli;

import com.apimock.dto.request.ExportEnvironmentRequest;
import com.apimock.dto.response.CommandResponse;
import com.apimock.model.Environment;
import com.apimock.service.api.EnvironmentStore;
import com.apimock.service.api.OpenApiConverterService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that writes a stored environment out as an OpenAPI 3.0 document.
 */
@ShellComponent
public class ExportCommand {

    private final OpenApiConverterService converterService;
    private final EnvironmentStore environmentStore;

    public ExportCommand(OpenApiConverterService converterService, EnvironmentStore environmentStore) {
        this.converterService = converterService;
        this.environmentStore = environmentStore;
    }

    /**
     * Exports the environment stored under {@code alias}. Without {@code --output} the JSON
     * is returned for display.
     *
     * @param alias  the alias of the environment to export
     * @param output the file to write, optional
     * @return the document, or a colored result line
     */
    @ShellMethod(key = "export-spec", value = "Exports a stored environment as an OpenAPI 3.0 document.")
    public String exportSpec(
            @ShellOption(help = "The alias of the environment to export.") String alias,
            @ShellOption(value = {"--output", "-o"}, help = "The file to write the document to.", defaultValue = ShellOption.NULL) String output
    ) {
        var request = new ExportEnvironmentRequest(alias, output);
        Environment environment = environmentStore.getEnvironment(request.alias());
        if (environment == null) {
            return CommandResponse.failure("No environment found with alias '" + request.alias() + "'.").toAnsiString();
        }

        Optional<String> document = converterService.exportEnvironment(environment);
        if (document.isEmpty()) {
            return CommandResponse.failure("Environment '" + request.alias() + "' could not be exported.").toAnsiString();
        }
        if (request.output() == null) {
            return document.get();
        }

        try {
            Files.writeString(Path.of(request.output()), document.get(), StandardCharsets.UTF_8);
            return CommandResponse.success("Exported environment '" + request.alias() + "' to " + request.output() + ".").toAnsiString();
        } catch (IOException e) {
            return CommandResponse.failure("Could not write " + request.output() + ": " + e.getMessage()).toAnsiString();
        }
    }
}
