package com.apimock.cli;

import com.apimock.dto.request.ImportSpecRequest;
import com.apimock.dto.response.CommandResponse;
import com.apimock.model.Environment;
import com.apimock.service.api.EnvironmentStore;
import com.apimock.service.api.OpenApiConverterService;
import java.util.Optional;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that turns a Swagger 2.0 or OpenAPI 3.x document into a stored
 * mock environment.
 */
@ShellComponent
public class ImportCommand {

    private final OpenApiConverterService converterService;
    private final EnvironmentStore environmentStore;

    public ImportCommand(OpenApiConverterService converterService, EnvironmentStore environmentStore) {
        this.converterService = converterService;
        this.environmentStore = environmentStore;
    }

    /**
     * Imports a document and stores the resulting environment under {@code alias}, replacing
     * any environment already stored there. Problems with the document itself have already
     * been reported by the converter when this returns a failure.
     *
     * @param alias  the alias to store the environment under
     * @param source the file path or URL of the document
     * @return a colored result line
     */
    @ShellMethod(key = "import-spec", value = "Imports a Swagger 2.0 or OpenAPI 3.x document as a mock environment.")
    public String importSpec(
            @ShellOption(help = "The alias to store the environment under.") String alias,
            @ShellOption(help = "The file path or URL of the specification.") String source
    ) {
        var request = new ImportSpecRequest(alias, source);
        CommandResponse response;
        try {
            Optional<Environment> environment = converterService.importSpecification(request.source());
            if (environment.isPresent()) {
                environmentStore.saveEnvironment(request.alias(), environment.get());
                response = CommandResponse.success("Imported " + environment.get().getRoutes().size()
                        + " route(s) into environment '" + request.alias() + "'.");
            } else {
                response = CommandResponse.failure("Nothing was imported from '" + request.source() + "'.");
            }
        } catch (Exception e) {
            response = CommandResponse.failure("Failed to store environment: " + e.getMessage());
        }
        return response.toAnsiString();
    }
}
