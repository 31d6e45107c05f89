package com.apimock.service.impl;

import com.apimock.converter.EnvironmentExporter;
import com.apimock.converter.EnvironmentImporter;
import com.apimock.converter.ResponseHeaderBuilder;
import com.apimock.exception.ApiMockException;
import com.apimock.model.Environment;
import com.apimock.model.OpenApiV3Specification;
import com.apimock.model.SpecificationVersion;
import com.apimock.service.api.ExportValidator;
import com.apimock.service.api.Notifier;
import com.apimock.service.api.SpecificationLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenApiConverterServiceImplTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SpecificationLoader specificationLoader;
    @Mock
    private ExportValidator exportValidator;
    @Mock
    private Notifier notifier;

    private DefaultEntityFactory entityFactory;
    private OpenApiConverterServiceImpl converterService;

    @BeforeEach
    void setUp() {
        entityFactory = new DefaultEntityFactory("New environment", 3000);
        EnvironmentImporter importer = new EnvironmentImporter(entityFactory, new ResponseHeaderBuilder(entityFactory));
        converterService = new OpenApiConverterServiceImpl(specificationLoader, importer, new EnvironmentExporter(),
                exportValidator, notifier);
    }

    @Test
    void importSpecification_whenVersionUnrecognized_warnsAndReturnsEmpty() throws Exception {
        when(specificationLoader.readTree("legacy.json")).thenReturn(objectMapper.readTree("{\"openapi\":\"2.0\"}"));

        Optional<Environment> environment = converterService.importSpecification("legacy.json");

        assertThat(environment).isEmpty();
        verify(notifier).warning("Imported file is not a Swagger 2.0 or OpenAPI 3.x specification");
        verify(specificationLoader, never()).dereference(anyString(), any());
        verify(notifier, never()).error(anyString());
    }

    @Test
    void importSpecification_whenLoaderFails_reportsErrorAndReturnsEmpty() {
        when(specificationLoader.readTree("missing.yaml"))
                .thenThrow(new ApiMockException("Specification file not found: missing.yaml"));

        Optional<Environment> environment = converterService.importSpecification("missing.yaml");

        assertThat(environment).isEmpty();
        verify(notifier).error("Error while importing file: Specification file not found: missing.yaml");
    }

    @Test
    void importSpecification_convertsDereferencedDocument() throws Exception {
        OpenAPI openApi = new OpenAPI().info(new Info().title("Loaded").version("1"))
                .servers(List.of(new Server().url("/loaded")));
        when(specificationLoader.readTree("orders.yaml")).thenReturn(objectMapper.readTree("{\"openapi\":\"3.0.1\"}"));
        when(specificationLoader.dereference("orders.yaml", SpecificationVersion.OPENAPI_V3))
                .thenReturn(new OpenApiV3Specification(openApi));

        Optional<Environment> environment = converterService.importSpecification("orders.yaml");

        assertThat(environment).isPresent();
        assertThat(environment.get().getName()).isEqualTo("Loaded");
        assertThat(environment.get().getEndpointPrefix()).isEqualTo("loaded");
        verifyNoInteractions(notifier);
    }

    @Test
    void importSpecification_whenServerVariableHasNoDefault_reportsError() {
        OpenAPI openApi = new OpenAPI().info(new Info().title("Broken").version("1"))
                .servers(List.of(new Server().url("https://{region}.example.com")));

        Optional<Environment> environment = converterService.importSpecification(new OpenApiV3Specification(openApi));

        assertThat(environment).isEmpty();
        verify(notifier).error(startsWith("Error while importing file: Server variable 'region'"));
    }

    @Test
    void exportEnvironment_returnsDocumentEvenWhenValidationFails() throws Exception {
        Environment environment = entityFactory.newEnvironment();
        environment.setName("Exported");
        when(exportValidator.validate(anyString())).thenReturn(List.of("attribute paths is missing"));

        Optional<String> document = converterService.exportEnvironment(environment);

        assertThat(document).isPresent();
        assertThat(objectMapper.readTree(document.get()).at("/info/title").asText()).isEqualTo("Exported");
        verify(exportValidator).validate(document.get());
        verifyNoInteractions(notifier);
    }

    @Test
    void exportEnvironment_whenConstructionFails_reportsErrorAndReturnsEmpty() {
        Environment environment = entityFactory.newEnvironment();
        environment.setRoutes(null);

        Optional<String> document = converterService.exportEnvironment(environment);

        assertThat(document).isEmpty();
        verify(notifier).error(startsWith("Error while exporting environment"));
        verifyNoInteractions(exportValidator);
    }
}
