package com.apimock.service.impl;

import com.apimock.converter.EnvironmentExporter;
import com.apimock.converter.EnvironmentImporter;
import com.apimock.converter.VersionDetector;
import com.apimock.exception.ErrorMessage;
import com.apimock.model.Environment;
import com.apimock.model.ParsedSpecification;
import com.apimock.model.SpecificationVersion;
import com.apimock.service.api.ExportValidator;
import com.apimock.service.api.Notifier;
import com.apimock.service.api.OpenApiConverterService;
import com.apimock.service.api.SpecificationLoader;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiConverterServiceImpl implements OpenApiConverterService {

    private final SpecificationLoader specificationLoader;
    private final EnvironmentImporter environmentImporter;
    private final EnvironmentExporter environmentExporter;
    private final ExportValidator exportValidator;
    private final Notifier notifier;

    public OpenApiConverterServiceImpl(SpecificationLoader specificationLoader,
                                       EnvironmentImporter environmentImporter,
                                       EnvironmentExporter environmentExporter,
                                       ExportValidator exportValidator,
                                       Notifier notifier) {
        this.specificationLoader = specificationLoader;
        this.environmentImporter = environmentImporter;
        this.environmentExporter = environmentExporter;
        this.exportValidator = exportValidator;
        this.notifier = notifier;
    }

    /**
     * {@inheritDoc}
     * The raw document is read once to detect its version, then parsed again by the parser
     * matching that version so references are resolved.
     */
    @Override
    public Optional<Environment> importSpecification(String source) {
        log.info("Starting OpenAPI file '{}' import", source);

        try {
            JsonNode document = specificationLoader.readTree(source);
            SpecificationVersion version = VersionDetector.detect(document);
            if (version == SpecificationVersion.UNRECOGNIZED) {
                log.warn("'{}' has neither a 'swagger' field nor a 3.x 'openapi' field", source);
                notifier.warning(ErrorMessage.IMPORT_WRONG_VERSION.text());
                return Optional.empty();
            }

            ParsedSpecification specification = specificationLoader.dereference(source, version);
            return convert(specification, document);
        } catch (Exception e) {
            notifier.error(ErrorMessage.IMPORT_ERROR.withDetail(e.getMessage()));
            log.error("Error while importing OpenAPI file: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Environment> importSpecification(ParsedSpecification specification) {
        try {
            return convert(specification, null);
        } catch (Exception e) {
            notifier.error(ErrorMessage.IMPORT_ERROR.withDetail(e.getMessage()));
            log.error("Error while importing OpenAPI document: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * {@inheritDoc}
     * Validation runs on the serialized text, after the document is complete.
     */
    @Override
    public Optional<String> exportEnvironment(Environment environment) {
        log.info("Starting environment {} export to OpenAPI file", environment.getUuid());

        try {
            String document = environmentExporter.export(environment);

            List<String> problems = exportValidator.validate(document);
            if (!problems.isEmpty()) {
                problems.forEach(problem -> log.warn("OpenAPI export validation: {}", problem));
            }

            log.info("Exported environment {} with {} route(s)", environment.getUuid(), environment.getRoutes().size());
            return Optional.of(document);
        } catch (Exception e) {
            notifier.error(ErrorMessage.EXPORT_ERROR.withDetail(e.getMessage()));
            log.error("Error while exporting OpenAPI file: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Environment> convert(ParsedSpecification specification, JsonNode sourceDocument) {
        Environment environment = environmentImporter.convert(specification, sourceDocument);
        log.info("Imported {} document '{}' with {} route(s)",
                specification.version(), environment.getName(), environment.getRoutes().size());
        return Optional.of(environment);
    }
}
