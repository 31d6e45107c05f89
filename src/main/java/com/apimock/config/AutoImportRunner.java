package com.apimock.config;

import com.apimock.model.Environment;
import com.apimock.service.api.EnvironmentStore;
import com.apimock.service.api.OpenApiConverterService;
import java.io.File;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Imports every specification found in a directory when the application starts.
 * <p>
 * The directory comes from {@code API_MOCK_SPECS_DIR}. Each {@code .json}, {@code .yaml} or
 * {@code .yml} file is imported under an alias derived from its name, e.g.
 * {@code "Pet Store.openapi.yaml"} becomes {@code "pet-store"}. Aliases that are already
 * stored are skipped, so restarts do not overwrite edited environments.
 */
@Slf4j
@Component
@Profile("!test")
public class AutoImportRunner implements CommandLineRunner {

    private final String specsDirectoryPath;
    private final OpenApiConverterService converterService;
    private final EnvironmentStore environmentStore;

    public AutoImportRunner(@Value("${API_MOCK_SPECS_DIR:/app/specs}") String specsDirectoryPath,
                            OpenApiConverterService converterService,
                            EnvironmentStore environmentStore) {
        this.specsDirectoryPath = specsDirectoryPath;
        this.converterService = converterService;
        this.environmentStore = environmentStore;
    }

    @Override
    public void run(String... args) {
        File specsDir = new File(specsDirectoryPath);
        if (!specsDir.isDirectory()) {
            log.info("Auto-import directory not found at '{}'. Skipping.", specsDirectoryPath);
            return;
        }

        File[] specFiles = specsDir.listFiles((dir, name) -> isSpecificationFile(name));
        if (specFiles == null || specFiles.length == 0) {
            log.info("No specification files found in '{}'. Skipping.", specsDirectoryPath);
            return;
        }
        Arrays.sort(specFiles);

        for (File file : specFiles) {
            String alias = aliasFor(file.getName());
            if (environmentStore.getEnvironment(alias) != null) {
                log.info("Environment '{}' is already stored, skipping {}", alias, file.getName());
                continue;
            }
            Optional<Environment> environment = converterService.importSpecification(file.getAbsolutePath());
            if (environment.isPresent()) {
                environmentStore.saveEnvironment(alias, environment.get());
                log.info("Auto-imported {} as '{}'", file.getName(), alias);
            } else {
                log.warn("Could not auto-import {}", file.getName());
            }
        }
    }

    static boolean isSpecificationFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".json") || lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    static String aliasFor(String fileName) {
        return fileName.toLowerCase(Locale.ROOT)
                .replaceFirst("(\\.(openapi|swagger))?\\.(json|ya?ml)$", "")
                .replaceAll("[^a-z0-9-]", "-");
    }
}
