package com.apimock.config;

import com.apimock.model.Environment;
import com.apimock.service.api.EnvironmentStore;
import com.apimock.service.api.OpenApiConverterService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoImportRunnerTest {

    @Mock
    private OpenApiConverterService converterService;
    @Mock
    private EnvironmentStore environmentStore;

    @TempDir
    Path specsDirectory;

    @Test
    void run_shouldImportNewSpecificationFiles() throws Exception {
        Path orders = Files.writeString(specsDirectory.resolve("orders.yaml"), "openapi: 3.0.0");
        Files.writeString(specsDirectory.resolve("notes.txt"), "ignored");
        Environment environment = new Environment();
        when(converterService.importSpecification(orders.toFile().getAbsolutePath())).thenReturn(Optional.of(environment));

        new AutoImportRunner(specsDirectory.toString(), converterService, environmentStore).run();

        verify(environmentStore).saveEnvironment("orders", environment);
        verify(converterService, times(1)).importSpecification(anyString());
    }

    @Test
    void run_shouldSkipStoredAliases() throws Exception {
        Files.writeString(specsDirectory.resolve("orders.json"), "{}");
        when(environmentStore.getEnvironment("orders")).thenReturn(new Environment());

        new AutoImportRunner(specsDirectory.toString(), converterService, environmentStore).run();

        verifyNoInteractions(converterService);
        verify(environmentStore, never()).saveEnvironment(anyString(), any());
    }

    @Test
    void run_shouldNotStoreFailedImports() throws Exception {
        Files.writeString(specsDirectory.resolve("broken.yml"), "nope");
        when(converterService.importSpecification(anyString())).thenReturn(Optional.empty());

        new AutoImportRunner(specsDirectory.toString(), converterService, environmentStore).run();

        verify(environmentStore, never()).saveEnvironment(anyString(), any());
    }

    @Test
    void run_shouldIgnoreMissingDirectory() {
        new AutoImportRunner(specsDirectory.resolve("absent").toString(), converterService, environmentStore).run();

        verifyNoInteractions(converterService, environmentStore);
    }

    @ParameterizedTest
    @CsvSource({
            "Pet Store.openapi.yaml, pet-store",
            "orders.json, orders",
            "billing.swagger.yml, billing",
            "Users_v2.YAML, users-v2"
    })
    void aliasFor_shouldDeriveAliasFromFileName(String fileName, String alias) {
        assertThat(AutoImportRunner.aliasFor(fileName)).isEqualTo(alias);
    }

    @Test
    void isSpecificationFile_shouldAcceptJsonAndYaml() {
        assertThat(AutoImportRunner.isSpecificationFile("a.JSON")).isTrue();
        assertThat(AutoImportRunner.isSpecificationFile("a.yml")).isTrue();
        assertThat(AutoImportRunner.isSpecificationFile("a.txt")).isFalse();
    }
}
