package com.apimock.service.impl;

import com.apimock.model.Environment;
import com.apimock.model.Header;
import com.apimock.model.Method;
import com.apimock.model.Route;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileEnvironmentStoreTest {

    @TempDir
    Path home;

    private DefaultEntityFactory entityFactory;

    @BeforeEach
    void setUp() {
        entityFactory = new DefaultEntityFactory("New environment", 3000);
    }

    @Test
    void saveEnvironment_shouldSurviveReload() {
        FileEnvironmentStore store = new FileEnvironmentStore(home.toString());
        store.init();

        Environment environment = entityFactory.newEnvironment();
        environment.setName("Orders");
        environment.getHeaders().add(new Header("Content-Type", "text/plain"));
        Route route = entityFactory.newRoute();
        route.setMethod(Method.DELETE);
        route.setEndpoint("orders/:id");
        environment.getRoutes().add(route);
        store.saveEnvironment("orders", environment);

        assertThat(store.getStoreFile()).exists();
        assertThat(store.getStoreFile().toPath()).isEqualTo(home.resolve(".api-mock").resolve("environments.json"));

        FileEnvironmentStore reloaded = new FileEnvironmentStore(home.toString());
        reloaded.init();

        assertThat(reloaded.getEnvironments()).containsOnlyKeys("orders");
        Environment restored = reloaded.getEnvironment("orders");
        assertThat(restored).isEqualTo(environment);
        assertThat(restored.getRoutes().get(0).getMethod()).isEqualTo(Method.DELETE);
    }

    @Test
    void init_shouldStartEmptyWithoutFile() {
        FileEnvironmentStore store = new FileEnvironmentStore(home.toString());
        store.init();

        assertThat(store.getEnvironments()).isEmpty();
        assertThat(store.getEnvironment("anything")).isNull();
    }

    @Test
    void init_shouldBackUpCorruptedFileAndStartEmpty() throws Exception {
        Path directory = Files.createDirectories(home.resolve(".api-mock"));
        Files.writeString(directory.resolve("environments.json"), "{ not json");

        FileEnvironmentStore store = new FileEnvironmentStore(home.toString());
        store.init();

        assertThat(store.getEnvironments()).isEmpty();
        File[] backups = directory.toFile().listFiles((dir, name) -> name.startsWith("environments.json.corrupted."));
        assertThat(backups).hasSize(1);
        assertThat(directory.resolve("environments.json")).doesNotExist();
    }

    @Test
    void getEnvironments_shouldBeUnmodifiable() {
        FileEnvironmentStore store = new FileEnvironmentStore(home.toString());
        store.init();
        store.saveEnvironment("one", entityFactory.newEnvironment());

        assertThatThrownBy(() -> store.getEnvironments().put("two", entityFactory.newEnvironment()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(store.getEnvironments()).hasSize(1);
    }

    @Test
    void getEnvironment_shouldReturnSavedHeadersInOrder() {
        FileEnvironmentStore store = new FileEnvironmentStore(home.toString());
        store.init();
        Environment environment = entityFactory.newEnvironment();
        environment.setHeaders(List.of(new Header("A", "1"), new Header("B", "2")));
        store.saveEnvironment("ordered", environment);

        FileEnvironmentStore reloaded = new FileEnvironmentStore(home.toString());
        reloaded.init();

        assertThat(reloaded.getEnvironment("ordered").getHeaders())
                .extracting(Header::getKey)
                .containsExactly("A", "B");
    }
}
