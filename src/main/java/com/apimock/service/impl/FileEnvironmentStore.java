package com.apimock.service.impl;

import com.apimock.exception.ApiMockException;
import com.apimock.model.Environment;
import com.apimock.service.api.EnvironmentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A file-based {@link EnvironmentStore} that keeps every environment in one JSON file,
 * {@code <home>/.api-mock/environments.json}.
 * <p>
 * Environments are cached in memory and the whole file is rewritten on every save.
 * File access is synchronized. A file that cannot be parsed is moved aside and the store
 * starts empty.
 */
@Service
@Slf4j
public class FileEnvironmentStore implements EnvironmentStore {

    static final String STORE_DIRECTORY = ".api-mock";
    static final String STORE_FILE = "environments.json";

    private final File storeFile;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Map<String, Environment> environments = new ConcurrentHashMap<>();

    /**
     * @param home the directory holding {@code .api-mock}; defaults to {@code API_MOCK_HOME},
     *             then to the user's home directory
     */
    public FileEnvironmentStore(@Value("${apimock.home:${API_MOCK_HOME:${user.home}}}") String home) {
        this.storeFile = new File(new File(home, STORE_DIRECTORY), STORE_FILE);
    }

    @PostConstruct
    public void init() {
        loadState();
    }

    @Override
    public void saveEnvironment(String alias, Environment environment) {
        environments.put(alias, environment);
        saveState();
        log.info("Saved environment '{}' under alias '{}'", environment.getName(), alias);
    }

    @Override
    public Environment getEnvironment(String alias) {
        return environments.get(alias);
    }

    @Override
    public Map<String, Environment> getEnvironments() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(environments));
    }

    File getStoreFile() {
        return storeFile;
    }

    private synchronized void saveState() {
        try {
            File parentDir = storeFile.getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(storeFile, environments);
        } catch (IOException e) {
            log.error("Failed to save environments to {}", storeFile, e);
            throw new ApiMockException("Failed to save environments", e);
        }
    }

    private synchronized void loadState() {
        if (!storeFile.exists() || storeFile.length() == 0) {
            log.info("No environment file found at {}, starting with an empty store.", storeFile);
            return;
        }
        try {
            TypeReference<ConcurrentHashMap<String, Environment>> typeRef = new TypeReference<>() {};
            environments = objectMapper.readValue(storeFile, typeRef);
            log.info("Loaded {} environment(s) from {}", environments.size(), storeFile);
        } catch (Exception e) {
            log.warn("Could not parse environment file at {}. It will be backed up and the store will start empty. Error: {}",
                    storeFile, e.getMessage());
            backupCorruptedFile();
            environments = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedFile() {
        File backupFile = new File(storeFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(storeFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted environment file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to back up corrupted environment file from {} to {}",
                    storeFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
