package com.apimock.service.api;

import com.apimock.model.Environment;
import java.util.Map;

/**
 * Keeps imported environments between sessions, keyed by a user-chosen alias.
 */
public interface EnvironmentStore {

    /**
     * Saves or replaces the environment stored under {@code alias}.
     *
     * @param alias       the unique alias used in later commands
     * @param environment the environment to persist
     */
    void saveEnvironment(String alias, Environment environment);

    /**
     * @param alias the alias the environment was saved under
     * @return the environment, or {@code null} if nothing is stored under that alias
     */
    Environment getEnvironment(String alias);

    /**
     * @return an unmodifiable view of every stored environment, keyed by alias
     */
    Map<String, Environment> getEnvironments();
}
