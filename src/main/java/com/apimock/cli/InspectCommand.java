package com.apimock.cli;

import com.apimock.dto.response.CommandResponse;
import com.apimock.model.Environment;
import com.apimock.model.HttpStatusCode;
import com.apimock.model.Route;
import com.apimock.model.RouteResponse;
import com.apimock.service.api.EnvironmentStore;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for looking at stored environments.
 */
@ShellComponent
public class InspectCommand {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final EnvironmentStore environmentStore;

    public InspectCommand(EnvironmentStore environmentStore) {
        this.environmentStore = environmentStore;
    }

    @ShellMethod(key = "environments", value = "List stored environments.")
    public String environments() {
        Map<String, Environment> environments = environmentStore.getEnvironments();
        if (environments.isEmpty()) {
            return CommandResponse.warning("No environments stored yet. Use 'import-spec' first.").toAnsiString();
        }
        StringBuilder sb = new StringBuilder(ANSI_CYAN + "Stored environments:" + ANSI_RESET);
        environments.forEach((alias, environment) -> sb.append(System.lineSeparator())
                .append("  ").append(ANSI_GREEN).append(alias).append(ANSI_RESET)
                .append(" - ").append(environment.getName())
                .append(" (port ").append(environment.getPort())
                .append(", ").append(environment.getRoutes().size()).append(" route(s))"));
        return sb.toString();
    }

    /**
     * Lists the routes of one environment with their response status codes.
     *
     * @param alias the alias of the environment
     */
    @ShellMethod(key = "routes", value = "Show the routes of a stored environment.")
    public String routes(@ShellOption(help = "The alias of the environment to inspect.") String alias) {
        Environment environment = environmentStore.getEnvironment(alias);
        if (environment == null) {
            return CommandResponse.failure("No environment found with alias '" + alias + "'.").toAnsiString();
        }

        StringBuilder sb = new StringBuilder(ANSI_CYAN + "Routes of " + ANSI_YELLOW + environment.getName() + ANSI_RESET
                + " (prefix '/" + environment.getEndpointPrefix() + "', port " + environment.getPort() + ")");
        environment.getRoutes().forEach(route -> sb.append(System.lineSeparator()).append(describe(route)));
        return sb.toString();
    }

    private String describe(Route route) {
        String statuses = route.getResponses().stream()
                .map(RouteResponse::getStatusCode)
                .map(InspectCommand::describeStatus)
                .collect(Collectors.joining(", "));
        String line = "  " + ANSI_PURPLE + route.getMethod().value().toUpperCase() + ANSI_RESET
                + " /" + route.getEndpoint() + " [" + statuses + "]";
        if (route.getDocumentation() != null && !route.getDocumentation().isEmpty()) {
            line += " - " + route.getDocumentation();
        }
        return line;
    }

    private static String describeStatus(int code) {
        return HttpStatusCode.fromCode(code)
                .map(status -> code + " " + status.getReasonPhrase())
                .orElse(String.valueOf(code));
    }
}
