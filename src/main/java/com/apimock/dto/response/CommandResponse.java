package com.apimock.dto.response;

/**
 * The outcome of a shell command or a notification, rendered as one colored console line.
 *
 * @param status  whether the outcome is a success, a warning or a failure
 * @param message the text shown to the user
 */
public record CommandResponse(Status status, String message) {

    public enum Status {
        SUCCESS("\u001B[32m"),
        WARNING("\u001B[33m"),
        FAILURE("\u001B[31m");

        private final String ansiColor;

        Status(String ansiColor) {
            this.ansiColor = ansiColor;
        }
    }

    private static final String ANSI_RESET = "\u001B[0m";

    public static CommandResponse success(String message) {
        return new CommandResponse(Status.SUCCESS, message);
    }

    public static CommandResponse warning(String message) {
        return new CommandResponse(Status.WARNING, message);
    }

    public static CommandResponse failure(String message) {
        return new CommandResponse(Status.FAILURE, message);
    }

    /**
     * @return the message wrapped in the ANSI color of its status (green, yellow or red)
     */
    public String toAnsiString() {
        return status.ansiColor + message + ANSI_RESET;
    }
}
