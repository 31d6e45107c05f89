package com.apimock.service.impl;

import com.apimock.dto.response.CommandResponse;
import com.apimock.service.api.Notifier;
import org.springframework.stereotype.Component;

/**
 * Prints notifications to the console, colored like command results.
 */
@Component
public class ConsoleNotifier implements Notifier {

    @Override
    public void warning(String message) {
        System.out.println(CommandResponse.warning(message).toAnsiString());
    }

    @Override
    public void error(String message) {
        System.out.println(CommandResponse.failure(message).toAnsiString());
    }
}
