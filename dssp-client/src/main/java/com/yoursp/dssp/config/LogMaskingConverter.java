package com.yoursp.dssp.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>WS-Security passwords and password= pairs: "[REDACTED]"</li>
 * <li>BinarySecret content (client nonce, server entropy): "[REDACTED]"</li>
 * <li>Base64 runs of 64 chars or more (document content, keys): first 8 chars + "..."</li>
 * </ul>
 * <p>
 * Register in the host's Logback configuration:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.dssp.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches <wsse:Password ...>secret</wsse:Password>
    private static final Pattern WSSE_PASSWORD_PATTERN = Pattern
            .compile("(<(?:\\w+:)?Password\\b[^>]*>)[^<]*(</(?:\\w+:)?Password>)");

    // Matches password=<value> or "password":"<value>"
    private static final Pattern PASSWORD_PATTERN = Pattern
            .compile("(?i)(password[\"=:]+\\s*[\"']?)[^\"&\\s,\\]]+");

    // Matches <wst:BinarySecret ...>value</wst:BinarySecret>
    private static final Pattern BINARY_SECRET_PATTERN = Pattern
            .compile("(<(?:\\w+:)?BinarySecret\\b[^>]*>)[^<]*(</(?:\\w+:)?BinarySecret>)");

    private static final Pattern BASE64_PATTERN = Pattern.compile("([A-Za-z0-9+/]{8})[A-Za-z0-9+/]{56,}={0,2}");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = WSSE_PASSWORD_PATTERN.matcher(masked).replaceAll("$1[REDACTED]$2");
        masked = PASSWORD_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = BINARY_SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]$2");
        masked = BASE64_PATTERN.matcher(masked).replaceAll("$1...");

        return masked;
    }
}
