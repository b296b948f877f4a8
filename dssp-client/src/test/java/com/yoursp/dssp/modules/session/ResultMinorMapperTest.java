package com.yoursp.dssp.modules.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultMinorMapperTest {

    @Test
    @DisplayName("Known DSS-P minor codes → readable message")
    void knownCodes() {
        assertEquals("User cancelled the signing ceremony",
                ResultMinorMapper.toMessage("urn:be:e-contract:dssp:1.0:resultminor:user-cancelled"));
        assertEquals("Signature is invalid",
                ResultMinorMapper.toMessage("urn:oasis:names:tc:dss:1.0:resultminor:invalid:IncorrectSignature"));
    }

    @Test
    @DisplayName("Unknown code → raw URI")
    void unknownCode() {
        String unknown = "urn:some:unknown:code";
        assertEquals(unknown, ResultMinorMapper.toMessage(unknown));
    }

    @Test
    @DisplayName("null/blank → default text")
    void nullBlank() {
        assertEquals("No additional error details", ResultMinorMapper.toMessage(null));
        assertEquals("No additional error details", ResultMinorMapper.toMessage(" "));
    }
}
