package com.yoursp.dssp.modules.session;

import java.util.Map;

/**
 * Maps DSS and DSS-P ResultMinor URIs to human-readable messages.
 */
public final class ResultMinorMapper {

    private ResultMinorMapper() {
    }

    private static final Map<String, String> MINOR_MAP = Map.ofEntries(
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:documentHash",
                    "Document hash returned for local signing"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:GeneralError",
                    "General signature service error"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:NotSupported",
                    "Requested operation is not supported"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:NotAuthorized",
                    "Application is not authorized for this operation"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:ReferencedDocumentNotPresent",
                    "The document is missing or could not be parsed"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:invalid:IncorrectSignature",
                    "Signature is invalid"),
            Map.entry("urn:oasis:names:tc:dss:1.0:resultminor:valid:signature:OnAllDocuments",
                    "Valid signature on all documents"),
            Map.entry("urn:oasis:names:tc:dss:1.0:profiles:asynchronousprocessing:resultminor:TimeOut",
                    "Asynchronous request timed out on the service"),
            Map.entry("urn:be:e-contract:dssp:1.0:resultminor:user-cancelled",
                    "User cancelled the signing ceremony"),
            Map.entry("urn:be:e-contract:dssp:1.0:resultminor:client-runtime",
                    "Signing client runtime error"),
            Map.entry("urn:be:e-contract:dssp:1.0:resultminor:subject-not-authorized",
                    "Signer is not authorized to sign this document"),
            Map.entry("urn:be:e-contract:dssp:1.0:resultminor:incorrect-signature-type",
                    "Requested signature type is not supported for this document"));

    /**
     * Map a ResultMinor URI to a human-readable message.
     *
     * @param resultMinor the ResultMinor URI from the response
     * @return human-readable message, or the raw URI if not mapped
     */
    public static String toMessage(String resultMinor) {
        if (resultMinor == null || resultMinor.isBlank()) {
            return "No additional error details";
        }
        return MINOR_MAP.getOrDefault(resultMinor, resultMinor);
    }
}
