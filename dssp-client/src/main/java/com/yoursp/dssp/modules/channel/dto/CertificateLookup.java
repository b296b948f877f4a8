package com.yoursp.dssp.modules.channel.dto;

import java.util.Objects;

/**
 * Where to find the application certificate and its key.
 *
 * @param location      key store file
 * @param storeType     key store type, e.g. PKCS12
 * @param storePassword password of the store and of the key entry
 * @param findType      how {@code findValue} is matched
 * @param findValue     alias, subject substring or SHA-1 thumbprint
 */
public record CertificateLookup(String location, String storeType, String storePassword,
        FindType findType, String findValue) {

    public enum FindType {
        ALIAS,
        SUBJECT_NAME,
        THUMBPRINT
    }

    public CertificateLookup {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(findType, "findType");
        Objects.requireNonNull(findValue, "findValue");
        storeType = storeType == null || storeType.isBlank() ? "PKCS12" : storeType;
    }

    @Override
    public String toString() {
        return "CertificateLookup[location=" + location + ", storeType=" + storeType
                + ", findType=" + findType + ", findValue=" + findValue + "]";
    }
}
