package com.yoursp.dssp.modules.verify.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.security.cert.X509Certificate;
import java.time.OffsetDateTime;

/**
 * One signature found by a verification.
 */
@Getter
@Builder
@AllArgsConstructor
public class SignatureInfo {

    private final OffsetDateTime signingTime;
    private final X509Certificate signer;

    /** Subject as reported by the service, long attribute names (GIVENNAME, SURNAME). */
    private final String signerSubject;

    /** Subject of {@link #signer} with short attribute names (G, SN). */
    private final String signerCertificateSubject;

    /** Claimed roles joined by ", ", or {@code null}. */
    private final String signerRole;

    private final String signatureProductionPlace;

    @Override
    public String toString() {
        return "SignatureInfo[signingTime=" + signingTime + ", signerSubject=" + signerSubject
                + ", signerRole=" + signerRole + ", signatureProductionPlace=" + signatureProductionPlace + "]";
    }
}
