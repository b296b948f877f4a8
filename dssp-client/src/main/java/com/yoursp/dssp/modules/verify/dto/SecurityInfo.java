package com.yoursp.dssp.modules.verify.dto;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a verification that found at least one signature.
 * <p>
 * {@link #getSignatures()} follows the order of the verification report.
 * {@link #getTimeStampValidity()} is the moment before which the document
 * timestamps must be renewed, {@link Instant#MAX} when the service gives none.
 * </p>
 */
@Getter
public class SecurityInfo {

    private final Instant timeStampValidity;
    private final List<SignatureInfo> signatures;

    public SecurityInfo(Instant timeStampValidity, List<SignatureInfo> signatures) {
        this.timeStampValidity = timeStampValidity == null ? Instant.MAX : timeStampValidity;
        this.signatures = List.copyOf(signatures);
    }
}
