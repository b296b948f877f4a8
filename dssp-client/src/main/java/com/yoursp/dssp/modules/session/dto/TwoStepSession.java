package com.yoursp.dssp.modules.session.dto;

import com.yoursp.dssp.model.SignerChain;
import lombok.Getter;

/**
 * Session of a two-step (local) signature.
 * <p>
 * The service keeps the prepared document under {@link #getCorrelationId()}
 * and returns the digest to sign. The signer is the one supplied on upload,
 * it is not read back from the response.
 * </p>
 */
@Getter
public class TwoStepSession {

    private final SignerChain signer;
    private final String correlationId;

    /** XML-DSig digest method URI. */
    private final String digestAlgorithm;

    private final byte[] digestValue;

    public TwoStepSession(SignerChain signer, String correlationId, String digestAlgorithm, byte[] digestValue) {
        this.signer = signer;
        this.correlationId = correlationId;
        this.digestAlgorithm = digestAlgorithm;
        this.digestValue = digestValue == null ? null : digestValue.clone();
    }

    public byte[] getDigestValue() {
        return digestValue == null ? null : digestValue.clone();
    }

    @Override
    public String toString() {
        return "TwoStepSession[correlationId=" + correlationId + ", digestAlgorithm=" + digestAlgorithm + "]";
    }
}
