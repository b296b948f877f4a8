package com.yoursp.dssp.modules.session.dto;

import com.yoursp.dssp.model.protocol.SecurityTokenReference;
import lombok.Getter;

import java.time.Instant;

/**
 * Session of an asynchronous (BROWSER/POST) signature, opened by the upload
 * and closed by the download.
 * <p>
 * All fields come from a validated upload response, except the key value
 * which is derived from the client nonce and the server entropy. The session
 * can be downloaded once; the download cancels the security-context token on
 * the service, so the caller must discard the session afterwards.
 * </p>
 */
@Getter
public class AsyncSession {

    /** Service correlation id (async ResponseID). */
    private final String serverId;

    /** Identifier of the security-context token. */
    private final String keyId;

    private final byte[] keyValue;

    /** Unattached token reference, echoed back as issued. */
    private final SecurityTokenReference keyReference;

    private final Instant expiresOn;

    public AsyncSession(String serverId, String keyId, byte[] keyValue,
            SecurityTokenReference keyReference, Instant expiresOn) {
        this.serverId = serverId;
        this.keyId = keyId;
        this.keyValue = keyValue.clone();
        this.keyReference = keyReference;
        this.expiresOn = expiresOn;
    }

    public byte[] getKeyValue() {
        return keyValue.clone();
    }

    public boolean isExpired(Instant now) {
        return expiresOn != null && !now.isBefore(expiresOn);
    }

    @Override
    public String toString() {
        return "AsyncSession[serverId=" + serverId + ", keyId=" + keyId + ", expiresOn=" + expiresOn + "]";
    }
}
