package com.yoursp.dssp.modules.request.dto;

import com.yoursp.dssp.model.protocol.SignRequest;

/**
 * Asynchronous sign request together with the client nonce it carries, which
 * is needed again to derive the session key from the response.
 */
public record AsyncSignRequest(SignRequest request, byte[] clientNonce, String documentId) {
}
