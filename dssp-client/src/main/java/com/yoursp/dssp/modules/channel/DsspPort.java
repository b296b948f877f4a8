package com.yoursp.dssp.modules.channel;

import com.yoursp.dssp.model.protocol.PendingRequest;
import com.yoursp.dssp.model.protocol.SignRequest;
import com.yoursp.dssp.model.protocol.SignResponse;
import com.yoursp.dssp.model.protocol.VerifyRequest;
import com.yoursp.dssp.model.protocol.VerifyResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Request/response exchange with the DSS-P service, already bound to one
 * authentication mode. Each operation is a single round trip; failures are
 * thrown (or complete the future) as they occur.
 */
public interface DsspPort {

    SignResponse sign(SignRequest request);

    CompletableFuture<SignResponse> signAsync(SignRequest request);

    SignResponse pendingRequest(PendingRequest request);

    CompletableFuture<SignResponse> pendingRequestAsync(PendingRequest request);

    VerifyResponse verify(VerifyRequest request);

    CompletableFuture<VerifyResponse> verifyAsync(VerifyRequest request);
}
