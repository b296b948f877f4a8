package com.yoursp.dssp.modules.client;

import com.yoursp.dssp.model.Document;
import com.yoursp.dssp.model.SignerChain;
import com.yoursp.dssp.model.protocol.PendingRequest;
import com.yoursp.dssp.model.protocol.SignRequest;
import com.yoursp.dssp.model.protocol.VerifyRequest;
import com.yoursp.dssp.modules.channel.ChannelSelector;
import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.crypto.LocalSignatureCalculator;
import com.yoursp.dssp.modules.request.DsspRequestFactory;
import com.yoursp.dssp.modules.request.dto.AsyncSignRequest;
import com.yoursp.dssp.modules.session.DsspResponseProcessor;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import com.yoursp.dssp.modules.session.dto.TwoStepSession;
import com.yoursp.dssp.modules.verify.dto.SecurityInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for the DSS-P flows: asynchronous (BROWSER/POST) signing,
 * two-step local signing, eSeal and verification.
 * <p>
 * Every operation builds one request, makes one call to the service and
 * validates the answer. Each flow exists in a blocking form and a
 * {@link CompletableFuture} form with the same validation and the same
 * exceptions; the future completes exceptionally where the blocking form
 * throws. Nothing is retried.
 * </p>
 * <ul>
 * <li>{@link com.yoursp.dssp.exception.DsspResultException}: unexpected result code</li>
 * <li>{@link com.yoursp.dssp.exception.DsspProtocolViolationException}: response misses required content</li>
 * <li>{@link com.yoursp.dssp.exception.DsspTransportException}: HTTP, I/O or SOAP fault</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DsspClient {

    private final DsspRequestFactory requestFactory;
    private final ChannelSelector channelSelector;
    private final DsspResponseProcessor responseProcessor;
    private final LocalSignatureCalculator signatureCalculator;
    private final ApplicationCredentials applicationCredentials;

    // ----- asynchronous (BROWSER/POST) signing

    /**
     * Uploads a document for signing by a user through the BROWSER/POST
     * protocol.
     *
     * @return the session to hand to the BROWSER/POST step and to the download
     */
    public AsyncSession uploadDocument(Document document) {
        AsyncSignRequest request = requestFactory.createAsyncSignRequest(document);
        log.info("DSS-P upload: documentId={}, size={}", request.documentId(), document.getSize());
        return responseProcessor.processAsyncSignResponse(
                channelSelector.open(applicationCredentials).sign(request.request()), request.clientNonce());
    }

    public CompletableFuture<AsyncSession> uploadDocumentAsync(Document document) {
        return async(() -> {
            AsyncSignRequest request = requestFactory.createAsyncSignRequest(document);
            log.info("DSS-P upload: documentId={}, size={}", request.documentId(), document.getSize());
            return channelSelector.open(applicationCredentials).signAsync(request.request())
                    .thenApply(response -> responseProcessor.processAsyncSignResponse(response,
                            request.clientNonce()));
        });
    }

    /**
     * Downloads the document signed through BROWSER/POST. This closes the
     * session on the service; the session cannot be used again.
     */
    public Document downloadDocument(AsyncSession session) {
        PendingRequest request = requestFactory.createDownloadRequest(session);
        log.info("DSS-P download: serverId={}", session.getServerId());
        return responseProcessor.processSignedDocumentResponse(
                channelSelector.open(session).pendingRequest(request));
    }

    public CompletableFuture<Document> downloadDocumentAsync(AsyncSession session) {
        return async(() -> {
            PendingRequest request = requestFactory.createDownloadRequest(session);
            log.info("DSS-P download: serverId={}", session.getServerId());
            return channelSelector.open(session).pendingRequestAsync(request)
                    .thenApply(responseProcessor::processSignedDocumentResponse);
        });
    }

    // ----- two-step signing

    /**
     * Uploads a document for a local signature by {@code signer}.
     *
     * @throws IllegalStateException when the signer has no end certificate or no private key
     */
    public TwoStepSession uploadDocumentForTwoStep(Document document, SignerChain signer) {
        SignRequest request = requestFactory.createTwoStepSignRequest(document, signer);
        log.info("DSS-P two-step upload: signer={}", signer.getSigner().getSubjectX500Principal());
        return responseProcessor.processTwoStepSignResponse(
                channelSelector.open(applicationCredentials).sign(request), signer);
    }

    public CompletableFuture<TwoStepSession> uploadDocumentForTwoStepAsync(Document document, SignerChain signer) {
        return async(() -> {
            SignRequest request = requestFactory.createTwoStepSignRequest(document, signer);
            log.info("DSS-P two-step upload: signer={}", signer.getSigner().getSubjectX500Principal());
            return channelSelector.open(applicationCredentials).signAsync(request)
                    .thenApply(response -> responseProcessor.processTwoStepSignResponse(response, signer));
        });
    }

    /**
     * Signs the session digest with the signer's private key and downloads
     * the signed document.
     */
    public Document downloadDocument(TwoStepSession session) {
        Objects.requireNonNull(session, "session");
        return downloadDocument(session, signatureCalculator.sign(session));
    }

    public CompletableFuture<Document> downloadDocumentAsync(TwoStepSession session) {
        return async(() -> {
            Objects.requireNonNull(session, "session");
            return downloadDocumentAsync(session, signatureCalculator.sign(session));
        });
    }

    /**
     * Downloads the signed document, with a signature value computed by the
     * caller over {@link TwoStepSession#getDigestValue()}.
     */
    public Document downloadDocument(TwoStepSession session, byte[] signatureValue) {
        SignRequest request = requestFactory.createDownloadRequest(session, signatureValue);
        log.info("DSS-P two-step download: correlationId={}", session.getCorrelationId());
        return responseProcessor.processSignedDocumentResponse(
                channelSelector.open(applicationCredentials).sign(request));
    }

    public CompletableFuture<Document> downloadDocumentAsync(TwoStepSession session, byte[] signatureValue) {
        return async(() -> {
            SignRequest request = requestFactory.createDownloadRequest(session, signatureValue);
            log.info("DSS-P two-step download: correlationId={}", session.getCorrelationId());
            return channelSelector.open(applicationCredentials).signAsync(request)
                    .thenApply(responseProcessor::processSignedDocumentResponse);
        });
    }

    // ----- eSeal

    /**
     * Seals a document with the key the service selects for the
     * authenticated application.
     */
    public Document seal(Document document) {
        SignRequest request = requestFactory.createSealRequest(document);
        log.info("DSS-P seal: size={}", document.getSize());
        return responseProcessor.processSignedDocumentResponse(
                channelSelector.open(applicationCredentials).sign(request));
    }

    public CompletableFuture<Document> sealAsync(Document document) {
        return async(() -> {
            SignRequest request = requestFactory.createSealRequest(document);
            log.info("DSS-P seal: size={}", document.getSize());
            return channelSelector.open(applicationCredentials).signAsync(request)
                    .thenApply(responseProcessor::processSignedDocumentResponse);
        });
    }

    // ----- verification

    /**
     * Verifies the signatures of a document.
     *
     * @return the signatures found, or empty when the document is not signed
     */
    public Optional<SecurityInfo> verify(Document document) {
        VerifyRequest request = requestFactory.createVerifyRequest(document);
        log.info("DSS-P verify: size={}", document.getSize());
        return responseProcessor.processVerifyResponse(channelSelector.open(applicationCredentials).verify(request));
    }

    public CompletableFuture<Optional<SecurityInfo>> verifyAsync(Document document) {
        return async(() -> {
            VerifyRequest request = requestFactory.createVerifyRequest(document);
            log.info("DSS-P verify: size={}", document.getSize());
            return channelSelector.open(applicationCredentials).verifyAsync(request)
                    .thenApply(responseProcessor::processVerifyResponse);
        });
    }

    private static <T> CompletableFuture<T> async(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
