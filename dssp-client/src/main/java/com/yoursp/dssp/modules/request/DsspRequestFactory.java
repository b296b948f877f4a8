package com.yoursp.dssp.modules.request;

import com.yoursp.dssp.config.DsspProperties;
import com.yoursp.dssp.model.Document;
import com.yoursp.dssp.model.SignerChain;
import com.yoursp.dssp.model.protocol.Base64Data;
import com.yoursp.dssp.model.protocol.Base64Signature;
import com.yoursp.dssp.model.protocol.BinarySecret;
import com.yoursp.dssp.model.protocol.CancelTarget;
import com.yoursp.dssp.model.protocol.DocumentType;
import com.yoursp.dssp.model.protocol.Entropy;
import com.yoursp.dssp.model.protocol.InputDocuments;
import com.yoursp.dssp.model.protocol.KeyInfo;
import com.yoursp.dssp.model.protocol.KeySelector;
import com.yoursp.dssp.model.protocol.OptionalInputs;
import com.yoursp.dssp.model.protocol.PendingRequest;
import com.yoursp.dssp.model.protocol.RequestDocumentHash;
import com.yoursp.dssp.model.protocol.RequestSecurityToken;
import com.yoursp.dssp.model.protocol.ReturnVerificationReport;
import com.yoursp.dssp.model.protocol.SecurityTokenReference;
import com.yoursp.dssp.model.protocol.SignRequest;
import com.yoursp.dssp.model.protocol.SignatureObject;
import com.yoursp.dssp.model.protocol.SignaturePlacement;
import com.yoursp.dssp.model.protocol.VerifyRequest;
import com.yoursp.dssp.model.protocol.X509Data;
import com.yoursp.dssp.modules.chain.CertificateChainBuilder;
import com.yoursp.dssp.modules.chain.PkixCertificateChainBuilder;
import com.yoursp.dssp.modules.request.dto.AsyncSignRequest;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import com.yoursp.dssp.modules.session.dto.TwoStepSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the DSS-P request messages.
 * <p>
 * Every request gets a fresh document id ({@code doc-<uuid>}) and, where
 * applicable, an enveloped signature placement on that id. Nothing here
 * touches the network; all randomness comes from a shared {@link SecureRandom},
 * which is thread-safe.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DsspRequestFactory {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final CertificateChainBuilder chainBuilder;
    private final DsspProperties properties;

    /**
     * Sign request for the asynchronous BROWSER/POST flow. Opens a secure
     * conversation with fresh client entropy.
     */
    public AsyncSignRequest createAsyncSignRequest(Document document) {
        Objects.requireNonNull(document, "document");
        String documentId = newDocumentId();

        byte[] clientNonce = new byte[DsspProtocol.CLIENT_NONCE_LENGTH];
        RANDOM.nextBytes(clientNonce);

        SignRequest request = SignRequest.builder()
                .profile(DsspProtocol.PROFILE_DSSP)
                .optionalInputs(OptionalInputs.builder()
                        .additionalProfile(DsspProtocol.PROFILE_ASYNC)
                        .requestSecurityToken(RequestSecurityToken.builder()
                                .tokenType(DsspProtocol.TOKEN_TYPE_SCT)
                                .requestType(DsspProtocol.REQUEST_TYPE_ISSUE)
                                .entropy(new Entropy(new BinarySecret(DsspProtocol.BINARY_SECRET_NONCE, clientNonce)))
                                .build())
                        .signatureType(effectiveSignatureType())
                        .signaturePlacement(envelopedSignature(documentId))
                        .build())
                .inputDocuments(inputDocuments(documentId, document))
                .build();

        log.debug("Async sign request built: documentId={}, mimeType={}", documentId, document.getMimeType());
        return new AsyncSignRequest(request, clientNonce.clone(), documentId);
    }

    /**
     * Synchronous eSeal request. The service selects the key from the
     * authenticated application.
     */
    public SignRequest createSealRequest(Document document) {
        Objects.requireNonNull(document, "document");
        String documentId = newDocumentId();

        log.debug("Seal request built: documentId={}, mimeType={}", documentId, document.getMimeType());
        return SignRequest.builder()
                .profile(DsspProtocol.PROFILE_ESEAL)
                .optionalInputs(OptionalInputs.builder()
                        .signatureType(effectiveSignatureType())
                        .signaturePlacement(envelopedSignature(documentId))
                        .build())
                .inputDocuments(inputDocuments(documentId, document))
                .build();
    }

    /**
     * First leg of a two-step signature: upload the document with the signer
     * chain and ask the service to keep it until the signature value arrives.
     *
     * @throws IllegalStateException when the signer has no end certificate or no private key
     */
    public SignRequest createTwoStepSignRequest(Document document, SignerChain signer) {
        Objects.requireNonNull(document, "document");
        requireUsableSigner(signer);
        String documentId = newDocumentId();

        return SignRequest.builder()
                .profile(DsspProtocol.PROFILE_LOCALSIG)
                .optionalInputs(OptionalInputs.builder()
                        .servicePolicy(DsspProtocol.POLICY_TWO_STEP)
                        .signatureType(effectiveSignatureType())
                        .keySelector(new KeySelector(new KeyInfo(new X509Data(encodedChain(signer)))))
                        .signaturePlacement(envelopedSignature(documentId))
                        .requestDocumentHash(new RequestDocumentHash(true))
                        .build())
                .inputDocuments(inputDocuments(documentId, document))
                .build();
    }

    /**
     * Download of an asynchronous signature. Cancels the security-context
     * token, which closes the session.
     */
    public PendingRequest createDownloadRequest(AsyncSession session) {
        Objects.requireNonNull(session, "session");
        SecurityTokenReference tokenReference = Objects.requireNonNull(session.getKeyReference(),
                "session keyReference");

        return PendingRequest.builder()
                .optionalInputs(OptionalInputs.builder()
                        .additionalProfile(DsspProtocol.PROFILE_ASYNC)
                        .responseId(session.getServerId())
                        .requestSecurityToken(RequestSecurityToken.builder()
                                .requestType(DsspProtocol.REQUEST_TYPE_CANCEL)
                                .cancelTarget(new CancelTarget(tokenReference))
                                .build())
                        .build())
                .build();
    }

    /**
     * Second leg of a two-step signature: hand the locally computed signature
     * value back under the session correlation id.
     */
    public SignRequest createDownloadRequest(TwoStepSession session, byte[] signatureValue) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(signatureValue, "signatureValue");

        return SignRequest.builder()
                .profile(DsspProtocol.PROFILE_LOCALSIG)
                .optionalInputs(OptionalInputs.builder()
                        .servicePolicy(DsspProtocol.POLICY_TWO_STEP)
                        .signatureType(effectiveSignatureType())
                        .correlationId(session.getCorrelationId())
                        .signatureObject(new SignatureObject(new Base64Signature(signatureValue.clone())))
                        .build())
                .build();
    }

    /**
     * Verification request asking for a report with verifier identity and
     * certificate values.
     */
    public VerifyRequest createVerifyRequest(Document document) {
        Objects.requireNonNull(document, "document");

        return VerifyRequest.builder()
                .profile(DsspProtocol.PROFILE_DSSP)
                .optionalInputs(OptionalInputs.builder()
                        .returnVerificationReport(new ReturnVerificationReport(true, true))
                        .build())
                .inputDocuments(inputDocuments(newDocumentId(), document))
                .build();
    }

    public static void requireUsableSigner(SignerChain signer) {
        Objects.requireNonNull(signer, "signer");
        if (!signer.isUsable()) {
            throw new IllegalStateException(
                    "SignerChain must be set and the end (first) certificate must have a private key");
        }
    }

    private List<byte[]> encodedChain(SignerChain signer) {
        List<X509Certificate> chain = signer.getCertificates();
        if (chain.size() == 1 && !PkixCertificateChainBuilder.isSelfSigned(chain.get(0))) {
            chain = chainBuilder.buildChain(chain.get(0));
        }

        List<byte[]> encoded = new ArrayList<>(chain.size());
        try {
            for (X509Certificate certificate : chain) {
                encoded.add(certificate.getEncoded());
            }
        } catch (CertificateEncodingException e) {
            throw new IllegalStateException("Unable to encode signer chain", e);
        }
        return encoded;
    }

    private String effectiveSignatureType() {
        String signatureType = properties.getSignatureType();
        return signatureType == null || signatureType.isBlank() ? null : signatureType;
    }

    private static String newDocumentId() {
        return DsspProtocol.DOCUMENT_ID_PREFIX + UUID.randomUUID();
    }

    private static SignaturePlacement envelopedSignature(String documentId) {
        return new SignaturePlacement(documentId, true);
    }

    private static InputDocuments inputDocuments(String documentId, Document document) {
        return new InputDocuments(List.of(new DocumentType(documentId,
                new Base64Data(document.getMimeType(), document.getContent()))));
    }
}
