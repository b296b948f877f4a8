package com.yoursp.dssp.modules.session;

import com.yoursp.dssp.exception.DsspProtocolViolationException;
import com.yoursp.dssp.exception.DsspResultException;
import com.yoursp.dssp.model.Document;
import com.yoursp.dssp.model.SignerChain;
import com.yoursp.dssp.model.protocol.DocumentHash;
import com.yoursp.dssp.model.protocol.DocumentType;
import com.yoursp.dssp.model.protocol.OptionalOutputs;
import com.yoursp.dssp.model.protocol.RequestSecurityTokenResponse;
import com.yoursp.dssp.model.protocol.ResponseBase;
import com.yoursp.dssp.model.protocol.Result;
import com.yoursp.dssp.model.protocol.SignResponse;
import com.yoursp.dssp.model.protocol.VerifyResponse;
import com.yoursp.dssp.model.protocol.XmlDateTimes;
import com.yoursp.dssp.modules.crypto.Psha1DerivedKeyGenerator;
import com.yoursp.dssp.modules.request.DsspProtocol;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import com.yoursp.dssp.modules.session.dto.TwoStepSession;
import com.yoursp.dssp.modules.verify.VerificationReportMapper;
import com.yoursp.dssp.modules.verify.dto.SecurityInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates service responses and extracts the state each flow continues
 * with.
 * <p>
 * Every response first goes through {@link #validate}. A result code other
 * than the one the flow expects is reported verbatim as a
 * {@link DsspResultException}; a response with the right code but without
 * the outputs the flow needs raises {@link DsspProtocolViolationException}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DsspResponseProcessor {

    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final VerificationReportMapper reportMapper;

    /**
     * Checks the result triple of a response.
     *
     * @param expectedMinor minor code to require, or {@code null} for any
     */
    public void validate(ResponseBase response, String expectedMajor, String expectedMinor) {
        if (response == null || response.getResult() == null) {
            throw new DsspProtocolViolationException("Response without result");
        }
        Result result = response.getResult();
        String message = result.getResultMessage() == null ? null : result.getResultMessage().getValue();

        if (!Objects.equals(expectedMajor, result.getResultMajor())
                || (expectedMinor != null && !expectedMinor.equals(result.getResultMinor()))) {
            log.warn("DSS-P unexpected result: major={}, minor={}, requestId={}",
                    result.getResultMajor(), result.getResultMinor(), response.getRequestId());
            throw new DsspResultException(result.getResultMajor(), result.getResultMinor(), message);
        }
    }

    /**
     * Async upload: the service answers Pending and issues a security-context
     * token. The session key is derived from the client nonce and the server
     * entropy.
     */
    public AsyncSession processAsyncSignResponse(SignResponse response, byte[] clientNonce) {
        validate(response, DsspProtocol.RESULT_MAJOR_PENDING, null);

        OptionalOutputs outputs = requireOutputs(response);
        if (outputs.getRequestSecurityTokenResponseCollection() == null
                || outputs.getRequestSecurityTokenResponseCollection().getResponses() == null
                || outputs.getRequestSecurityTokenResponseCollection().getResponses().isEmpty()) {
            throw new DsspProtocolViolationException("Pending response without security token response");
        }
        RequestSecurityTokenResponse tokenResponse =
                outputs.getRequestSecurityTokenResponseCollection().getResponses().get(0);

        if (tokenResponse.getRequestedSecurityToken() == null
                || tokenResponse.getRequestedSecurityToken().getSecurityContextToken() == null) {
            throw new DsspProtocolViolationException("Security token response without security context token");
        }
        if (tokenResponse.getEntropy() == null || tokenResponse.getEntropy().getBinarySecret() == null
                || tokenResponse.getEntropy().getBinarySecret().getValue() == null) {
            throw new DsspProtocolViolationException("Security token response without server entropy");
        }
        if (tokenResponse.getKeySize() == null) {
            throw new DsspProtocolViolationException("Security token response without key size");
        }
        if (tokenResponse.getRequestedUnattachedReference() == null
                || tokenResponse.getRequestedUnattachedReference().getSecurityTokenReference() == null) {
            throw new DsspProtocolViolationException("Security token response without unattached reference");
        }

        byte[] keyValue = Psha1DerivedKeyGenerator.deriveKey(clientNonce,
                tokenResponse.getEntropy().getBinarySecret().getValue(), tokenResponse.getKeySize());

        AsyncSession session = new AsyncSession(
                outputs.getResponseId(),
                tokenResponse.getRequestedSecurityToken().getSecurityContextToken().getIdentifier(),
                keyValue,
                tokenResponse.getRequestedUnattachedReference().getSecurityTokenReference(),
                expiresOn(tokenResponse));

        log.info("DSS-P async session opened: serverId={}, expiresOn={}", session.getServerId(), session.getExpiresOn());
        return session;
    }

    /**
     * Two-step upload: Success with minor documentHash. The signer is the one
     * supplied with the request.
     */
    public TwoStepSession processTwoStepSignResponse(SignResponse response, SignerChain signer) {
        validate(response, DsspProtocol.RESULT_MAJOR_SUCCESS, DsspProtocol.RESULT_MINOR_DOCUMENT_HASH);

        OptionalOutputs outputs = requireOutputs(response);
        DocumentHash hash = outputs.getDocumentHash();
        if (outputs.getCorrelationId() == null || hash == null || hash.getDigestValue() == null) {
            throw new DsspProtocolViolationException("Two-step response without correlation id or document hash");
        }

        TwoStepSession session = new TwoStepSession(signer, outputs.getCorrelationId(),
                hash.getDigestMethod() == null ? null : hash.getDigestMethod().getAlgorithm(),
                hash.getDigestValue());
        log.info("DSS-P two-step session opened: correlationId={}, digestAlgorithm={}",
                session.getCorrelationId(), session.getDigestAlgorithm());
        return session;
    }

    /**
     * Seal and download responses: exactly one signed document.
     */
    public Document processSignedDocumentResponse(SignResponse response) {
        validate(response, DsspProtocol.RESULT_MAJOR_SUCCESS, null);

        OptionalOutputs outputs = requireOutputs(response);
        List<DocumentType> documents = outputs.getDocumentWithSignature() == null ? null
                : outputs.getDocumentWithSignature().getDocuments();
        if (documents == null || documents.size() != 1) {
            throw new DsspProtocolViolationException("Expected exactly one signed document, got "
                    + (documents == null ? 0 : documents.size()));
        }

        DocumentType signed = documents.get(0);
        if (signed.getBase64Data() == null || signed.getBase64Data().getValue() == null) {
            throw new DsspProtocolViolationException("Signed document without content");
        }
        String mimeType = signed.getBase64Data().getMimeType() == null
                ? DEFAULT_MIME_TYPE : signed.getBase64Data().getMimeType();
        return new Document(signed.getId(), mimeType, signed.getBase64Data().getValue());
    }

    /**
     * Verify response. An absent report means the document carries no
     * signature.
     */
    public Optional<SecurityInfo> processVerifyResponse(VerifyResponse response) {
        validate(response, DsspProtocol.RESULT_MAJOR_SUCCESS, null);

        OptionalOutputs outputs = response.getOptionalOutputs();
        if (outputs == null || outputs.getVerificationReport() == null
                || outputs.getVerificationReport().getIndividualReports() == null
                || outputs.getVerificationReport().getIndividualReports().isEmpty()) {
            log.info("DSS-P verify: no signature found");
            return Optional.empty();
        }

        SecurityInfo info = reportMapper.map(outputs.getVerificationReport().getIndividualReports(),
                outputs.getTimeStampRenewal());
        log.info("DSS-P verify: signatures={}", info.getSignatures().size());
        return Optional.of(info);
    }

    private static OptionalOutputs requireOutputs(ResponseBase response) {
        if (response.getOptionalOutputs() == null) {
            throw new DsspProtocolViolationException("Response without optional outputs");
        }
        return response.getOptionalOutputs();
    }

    private static Instant expiresOn(RequestSecurityTokenResponse tokenResponse) {
        if (tokenResponse.getLifetime() == null || tokenResponse.getLifetime().getExpires() == null) {
            return null;
        }
        try {
            return XmlDateTimes.parse(tokenResponse.getLifetime().getExpires()).toInstant();
        } catch (DateTimeParseException e) {
            throw new DsspProtocolViolationException("Invalid token expiry: "
                    + tokenResponse.getLifetime().getExpires(), e);
        }
    }
}
