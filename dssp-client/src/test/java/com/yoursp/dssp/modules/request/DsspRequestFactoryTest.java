package com.yoursp.dssp.modules.request;

import com.yoursp.dssp.TestCertificates;
import com.yoursp.dssp.config.DsspProperties;
import com.yoursp.dssp.model.Document;
import com.yoursp.dssp.model.SignerChain;
import com.yoursp.dssp.model.protocol.DocumentType;
import com.yoursp.dssp.model.protocol.OptionalInputs;
import com.yoursp.dssp.model.protocol.PendingRequest;
import com.yoursp.dssp.model.protocol.Reference;
import com.yoursp.dssp.model.protocol.SecurityTokenReference;
import com.yoursp.dssp.model.protocol.SignRequest;
import com.yoursp.dssp.model.protocol.VerifyRequest;
import com.yoursp.dssp.modules.chain.CertificateChainBuilder;
import com.yoursp.dssp.modules.request.dto.AsyncSignRequest;
import com.yoursp.dssp.modules.session.dto.AsyncSession;
import com.yoursp.dssp.modules.session.dto.TwoStepSession;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DsspRequestFactoryTest {

    private static final Document PDF = new Document("application/pdf",
            "%PDF-1.4 test content".getBytes(StandardCharsets.US_ASCII));

    private static KeyPair rootKeys;
    private static X509Certificate root;
    private static KeyPair signerKeys;
    private static X509Certificate signer;

    @Mock
    private CertificateChainBuilder chainBuilder;

    private final DsspProperties properties = new DsspProperties();

    private DsspRequestFactory factory;

    @BeforeAll
    static void setUpCertificates() {
        rootKeys = TestCertificates.rsaKeyPair();
        root = TestCertificates.selfSigned("CN=Test Root CA, C=BE", rootKeys, true);
        signerKeys = TestCertificates.rsaKeyPair();
        signer = TestCertificates.issue(TestCertificates.principal("CN=Alice (Signature), C=BE"),
                signerKeys.getPublic(), root.getSubjectX500Principal(), rootKeys.getPrivate(), false);
    }

    @BeforeEach
    void setUp() {
        properties.setSignatureType("urn:be:e-contract:dssp:signature:pades-baseline");
        factory = new DsspRequestFactory(chainBuilder, properties);
    }

    @Test
    @DisplayName("Async sign request → SCT issue with 32-byte nonce and enveloped placement on the doc id")
    void asyncSignRequest() {
        AsyncSignRequest asyncRequest = factory.createAsyncSignRequest(PDF);
        SignRequest request = asyncRequest.request();
        OptionalInputs inputs = request.getOptionalInputs();

        assertEquals(DsspProtocol.PROFILE_DSSP, request.getProfile());
        assertEquals(DsspProtocol.PROFILE_ASYNC, inputs.getAdditionalProfile());
        assertEquals(DsspProtocol.TOKEN_TYPE_SCT, inputs.getRequestSecurityToken().getTokenType());
        assertEquals(DsspProtocol.REQUEST_TYPE_ISSUE, inputs.getRequestSecurityToken().getRequestType());
        assertEquals(DsspProtocol.BINARY_SECRET_NONCE,
                inputs.getRequestSecurityToken().getEntropy().getBinarySecret().getType());
        assertEquals(32, asyncRequest.clientNonce().length);
        assertArrayEquals(asyncRequest.clientNonce(),
                inputs.getRequestSecurityToken().getEntropy().getBinarySecret().getValue());
        assertEquals("urn:be:e-contract:dssp:signature:pades-baseline", inputs.getSignatureType());

        DocumentType document = request.getInputDocuments().getDocuments().get(0);
        assertTrue(document.getId().startsWith("doc-"));
        assertEquals(asyncRequest.documentId(), document.getId());
        assertEquals(document.getId(), inputs.getSignaturePlacement().getWhichDocument());
        assertTrue(inputs.getSignaturePlacement().getCreateEnvelopedSignature());
        assertEquals("application/pdf", document.getBase64Data().getMimeType());
        assertArrayEquals(PDF.getContent(), document.getBase64Data().getValue());
    }

    @Test
    @DisplayName("Two async requests → different doc ids and nonces")
    void freshIdsAndNonces() {
        AsyncSignRequest first = factory.createAsyncSignRequest(PDF);
        AsyncSignRequest second = factory.createAsyncSignRequest(PDF);

        assertNotEquals(first.documentId(), second.documentId());
        assertFalse(Arrays.equals(first.clientNonce(), second.clientNonce()));
    }

    @Test
    @DisplayName("Blank signature type → omitted (service default)")
    void blankSignatureType() {
        properties.setSignatureType(" ");

        SignRequest request = factory.createSealRequest(PDF);

        assertNull(request.getOptionalInputs().getSignatureType());
    }

    @Test
    @DisplayName("Seal request → eSeal profile, no token request")
    void sealRequest() {
        SignRequest request = factory.createSealRequest(PDF);

        assertEquals(DsspProtocol.PROFILE_ESEAL, request.getProfile());
        assertNull(request.getOptionalInputs().getRequestSecurityToken());
        assertEquals(request.getInputDocuments().getDocuments().get(0).getId(),
                request.getOptionalInputs().getSignaturePlacement().getWhichDocument());
    }

    @Test
    @DisplayName("Two-step, single non self-signed cert → chain completed by the builder")
    void twoStepCompletesChain() throws Exception {
        when(chainBuilder.buildChain(signer)).thenReturn(List.of(signer, root));

        SignRequest request = factory.createTwoStepSignRequest(PDF, new SignerChain(signer, signerKeys.getPrivate()));
        OptionalInputs inputs = request.getOptionalInputs();

        assertEquals(DsspProtocol.PROFILE_LOCALSIG, request.getProfile());
        assertEquals(DsspProtocol.POLICY_TWO_STEP, inputs.getServicePolicy());
        assertTrue(inputs.getRequestDocumentHash().getMaintainRequestState());
        List<byte[]> embedded = inputs.getKeySelector().getKeyInfo().getX509Data().getCertificates();
        assertEquals(2, embedded.size());
        assertArrayEquals(signer.getEncoded(), embedded.get(0));
        assertArrayEquals(root.getEncoded(), embedded.get(1));
    }

    @Test
    @DisplayName("Two-step, full chain supplied → embedded verbatim")
    void twoStepChainVerbatim() throws Exception {
        SignRequest request = factory.createTwoStepSignRequest(PDF,
                new SignerChain(List.of(signer, root), signerKeys.getPrivate()));

        List<byte[]> embedded = request.getOptionalInputs().getKeySelector().getKeyInfo().getX509Data()
                .getCertificates();
        assertEquals(2, embedded.size());
        assertArrayEquals(signer.getEncoded(), embedded.get(0));
        verifyNoInteractions(chainBuilder);
    }

    @Test
    @DisplayName("Two-step, self-signed signer → no chain lookup")
    void twoStepSelfSigned() {
        SignRequest request = factory.createTwoStepSignRequest(PDF, new SignerChain(root, rootKeys.getPrivate()));

        assertEquals(1, request.getOptionalInputs().getKeySelector().getKeyInfo().getX509Data()
                .getCertificates().size());
        verify(chainBuilder, never()).buildChain(any());
    }

    @Test
    @DisplayName("Two-step without private key or certificate → IllegalStateException")
    void twoStepUnusableSigner() {
        assertThrows(IllegalStateException.class,
                () -> factory.createTwoStepSignRequest(PDF, new SignerChain(signer, null)));
        assertThrows(IllegalStateException.class,
                () -> factory.createTwoStepSignRequest(PDF, new SignerChain(List.of(), signerKeys.getPrivate())));
        assertThrows(NullPointerException.class, () -> factory.createTwoStepSignRequest(PDF, null));
    }

    @Test
    @DisplayName("Async download → Cancel of the issued token reference, echoed as is")
    void asyncDownloadRequest() {
        SecurityTokenReference reference = new SecurityTokenReference(new Reference("urn:uuid:sct-1",
                DsspProtocol.TOKEN_TYPE_SCT));
        AsyncSession session = new AsyncSession("server-1", "urn:uuid:sct-1", new byte[32], reference,
                Instant.now().plusSeconds(300));

        PendingRequest request = factory.createDownloadRequest(session);
        OptionalInputs inputs = request.getOptionalInputs();

        assertEquals(DsspProtocol.PROFILE_ASYNC, inputs.getAdditionalProfile());
        assertEquals("server-1", inputs.getResponseId());
        assertEquals(DsspProtocol.REQUEST_TYPE_CANCEL, inputs.getRequestSecurityToken().getRequestType());
        assertSame(reference, inputs.getRequestSecurityToken().getCancelTarget().getSecurityTokenReference());
    }

    @Test
    @DisplayName("Async session without token reference → NullPointerException, nothing made up")
    void asyncDownloadWithoutReference() {
        AsyncSession session = new AsyncSession("server-1", "urn:uuid:sct-1", new byte[32], null,
                Instant.now().plusSeconds(300));

        assertThrows(NullPointerException.class, () -> factory.createDownloadRequest(session));
    }

    @Test
    @DisplayName("Two-step download → correlation id and signature value unchanged")
    void twoStepDownloadRequest() {
        TwoStepSession session = new TwoStepSession(new SignerChain(signer, signerKeys.getPrivate()), "corr-42",
                "http://www.w3.org/2001/04/xmlenc#sha256", new byte[32]);
        byte[] signatureValue = { 1, 2, 3, 4 };

        SignRequest request = factory.createDownloadRequest(session, signatureValue);
        OptionalInputs inputs = request.getOptionalInputs();

        assertEquals(DsspProtocol.PROFILE_LOCALSIG, request.getProfile());
        assertEquals(DsspProtocol.POLICY_TWO_STEP, inputs.getServicePolicy());
        assertEquals("corr-42", inputs.getCorrelationId());
        assertArrayEquals(signatureValue, inputs.getSignatureObject().getBase64Signature().getValue());
        assertNull(request.getInputDocuments());
    }

    @Test
    @DisplayName("Verify request → report with verifier and certificate values")
    void verifyRequest() {
        VerifyRequest request = factory.createVerifyRequest(PDF);

        assertEquals(DsspProtocol.PROFILE_DSSP, request.getProfile());
        assertTrue(request.getOptionalInputs().getReturnVerificationReport().getIncludeVerifier());
        assertTrue(request.getOptionalInputs().getReturnVerificationReport().getIncludeCertificateValues());
        assertTrue(request.getInputDocuments().getDocuments().get(0).getId().startsWith("doc-"));
    }

    @Test
    @DisplayName("Missing document → NullPointerException")
    void nullDocument() {
        assertThrows(NullPointerException.class, () -> factory.createAsyncSignRequest(null));
        assertThrows(NullPointerException.class, () -> factory.createSealRequest(null));
        assertThrows(NullPointerException.class, () -> factory.createVerifyRequest(null));
    }
}
