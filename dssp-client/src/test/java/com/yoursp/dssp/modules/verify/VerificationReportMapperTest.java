package com.yoursp.dssp.modules.verify;

import com.yoursp.dssp.TestCertificates;
import com.yoursp.dssp.exception.DsspProtocolViolationException;
import com.yoursp.dssp.exception.DsspResultException;
import com.yoursp.dssp.model.protocol.CertificatePathValidity;
import com.yoursp.dssp.model.protocol.CertificateValidity;
import com.yoursp.dssp.model.protocol.DetailedSignatureReport;
import com.yoursp.dssp.model.protocol.Details;
import com.yoursp.dssp.model.protocol.IndividualReport;
import com.yoursp.dssp.model.protocol.InternationalString;
import com.yoursp.dssp.model.protocol.PathValidityDetail;
import com.yoursp.dssp.model.protocol.Result;
import com.yoursp.dssp.model.protocol.SignedObjectIdentifier;
import com.yoursp.dssp.model.protocol.SignedProperties;
import com.yoursp.dssp.model.protocol.SignedSignatureProperties;
import com.yoursp.dssp.model.protocol.SignerRole;
import com.yoursp.dssp.model.protocol.TimeStampRenewal;
import com.yoursp.dssp.modules.request.DsspProtocol;
import com.yoursp.dssp.modules.verify.dto.SecurityInfo;
import com.yoursp.dssp.modules.verify.dto.SignatureInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationReportMapperTest {

    private static final String SECOND_SUBJECT = "CN=Alice Jansens (Signature), C=BE";

    private static X509Certificate eidCertificate;
    private static X509Certificate secondCertificate;

    private final VerificationReportMapper mapper = new VerificationReportMapper();

    @BeforeAll
    static void setUpCertificates() {
        KeyPair caKeys = TestCertificates.rsaKeyPair();
        X509Certificate ca = TestCertificates.selfSigned("CN=Citizen CA, C=BE", caKeys, true);
        eidCertificate = TestCertificates.issue(TestCertificates.principal(TestCertificates.EID_SUBJECT),
                TestCertificates.rsaKeyPair().getPublic(), ca.getSubjectX500Principal(), caKeys.getPrivate(), false);
        secondCertificate = TestCertificates.issue(TestCertificates.principal(SECOND_SUBJECT),
                TestCertificates.rsaKeyPair().getPublic(), ca.getSubjectX500Principal(), caKeys.getPrivate(), false);
    }

    @Test
    @DisplayName("Single signature → signing time, role, place and both subject notations")
    void singleSignature() throws Exception {
        SecurityInfo info = mapper.map(List.of(
                report("2014-09-23T20:11:34+02:00", List.of("Zaakvoerder"), "Denderleeuw",
                        TestCertificates.EID_SUBJECT, eidCertificate)), null);

        assertEquals(1, info.getSignatures().size());
        SignatureInfo signature = info.getSignatures().get(0);
        assertEquals(LocalDateTime.of(2014, 9, 23, 20, 11, 34), signature.getSigningTime().toLocalDateTime());
        assertEquals("Zaakvoerder", signature.getSignerRole());
        assertEquals("Denderleeuw", signature.getSignatureProductionPlace());
        assertNotNull(signature.getSigner());
        assertArrayEquals(eidCertificate.getEncoded(), signature.getSigner().getEncoded());
        assertEquals(TestCertificates.EID_SUBJECT, signature.getSignerSubject());
        assertEquals("SERIALNUMBER=79021802145, G=Bryan Eduard, SN=Brouckaert, CN=Bryan Brouckaert (Signature), C=BE",
                signature.getSignerCertificateSubject());
        assertEquals(Instant.MAX, info.getTimeStampValidity());
    }

    @Test
    @DisplayName("Double signature → two entries in report order, no field mixing")
    void doubleSignature() {
        SecurityInfo info = mapper.map(List.of(
                report("2014-09-23T20:11:34+02:00", List.of("Zaakvoerder"), "Denderleeuw",
                        TestCertificates.EID_SUBJECT, eidCertificate),
                report("2015-01-05T09:00:00+01:00", null, null, SECOND_SUBJECT, secondCertificate)),
                new TimeStampRenewal("2030-06-01T00:00:00Z"));

        assertEquals(2, info.getSignatures().size());
        SignatureInfo first = info.getSignatures().get(0);
        SignatureInfo second = info.getSignatures().get(1);

        assertEquals("Zaakvoerder", first.getSignerRole());
        assertEquals("Denderleeuw", first.getSignatureProductionPlace());
        assertEquals(LocalDateTime.of(2014, 9, 23, 20, 11, 34), first.getSigningTime().toLocalDateTime());

        assertNull(second.getSignerRole());
        assertNull(second.getSignatureProductionPlace());
        assertEquals(LocalDateTime.of(2015, 1, 5, 9, 0, 0), second.getSigningTime().toLocalDateTime());
        assertEquals(SECOND_SUBJECT, second.getSignerSubject());
        assertEquals(secondCertificate, second.getSigner());

        assertEquals(Instant.parse("2030-06-01T00:00:00Z"), info.getTimeStampValidity());
    }

    @Test
    @DisplayName("Several claimed roles → joined with comma and space")
    void rolesJoined() {
        SecurityInfo info = mapper.map(List.of(report("2014-09-23T20:11:34Z", List.of("Zaakvoerder", "CEO"), null,
                TestCertificates.EID_SUBJECT, eidCertificate)), null);

        assertEquals("Zaakvoerder, CEO", info.getSignatures().get(0).getSignerRole());
    }

    @Test
    @DisplayName("Individual report not successful → DsspResultException")
    void failedIndividualReport() {
        IndividualReport report = report("2014-09-23T20:11:34Z", null, null,
                TestCertificates.EID_SUBJECT, eidCertificate);
        report.setResult(new Result("urn:oasis:names:tc:dss:1.0:resultmajor:RequesterError",
                "urn:oasis:names:tc:dss:1.0:resultminor:invalid:IncorrectSignature",
                new InternationalString("en", "bad signature")));

        DsspResultException ex = assertThrows(DsspResultException.class, () -> mapper.map(List.of(report), null));
        assertEquals("urn:oasis:names:tc:dss:1.0:resultminor:invalid:IncorrectSignature", ex.getResultMinor());
        assertEquals("bad signature", ex.getResultMessage());
    }

    @Test
    @DisplayName("Report without signer certificate → DsspProtocolViolationException")
    void missingCertificate() {
        IndividualReport report = report("2014-09-23T20:11:34Z", null, null,
                TestCertificates.EID_SUBJECT, eidCertificate);
        report.setDetails(null);

        assertThrows(DsspProtocolViolationException.class, () -> mapper.map(List.of(report), null));
    }

    @Test
    @DisplayName("Report without signed object identifier → DsspProtocolViolationException")
    void missingSignedProperties() {
        IndividualReport report = report("2014-09-23T20:11:34Z", null, null,
                TestCertificates.EID_SUBJECT, eidCertificate);
        report.setSignedObjectIdentifier(null);

        assertThrows(DsspProtocolViolationException.class, () -> mapper.map(List.of(report), null));
    }

    @Test
    @DisplayName("Report without signing time → DsspProtocolViolationException")
    void missingSigningTime() {
        IndividualReport report = report(null, List.of("Zaakvoerder"), "Denderleeuw",
                TestCertificates.EID_SUBJECT, eidCertificate);

        DsspProtocolViolationException ex = assertThrows(DsspProtocolViolationException.class,
                () -> mapper.map(List.of(report), null));
        assertTrue(ex.getMessage().contains("signing time"));
    }

    static IndividualReport report(String signingTime, List<String> roles, String location,
            String subject, X509Certificate certificate) {
        try {
            SignedSignatureProperties properties = new SignedSignatureProperties(signingTime, location,
                    roles == null ? null : new SignerRole(roles));
            return IndividualReport.builder()
                    .signedObjectIdentifier(new SignedObjectIdentifier(new SignedProperties(properties)))
                    .result(new Result(DsspProtocol.RESULT_MAJOR_SUCCESS, null, null))
                    .details(new Details(new DetailedSignatureReport(new CertificatePathValidity(
                            new PathValidityDetail(List.of(
                                    new CertificateValidity(subject, certificate.getEncoded())))))))
                    .build();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
