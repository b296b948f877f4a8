package com.yoursp.dssp.modules.verify;

import com.yoursp.dssp.exception.DsspProtocolViolationException;
import com.yoursp.dssp.exception.DsspResultException;
import com.yoursp.dssp.model.protocol.CertificateValidity;
import com.yoursp.dssp.model.protocol.IndividualReport;
import com.yoursp.dssp.model.protocol.Result;
import com.yoursp.dssp.model.protocol.SignedSignatureProperties;
import com.yoursp.dssp.model.protocol.SignerRole;
import com.yoursp.dssp.model.protocol.TimeStampRenewal;
import com.yoursp.dssp.model.protocol.XmlDateTimes;
import com.yoursp.dssp.modules.request.DsspProtocol;
import com.yoursp.dssp.modules.verify.dto.SecurityInfo;
import com.yoursp.dssp.modules.verify.dto.SignatureInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.security.auth.x500.X500Principal;
import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the individual reports of a verification report into
 * {@link SecurityInfo}.
 */
@Slf4j
@Component
public class VerificationReportMapper {

    /** Short aliases for the attributes RFC 1779 has no keyword for. */
    private static final Map<String, String> SHORT_ALIASES = Map.of(
            "2.5.4.5", "SERIALNUMBER",
            "2.5.4.42", "G",
            "2.5.4.4", "SN",
            "2.5.4.12", "T",
            "2.5.4.8", "S",
            "1.2.840.113549.1.9.1", "E");

    /**
     * Maps the reports in order.
     *
     * @param reports          individual reports, one per signature
     * @param timeStampRenewal renewal deadline, may be {@code null}
     * @throws DsspResultException             when a report is not a success
     * @throws DsspProtocolViolationException when a report misses its signing time or signer certificate
     */
    public SecurityInfo map(List<IndividualReport> reports, TimeStampRenewal timeStampRenewal) {
        List<SignatureInfo> signatures = new ArrayList<>(reports.size());
        for (IndividualReport report : reports) {
            signatures.add(mapReport(report));
        }

        Instant validity = Optional.ofNullable(timeStampRenewal)
                .map(TimeStampRenewal::getBefore)
                .map(before -> parseDateTime(before, "TimeStampRenewal/@Before").toInstant())
                .orElse(Instant.MAX);

        log.debug("Verification report mapped: signatures={}, timeStampValidity={}", signatures.size(), validity);
        return new SecurityInfo(validity, signatures);
    }

    SignatureInfo mapReport(IndividualReport report) {
        Result result = report.getResult();
        if (result == null || !DsspProtocol.RESULT_MAJOR_SUCCESS.equals(result.getResultMajor())) {
            throw result == null
                    ? new DsspProtocolViolationException("Individual report without result")
                    : new DsspResultException(result.getResultMajor(), result.getResultMinor(),
                            result.getResultMessage() == null ? null : result.getResultMessage().getValue());
        }

        SignedSignatureProperties properties = signedSignatureProperties(report);
        CertificateValidity signerValidity = signerValidity(report);
        X509Certificate certificate = decodeCertificate(signerValidity.getCertificateValue());

        return SignatureInfo.builder()
                .signingTime(parseDateTime(properties.getSigningTime(), "SigningTime"))
                .signer(certificate)
                .signerSubject(signerValidity.getSubject())
                .signerCertificateSubject(shortSubject(certificate.getSubjectX500Principal()))
                .signerRole(joinRoles(properties.getSignerRole()))
                .signatureProductionPlace(properties.getLocation())
                .build();
    }

    /**
     * Renders a subject with short attribute aliases, most significant RDN last.
     */
    public static String shortSubject(X500Principal subject) {
        return subject.getName(X500Principal.RFC1779, SHORT_ALIASES);
    }

    private static SignedSignatureProperties signedSignatureProperties(IndividualReport report) {
        if (report.getSignedObjectIdentifier() == null
                || report.getSignedObjectIdentifier().getSignedProperties() == null
                || report.getSignedObjectIdentifier().getSignedProperties().getSignedSignatureProperties() == null) {
            throw new DsspProtocolViolationException("Individual report without signed signature properties");
        }
        SignedSignatureProperties properties = report.getSignedObjectIdentifier().getSignedProperties()
                .getSignedSignatureProperties();
        if (properties.getSigningTime() == null) {
            throw new DsspProtocolViolationException("Individual report without signing time");
        }
        return properties;
    }

    private static CertificateValidity signerValidity(IndividualReport report) {
        List<CertificateValidity> validities = report.getDetails() == null
                || report.getDetails().getDetailedSignatureReport() == null
                || report.getDetails().getDetailedSignatureReport().getCertificatePathValidity() == null
                || report.getDetails().getDetailedSignatureReport().getCertificatePathValidity()
                        .getPathValidityDetail() == null
                ? null
                : report.getDetails().getDetailedSignatureReport().getCertificatePathValidity()
                        .getPathValidityDetail().getCertificateValidities();
        if (validities == null || validities.isEmpty() || validities.get(0).getCertificateValue() == null) {
            throw new DsspProtocolViolationException("Individual report without signer certificate");
        }
        return validities.get(0);
    }

    private static X509Certificate decodeCertificate(byte[] der) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
        } catch (CertificateException e) {
            throw new DsspProtocolViolationException("Signer certificate in verification report is not valid DER", e);
        }
    }

    private static String joinRoles(SignerRole role) {
        if (role == null || role.getClaimedRoles() == null) {
            return null;
        }
        return String.join(", ", role.getClaimedRoles());
    }

    private static OffsetDateTime parseDateTime(String value, String field) {
        try {
            return XmlDateTimes.parse(value);
        } catch (DateTimeParseException e) {
            throw new DsspProtocolViolationException("Invalid " + field + ": " + value, e);
        }
    }
}
