package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Union of the optional inputs used by the DSS-P flows. Unset fields are not
 * serialized.
 */
@JsonPropertyOrder({ "AdditionalProfile", "ServicePolicy", "ResponseID", "RequestSecurityToken",
        "SignatureType", "KeySelector", "SignaturePlacement", "RequestDocumentHash", "CorrelationID",
        "SignatureObject", "ReturnVerificationReport" })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptionalInputs {

    @JacksonXmlProperty(localName = "AdditionalProfile", namespace = DsspNamespaces.DSS)
    private String additionalProfile;

    @JacksonXmlProperty(localName = "ServicePolicy", namespace = DsspNamespaces.DSS)
    private String servicePolicy;

    @JacksonXmlProperty(localName = "ResponseID", namespace = DsspNamespaces.ASYNC)
    private String responseId;

    @JacksonXmlProperty(localName = "RequestSecurityToken", namespace = DsspNamespaces.WST)
    private RequestSecurityToken requestSecurityToken;

    @JacksonXmlProperty(localName = "SignatureType", namespace = DsspNamespaces.DSS)
    private String signatureType;

    @JacksonXmlProperty(localName = "KeySelector", namespace = DsspNamespaces.DSS)
    private KeySelector keySelector;

    @JacksonXmlProperty(localName = "SignaturePlacement", namespace = DsspNamespaces.DSS)
    private SignaturePlacement signaturePlacement;

    @JacksonXmlProperty(localName = "RequestDocumentHash", namespace = DsspNamespaces.LOCALSIG)
    private RequestDocumentHash requestDocumentHash;

    @JacksonXmlProperty(localName = "CorrelationID", namespace = DsspNamespaces.LOCALSIG)
    private String correlationId;

    @JacksonXmlProperty(localName = "SignatureObject", namespace = DsspNamespaces.DSS)
    private SignatureObject signatureObject;

    @JacksonXmlProperty(localName = "ReturnVerificationReport", namespace = DsspNamespaces.VR)
    private ReturnVerificationReport returnVerificationReport;
}
