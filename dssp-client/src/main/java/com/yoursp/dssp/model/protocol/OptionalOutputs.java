package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Union of the optional outputs returned by the DSS-P flows.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptionalOutputs {

    @JacksonXmlProperty(localName = "ResponseID", namespace = DsspNamespaces.ASYNC)
    private String responseId;

    @JacksonXmlProperty(localName = "RequestSecurityTokenResponseCollection", namespace = DsspNamespaces.WST)
    private RequestSecurityTokenResponseCollection requestSecurityTokenResponseCollection;

    @JacksonXmlProperty(localName = "DocumentWithSignature", namespace = DsspNamespaces.DSS)
    private DocumentWithSignature documentWithSignature;

    @JacksonXmlProperty(localName = "CorrelationID", namespace = DsspNamespaces.LOCALSIG)
    private String correlationId;

    @JacksonXmlProperty(localName = "DocumentHash", namespace = DsspNamespaces.LOCALSIG)
    private DocumentHash documentHash;

    @JacksonXmlProperty(localName = "VerificationReport", namespace = DsspNamespaces.VR)
    private VerificationReport verificationReport;

    @JacksonXmlProperty(localName = "TimeStampRenewal", namespace = DsspNamespaces.DSSP)
    private TimeStampRenewal timeStampRenewal;
}
