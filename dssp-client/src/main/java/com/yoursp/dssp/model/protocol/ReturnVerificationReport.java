package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@JsonPropertyOrder({ "IncludeVerifier", "IncludeCertificateValues" })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReturnVerificationReport {

    @JacksonXmlProperty(localName = "IncludeVerifier", namespace = DsspNamespaces.VR)
    private Boolean includeVerifier;

    @JacksonXmlProperty(localName = "IncludeCertificateValues", namespace = DsspNamespaces.VR)
    private Boolean includeCertificateValues;
}
