package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@JacksonXmlRootElement(localName = "VerifyRequest", namespace = DsspNamespaces.DSS)
@JsonPropertyOrder({ "Profile", "OptionalInputs", "InputDocuments" })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerifyRequest {

    @JacksonXmlProperty(localName = "Profile", isAttribute = true)
    private String profile;

    @JacksonXmlProperty(localName = "OptionalInputs", namespace = DsspNamespaces.DSS)
    private OptionalInputs optionalInputs;

    @JacksonXmlProperty(localName = "InputDocuments", namespace = DsspNamespaces.DSS)
    private InputDocuments inputDocuments;
}
