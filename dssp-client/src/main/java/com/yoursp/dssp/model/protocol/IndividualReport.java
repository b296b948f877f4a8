package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndividualReport {

    @JacksonXmlProperty(localName = "SignedObjectIdentifier", namespace = DsspNamespaces.VR)
    private SignedObjectIdentifier signedObjectIdentifier;

    @JacksonXmlProperty(localName = "Result", namespace = DsspNamespaces.DSS)
    private Result result;

    @JacksonXmlProperty(localName = "Details", namespace = DsspNamespaces.VR)
    private Details details;
}
