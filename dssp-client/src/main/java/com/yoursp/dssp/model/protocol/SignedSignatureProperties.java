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
public class SignedSignatureProperties {

    @JacksonXmlProperty(localName = "SigningTime", namespace = DsspNamespaces.XADES)
    private String signingTime;

    @JacksonXmlProperty(localName = "Location", namespace = DsspNamespaces.VR)
    private String location;

    @JacksonXmlProperty(localName = "SignerRole", namespace = DsspNamespaces.VR)
    private SignerRole signerRole;
}
