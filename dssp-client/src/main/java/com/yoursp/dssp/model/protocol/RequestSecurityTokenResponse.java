package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Issued security-context token, with the server entropy needed to derive the
 * shared session key.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestSecurityTokenResponse {

    @JacksonXmlProperty(localName = "TokenType", namespace = DsspNamespaces.WST)
    private String tokenType;

    @JacksonXmlProperty(localName = "RequestedSecurityToken", namespace = DsspNamespaces.WST)
    private RequestedSecurityToken requestedSecurityToken;

    @JacksonXmlProperty(localName = "RequestedUnattachedReference", namespace = DsspNamespaces.WST)
    private RequestedReference requestedUnattachedReference;

    @JacksonXmlProperty(localName = "Entropy", namespace = DsspNamespaces.WST)
    private Entropy entropy;

    @JacksonXmlProperty(localName = "KeySize", namespace = DsspNamespaces.WST)
    private Integer keySize;

    @JacksonXmlProperty(localName = "Lifetime", namespace = DsspNamespaces.WST)
    private Lifetime lifetime;
}
