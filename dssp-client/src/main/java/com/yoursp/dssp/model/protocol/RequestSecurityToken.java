package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * WS-Trust token request. Used to open a secure conversation (Issue) on the
 * asynchronous upload and to close it (Cancel) on download.
 */
@JsonPropertyOrder({ "TokenType", "RequestType", "Entropy", "CancelTarget" })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestSecurityToken {

    @JacksonXmlProperty(localName = "TokenType", namespace = DsspNamespaces.WST)
    private String tokenType;

    @JacksonXmlProperty(localName = "RequestType", namespace = DsspNamespaces.WST)
    private String requestType;

    @JacksonXmlProperty(localName = "Entropy", namespace = DsspNamespaces.WST)
    private Entropy entropy;

    @JacksonXmlProperty(localName = "CancelTarget", namespace = DsspNamespaces.WST)
    private CancelTarget cancelTarget;
}
