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
public class RequestedReference {

    @JacksonXmlProperty(localName = "SecurityTokenReference", namespace = DsspNamespaces.WSSE)
    private SecurityTokenReference securityTokenReference;
}
