package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * DER encoded certificates, end certificate first.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class X509Data {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "X509Certificate", namespace = DsspNamespaces.DS)
    private List<byte[]> certificates;
}
