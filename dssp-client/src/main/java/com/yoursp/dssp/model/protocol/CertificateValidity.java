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
public class CertificateValidity {

    @JacksonXmlProperty(localName = "Subject", namespace = DsspNamespaces.VR)
    private String subject;

    @JacksonXmlProperty(localName = "CertificateValue", namespace = DsspNamespaces.VR)
    private byte[] certificateValue;
}
