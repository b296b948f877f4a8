package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Digest of the prepared document, to be signed locally in the two-step flow.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentHash {

    @JacksonXmlProperty(localName = "DigestMethod", namespace = DsspNamespaces.DS)
    private DigestMethod digestMethod;

    @JacksonXmlProperty(localName = "DigestValue", namespace = DsspNamespaces.DS)
    private byte[] digestValue;
}
