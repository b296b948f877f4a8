package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@JacksonXmlRootElement(localName = "SignResponse", namespace = DsspNamespaces.DSS)
@NoArgsConstructor
@SuperBuilder
public class SignResponse extends ResponseBase {
}
