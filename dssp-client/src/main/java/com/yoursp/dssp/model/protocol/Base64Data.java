package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
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
public class Base64Data {

    @JacksonXmlProperty(localName = "MimeType", isAttribute = true)
    private String mimeType;

    @JacksonXmlText
    private byte[] value;
}
