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
public class Lifetime {

    @JacksonXmlProperty(localName = "Created", namespace = DsspNamespaces.WSU)
    private String created;

    @JacksonXmlProperty(localName = "Expires", namespace = DsspNamespaces.WSU)
    private String expires;
}
