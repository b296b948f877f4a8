package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Common shape of every DSS response: a result triple plus optional outputs.
 */
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class ResponseBase {

    @JacksonXmlProperty(localName = "Profile", isAttribute = true)
    private String profile;

    @JacksonXmlProperty(localName = "RequestID", isAttribute = true)
    private String requestId;

    @JacksonXmlProperty(localName = "Result", namespace = DsspNamespaces.DSS)
    private Result result;

    @JacksonXmlProperty(localName = "OptionalOutputs", namespace = DsspNamespaces.DSS)
    private OptionalOutputs optionalOutputs;
}
