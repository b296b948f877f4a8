package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@JsonPropertyOrder({ "ResultMajor", "ResultMinor", "ResultMessage" })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Result {

    @JacksonXmlProperty(localName = "ResultMajor", namespace = DsspNamespaces.DSS)
    private String resultMajor;

    @JacksonXmlProperty(localName = "ResultMinor", namespace = DsspNamespaces.DSS)
    private String resultMinor;

    @JacksonXmlProperty(localName = "ResultMessage", namespace = DsspNamespaces.DSS)
    private InternationalString resultMessage;
}
