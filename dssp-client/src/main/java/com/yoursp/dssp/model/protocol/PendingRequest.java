package com.yoursp.dssp.model.protocol;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Asynchronous-processing follow-up request, used to collect the result of a
 * pending sign request.
 */
@JacksonXmlRootElement(localName = "PendingRequest", namespace = DsspNamespaces.ASYNC)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingRequest {

    @JacksonXmlProperty(localName = "OptionalInputs", namespace = DsspNamespaces.DSS)
    private OptionalInputs optionalInputs;
}
