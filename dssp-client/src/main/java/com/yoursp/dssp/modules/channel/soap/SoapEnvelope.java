package com.yoursp.dssp.modules.channel.soap;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.yoursp.dssp.model.protocol.SignResponse;
import com.yoursp.dssp.model.protocol.VerifyResponse;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Read side of a SOAP 1.1 envelope. The header is ignored.
 */
@Getter
@Setter
@NoArgsConstructor
@JacksonXmlRootElement(localName = "Envelope", namespace = SoapEnvelope.SOAP_NS)
public class SoapEnvelope {

    public static final String SOAP_NS = "http://schemas.xmlsoap.org/soap/envelope/";

    @JacksonXmlProperty(localName = "Body", namespace = SOAP_NS)
    private Body body;

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Body {

        @JacksonXmlProperty(localName = "SignResponse")
        private SignResponse signResponse;

        @JacksonXmlProperty(localName = "Response")
        private VerifyResponse verifyResponse;

        @JacksonXmlProperty(localName = "Fault", namespace = SOAP_NS)
        private Fault fault;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Fault {

        @JacksonXmlProperty(localName = "faultcode")
        private String faultCode;

        @JacksonXmlProperty(localName = "faultstring")
        private String faultString;
    }
}
