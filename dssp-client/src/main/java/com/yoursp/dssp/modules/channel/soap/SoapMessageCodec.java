package com.yoursp.dssp.modules.channel.soap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.yoursp.dssp.exception.DsspTransportException;
import com.yoursp.dssp.exception.SoapFaultException;
import com.yoursp.dssp.model.protocol.DsspNamespaces;
import com.yoursp.dssp.model.protocol.SignResponse;
import com.yoursp.dssp.model.protocol.VerifyResponse;
import com.yoursp.dssp.modules.channel.ChannelBinding;
import org.springframework.stereotype.Component;

/**
 * Writes DSS-P requests into SOAP 1.1 envelopes and reads the responses
 * back.
 * <p>
 * The security header depends on the binding: a UsernameToken for
 * {@code USERNAME_PASSWORD}, the session's SecurityContextToken for
 * {@code SECURE_CONVERSATION}, nothing for the other modes (those
 * authenticate at the TLS layer or not at all).
 * </p>
 */
@Component
public class SoapMessageCodec {

    private static final String PASSWORD_TEXT =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordText";

    private final XmlMapper xmlMapper;

    public SoapMessageCodec() {
        this.xmlMapper = XmlMapper.builder()
                .defaultUseWrapper(false)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .build();
    }

    public String encode(Object request, ChannelBinding binding) {
        String body;
        try {
            body = xmlMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + request.getClass().getSimpleName(), e);
        }
        return buildEnvelope(securityHeader(binding), body);
    }

    public SignResponse decodeSignResponse(String xml) {
        SoapEnvelope.Body body = decodeBody(xml);
        if (body.getSignResponse() == null) {
            throw new DsspTransportException("SOAP body without SignResponse");
        }
        return body.getSignResponse();
    }

    public VerifyResponse decodeVerifyResponse(String xml) {
        SoapEnvelope.Body body = decodeBody(xml);
        if (body.getVerifyResponse() == null) {
            throw new DsspTransportException("SOAP body without Response");
        }
        return body.getVerifyResponse();
    }

    /**
     * @throws SoapFaultException when the body is a SOAP fault
     */
    SoapEnvelope.Body decodeBody(String xml) {
        SoapEnvelope envelope;
        try {
            envelope = xmlMapper.readValue(xml, SoapEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new DsspTransportException("Unreadable SOAP response", e);
        }
        if (envelope == null || envelope.getBody() == null) {
            throw new DsspTransportException("SOAP response without body");
        }
        SoapEnvelope.Fault fault = envelope.getBody().getFault();
        if (fault != null) {
            throw new SoapFaultException(fault.getFaultCode(), fault.getFaultString());
        }
        return envelope.getBody();
    }

    private static String securityHeader(ChannelBinding binding) {
        switch (binding.getMode()) {
            case USERNAME_PASSWORD:
                return """
                        <wsse:Security soapenv:mustUnderstand="1" xmlns:wsse="%s">
                          <wsse:UsernameToken>
                            <wsse:Username>%s</wsse:Username>
                            <wsse:Password Type="%s">%s</wsse:Password>
                          </wsse:UsernameToken>
                        </wsse:Security>
                        """
                        .formatted(DsspNamespaces.WSSE,
                                escape(binding.getCredentials().getUsername()),
                                PASSWORD_TEXT,
                                escape(binding.getCredentials().getPassword()));
            case SECURE_CONVERSATION:
                return """
                        <wsse:Security soapenv:mustUnderstand="1" xmlns:wsse="%s">
                          <wsc:SecurityContextToken xmlns:wsc="%s">
                            <wsc:Identifier>%s</wsc:Identifier>
                          </wsc:SecurityContextToken>
                        </wsse:Security>
                        """
                        .formatted(DsspNamespaces.WSSE, DsspNamespaces.WSC,
                                escape(binding.getSession().getKeyId()));
            default:
                return "";
        }
    }

    private static String buildEnvelope(String header, String body) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <soapenv:Envelope xmlns:soapenv="%s">
                  <soapenv:Header>
                %s  </soapenv:Header>
                  <soapenv:Body>
                    %s
                  </soapenv:Body>
                </soapenv:Envelope>
                """
                .formatted(SoapEnvelope.SOAP_NS, header, body);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
