package com.yoursp.dssp.exception;

import lombok.Getter;

/**
 * SOAP fault returned instead of a DSS response.
 */
@Getter
public class SoapFaultException extends DsspTransportException {

    private final String faultCode;
    private final String faultString;

    public SoapFaultException(String faultCode, String faultString) {
        super("SOAP fault " + faultCode + ": " + faultString);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }
}
