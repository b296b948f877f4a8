package com.yoursp.dssp.model.protocol;

/**
 * XML namespaces of the DSS-P wire schema.
 */
public final class DsspNamespaces {

    public static final String DSS = "urn:oasis:names:tc:dss:1.0:core:schema";
    public static final String ASYNC = "urn:oasis:names:tc:dss:1.0:profiles:asynchronousprocessing:1.0";
    public static final String LOCALSIG = "http://docs.oasis-open.org/dss-x/ns/localsig";
    public static final String VR = "urn:oasis:names:tc:dss-x:1.0:profiles:verificationreport:schema#";
    public static final String DSSP = "urn:be:e-contract:dssp:1.0";
    public static final String XADES = "http://uri.etsi.org/01903/v1.3.2#";
    public static final String DS = "http://www.w3.org/2000/09/xmldsig#";
    public static final String WST = "http://docs.oasis-open.org/ws-sx/ws-trust/200512";
    public static final String WSC = "http://docs.oasis-open.org/ws-sx/ws-secureconversation/200512";
    public static final String WSSE = "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    public static final String WSU = "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";
    public static final String XML = "http://www.w3.org/XML/1998/namespace";

    private DsspNamespaces() {
    }
}
