package com.yoursp.dssp.modules.request;

/**
 * Profile, policy and result-code URIs of the DSS-P protocol.
 */
public final class DsspProtocol {

    // Profiles
    public static final String PROFILE_DSSP = "urn:be:e-contract:dssp:1.0";
    public static final String PROFILE_ESEAL = "urn:be:e-contract:dssp:eseal:1.0";
    public static final String PROFILE_LOCALSIG = "http://docs.oasis-open.org/dss-x/ns/localsig";
    public static final String PROFILE_ASYNC = "urn:oasis:names:tc:dss:1.0:profiles:asynchronousprocessing";

    public static final String POLICY_TWO_STEP = "http://docs.oasis-open.org/dss-x/ns/localsig/two-step-approach";

    // WS-Trust / WS-SecureConversation
    public static final String TOKEN_TYPE_SCT = "http://docs.oasis-open.org/ws-sx/ws-secureconversation/200512/sct";
    public static final String REQUEST_TYPE_ISSUE = "http://docs.oasis-open.org/ws-sx/ws-trust/200512/Issue";
    public static final String REQUEST_TYPE_CANCEL = "http://docs.oasis-open.org/ws-sx/ws-trust/200512/Cancel";
    public static final String BINARY_SECRET_NONCE = "http://docs.oasis-open.org/ws-sx/ws-trust/200512/Nonce";

    // Result codes
    public static final String RESULT_MAJOR_SUCCESS = "urn:oasis:names:tc:dss:1.0:resultmajor:Success";
    public static final String RESULT_MAJOR_PENDING =
            "urn:oasis:names:tc:dss:1.0:profiles:asynchronousprocessing:resultmajor:Pending";
    public static final String RESULT_MINOR_DOCUMENT_HASH = "urn:oasis:names:tc:dss:1.0:resultminor:documentHash";

    public static final String DOCUMENT_ID_PREFIX = "doc-";
    public static final int CLIENT_NONCE_LENGTH = 32;

    private DsspProtocol() {
    }
}
