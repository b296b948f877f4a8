package com.yoursp.dssp.exception;

import com.yoursp.dssp.modules.session.ResultMinorMapper;
import lombok.Getter;

/**
 * Thrown when the service answers with a result code the flow does not
 * expect. Major, minor and message are kept exactly as returned.
 */
@Getter
public class DsspResultException extends RuntimeException {

    private final String resultMajor;
    private final String resultMinor;
    private final String resultMessage;

    public DsspResultException(String resultMajor, String resultMinor, String resultMessage) {
        super(buildMessage(resultMajor, resultMinor, resultMessage));
        this.resultMajor = resultMajor;
        this.resultMinor = resultMinor;
        this.resultMessage = resultMessage;
    }

    /**
     * Human-readable description of the minor code.
     */
    public String getDescription() {
        return ResultMinorMapper.toMessage(resultMinor);
    }

    private static String buildMessage(String major, String minor, String message) {
        StringBuilder sb = new StringBuilder("DSS-P request failed: ").append(major);
        if (minor != null) {
            sb.append(" / ").append(minor);
        }
        if (message != null) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
