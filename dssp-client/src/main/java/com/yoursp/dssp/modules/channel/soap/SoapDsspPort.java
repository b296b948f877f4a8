package com.yoursp.dssp.modules.channel.soap;

import com.yoursp.dssp.exception.DsspTransportException;
import com.yoursp.dssp.model.protocol.PendingRequest;
import com.yoursp.dssp.model.protocol.ResponseBase;
import com.yoursp.dssp.model.protocol.SignRequest;
import com.yoursp.dssp.model.protocol.SignResponse;
import com.yoursp.dssp.model.protocol.VerifyRequest;
import com.yoursp.dssp.model.protocol.VerifyResponse;
import com.yoursp.dssp.modules.channel.ChannelBinding;
import com.yoursp.dssp.modules.channel.DsspPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * {@link DsspPort} over SOAP 1.1 and HTTP.
 * <p>
 * One round trip per call, no retry. A SOAP fault surfaces as
 * {@link com.yoursp.dssp.exception.SoapFaultException}, every other HTTP or
 * I/O failure as {@link DsspTransportException}.
 * </p>
 */
@Slf4j
public class SoapDsspPort implements DsspPort {

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final SoapMessageCodec codec;
    private final ChannelBinding binding;

    public SoapDsspPort(HttpClient httpClient, URI endpoint, Duration requestTimeout,
            SoapMessageCodec codec, ChannelBinding binding) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
        this.codec = codec;
        this.binding = binding;
    }

    @Override
    public SignResponse sign(SignRequest request) {
        return exchange("sign", request, codec::decodeSignResponse);
    }

    @Override
    public CompletableFuture<SignResponse> signAsync(SignRequest request) {
        return exchangeAsync("sign", request, codec::decodeSignResponse);
    }

    @Override
    public SignResponse pendingRequest(PendingRequest request) {
        return exchange("pendingRequest", request, codec::decodeSignResponse);
    }

    @Override
    public CompletableFuture<SignResponse> pendingRequestAsync(PendingRequest request) {
        return exchangeAsync("pendingRequest", request, codec::decodeSignResponse);
    }

    @Override
    public VerifyResponse verify(VerifyRequest request) {
        return exchange("verify", request, codec::decodeVerifyResponse);
    }

    @Override
    public CompletableFuture<VerifyResponse> verifyAsync(VerifyRequest request) {
        return exchangeAsync("verify", request, codec::decodeVerifyResponse);
    }

    private <T extends ResponseBase> T exchange(String operation, Object body, Function<String, T> decoder) {
        HttpRequest request = buildRequest(operation, body);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return handleResponse(operation, response, decoder);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DsspTransportException("DSS-P " + operation + " call interrupted", e);
        } catch (IOException e) {
            log.error("DSS-P SOAP call failed: operation={}, error={}", operation, e.getMessage());
            throw new DsspTransportException("DSS-P " + operation + " call failed", e);
        }
    }

    private <T extends ResponseBase> CompletableFuture<T> exchangeAsync(String operation, Object body,
            Function<String, T> decoder) {
        HttpRequest request = buildRequest(operation, body);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.error("DSS-P SOAP call failed: operation={}, error={}", operation, cause.getMessage());
                        throw new DsspTransportException("DSS-P " + operation + " call failed", cause);
                    }
                    return handleResponse(operation, response, decoder);
                });
    }

    private HttpRequest buildRequest(String operation, Object body) {
        String envelope = codec.encode(body, binding);
        log.info("DSS-P SOAP request: endpoint={}, operation={}, mode={}", endpoint, operation, binding.getMode());

        return HttpRequest.newBuilder()
                .uri(endpoint)
                .header("Content-Type", "text/xml; charset=utf-8")
                .header("SOAPAction", "\"\"")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(envelope))
                .build();
    }

    private <T extends ResponseBase> T handleResponse(String operation, HttpResponse<String> response,
            Function<String, T> decoder) {
        int status = response.statusCode();
        if (status != 200 && status != 500) {
            log.error("DSS-P SOAP error: operation={}, httpStatus={}", operation, status);
            throw new DsspTransportException("DSS-P " + operation + " call failed with HTTP " + status);
        }

        // a 500 carries a SOAP fault, which the decoder raises
        T decoded = decoder.apply(response.body());
        if (status != 200) {
            throw new DsspTransportException("DSS-P " + operation + " call failed with HTTP " + status);
        }

        // Log only the result codes, never document content
        log.info("DSS-P SOAP response: operation={}, requestId={}, resultMajor={}", operation,
                decoded.getRequestId(), decoded.getResult() == null ? null : decoded.getResult().getResultMajor());
        return decoded;
    }
}
