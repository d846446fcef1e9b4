package com.testops.publisher.support;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;

/** Canned {@link HttpResponse} for stubbing a mocked {@link HttpClient}. */
public record FakeHttpResponse(int statusCode, String body) implements HttpResponse<String> {

    public static FakeHttpResponse of(int statusCode, String body) {
        return new FakeHttpResponse(statusCode, body);
    }

    public static FakeHttpResponse status(int statusCode) {
        return new FakeHttpResponse(statusCode, "");
    }

    @Override public HttpRequest request()                               { return null; }
    @Override public Optional<HttpResponse<String>> previousResponse()   { return Optional.empty(); }
    @Override public HttpHeaders headers()                               { return HttpHeaders.of(Map.of(), (a, b) -> true); }
    @Override public Optional<SSLSession> sslSession()                   { return Optional.empty(); }
    @Override public URI uri()                                           { return URI.create("http://localhost/"); }
    @Override public HttpClient.Version version()                        { return HttpClient.Version.HTTP_1_1; }
}
