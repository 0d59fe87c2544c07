package com.wangbin.fritz.core.connection.tr064;

import com.wangbin.fritz.common.enums.ConnectionStatus;
import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.connection.RemoteConnection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TR-064连接：通过SOAP调用路由器服务
 */
@Slf4j
public class Tr064Connection implements RemoteConnection {

    private static final int HTTP_UNAUTHORIZED = 401;

    private final HttpClient httpClient;
    private final ExecutorService executorService;
    private final URI baseUri;
    private final DeviceDescription description;
    private final Duration readTimeout;
    private final DigestAuthenticator authenticator;

    private volatile ConnectionStatus status = ConnectionStatus.CONNECTED;

    // 统计计数器
    private final AtomicLong calls = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);

    Tr064Connection(HttpClient httpClient, ExecutorService executorService, URI baseUri,
                    DeviceDescription description, Duration readTimeout, DigestAuthenticator authenticator) {
        this.httpClient = httpClient;
        this.executorService = executorService;
        this.baseUri = baseUri;
        this.description = description;
        this.readTimeout = readTimeout;
        this.authenticator = authenticator;
    }

    @Override
    public Map<String, Object> call(String service, String action) throws CollectorException {
        if (!status.isConnected()) {
            throw CollectorException.stateException("连接未建立或已断开: " + baseUri);
        }
        Tr064Service target = description.findService(service)
                .orElseThrow(() -> CollectorException.unsupportedException(service, action));

        calls.incrementAndGet();
        try {
            URI uri = baseUri.resolve(target.controlUrl());
            String body = SoapEnvelope.buildRequest(target.serviceType(), action);
            String soapAction = SoapEnvelope.soapActionHeader(target.serviceType(), action);

            HttpResponse<String> response = send(uri, soapAction, body, service, action);
            if (response.statusCode() == HTTP_UNAUTHORIZED && authenticator != null
                    && authenticator.updateChallenge(response.headers().firstValue("WWW-Authenticate").orElse(null))) {
                log.debug("收到摘要质询，携带认证头重试: {}#{}", service, action);
                response = send(uri, soapAction, body, service, action);
            }

            if (response.statusCode() == HTTP_UNAUTHORIZED) {
                throw CollectorException.authException(service, action);
            }
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                status = authenticator != null && authenticator.hasChallenge()
                        ? ConnectionStatus.AUTHENTICATED : ConnectionStatus.CONNECTED;
                return SoapEnvelope.parseResponse(response.body(), service, action);
            }
            if (response.body() != null && response.body().contains("Fault")) {
                // 非2xx但带SOAP Fault，由解析器转换为具体异常
                SoapEnvelope.parseResponse(response.body(), service, action);
            }
            throw CollectorException.callException("HTTP状态码 " + response.statusCode(), service, action, null);
        } catch (CollectorException e) {
            errors.incrementAndGet();
            throw e;
        }
    }

    private HttpResponse<String> send(URI uri, String soapAction, String body, String service, String action)
            throws CollectorException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(readTimeout)
                .header("Content-Type", "text/xml; charset=\"utf-8\"")
                .header("SOAPAction", soapAction)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));

        if (authenticator != null && authenticator.hasChallenge()) {
            builder.header("Authorization", authenticator.authorize("POST", uri.getRawPath()));
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw CollectorException.callException("请求失败: " + e.getMessage(), service, action, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CollectorException.callException("请求被中断", service, action, e);
        }
    }

    @Override
    public String getModelName() {
        return description.getModelName();
    }

    public DeviceDescription getDescription() {
        return description;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    @Override
    public void close() {
        if (status == ConnectionStatus.DISCONNECTED) {
            return;
        }
        status = ConnectionStatus.DISCONNECTED;
        shutdownExecutor(executorService);
        log.info("TR-064连接已关闭: {}, 调用 {} 次, 失败 {} 次", baseUri, calls.get(), errors.get());
    }

    static void shutdownExecutor(ExecutorService executorService) {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
