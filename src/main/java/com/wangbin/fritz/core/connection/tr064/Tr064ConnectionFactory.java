package com.wangbin.fritz.core.connection.tr064;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.fritz.common.exception.CollectorException;
import com.wangbin.fritz.core.connection.ConnectionFactory;
import com.wangbin.fritz.core.connection.RemoteConnection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * TR-064连接工厂：加载设备描述并创建连接
 */
@Slf4j
public class Tr064ConnectionFactory implements ConnectionFactory {

    public static final List<String> DEFAULT_DESCRIPTIONS = List.of("tr64desc.xml", "igddesc.xml");

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final List<String> descriptionFiles;

    public Tr064ConnectionFactory(Duration connectTimeout, Duration readTimeout) {
        this(connectTimeout, readTimeout, DEFAULT_DESCRIPTIONS);
    }

    public Tr064ConnectionFactory(Duration connectTimeout, Duration readTimeout, List<String> descriptionFiles) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        this.descriptionFiles = List.copyOf(descriptionFiles);
    }

    @Override
    public RemoteConnection connect(String address, int port, String user, String password)
            throws CollectorException {
        URI baseUri = buildBaseUri(address, port);
        ExecutorService executorService = newExecutorService();
        try {
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .executor(executorService)
                    .build();
            DeviceDescription description = loadDescriptions(httpClient, baseUri);
            DigestAuthenticator authenticator = hasCredentials(user, password)
                    ? new DigestAuthenticator(user, password) : null;
            log.info("TR-064连接建立: {}, 型号: {}, 服务数: {}",
                    baseUri, description.getModelName(), description.getServices().size());
            return new Tr064Connection(httpClient, executorService, baseUri, description, readTimeout, authenticator);
        } catch (CollectorException e) {
            Tr064Connection.shutdownExecutor(executorService);
            throw e;
        } catch (RuntimeException e) {
            Tr064Connection.shutdownExecutor(executorService);
            throw CollectorException.connectionException("TR-064连接建立失败: " + e.getMessage(), e);
        }
    }

    ExecutorService newExecutorService() {
        return Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("tr064-http-%d")
                .setDaemon(true)
                .build());
    }

    private DeviceDescription loadDescriptions(HttpClient httpClient, URI baseUri) throws CollectorException {
        DeviceDescription merged = null;
        Exception lastError = null;

        for (String file : descriptionFiles) {
            URI uri = baseUri.resolve("/" + file);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(readTimeout)
                    .GET()
                    .build();
            try {
                HttpResponse<String> response =
                        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    log.debug("设备描述不可用: {} (状态码: {})", uri, response.statusCode());
                    continue;
                }
                DeviceDescription description = DeviceDescriptionParser.parse(response.body());
                merged = merged == null ? description : merged.merge(description);
            } catch (IOException | CollectorException e) {
                lastError = e;
                log.warn("加载设备描述失败: {} - {}", uri, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CollectorException.connectionException("加载设备描述被中断", e);
            }
        }

        if (merged == null) {
            throw CollectorException.connectionException("无法从 " + baseUri + " 获取设备描述", lastError);
        }
        return merged;
    }

    private static URI buildBaseUri(String address, int port) {
        String host = address.contains(":") && !address.startsWith("[") ? "[" + address + "]" : address;
        return URI.create("http://" + host + ":" + port);
    }

    private static boolean hasCredentials(String user, String password) {
        return (user != null && !user.isEmpty()) || (password != null && !password.isEmpty());
    }
}
