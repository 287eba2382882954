/*
 * Copyright Longhorn authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.longhorn.operator.instancemanager.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Talks to the management daemon over HTTP. The list endpoint returns a JSON object keyed by the process name, the
 * watch endpoint streams one JSON record per line.
 */
public class HttpProcessManagerClient implements ProcessManagerClient {
    private static final Logger LOGGER = LogManager.getLogger(HttpProcessManagerClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    // Bounds the wait for the response headers only. The body of the watch stays open.
    private static final Duration WATCH_RESPONSE_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI baseUri;
    private final ManagerRole role;
    private final Duration watchResponseTimeout;

    /**
     * Constructs the client
     *
     * @param httpClient    Shared HTTP client
     * @param mapper        Object mapper for decoding the records
     * @param baseUri       Base URI of the daemon, for example {@code http://10.0.0.5:8500}
     * @param role          Role of the instance manager
     */
    public HttpProcessManagerClient(HttpClient httpClient, ObjectMapper mapper, URI baseUri, ManagerRole role) {
        this(httpClient, mapper, baseUri, role, WATCH_RESPONSE_TIMEOUT);
    }

    /*test*/ HttpProcessManagerClient(HttpClient httpClient, ObjectMapper mapper, URI baseUri, ManagerRole role, Duration watchResponseTimeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUri = baseUri;
        this.role = role;
        this.watchResponseTimeout = watchResponseTimeout;
    }

    /**
     * Creates a factory of HTTP clients which share one HTTP client and one object mapper.
     *
     * @param port  Management port of the daemons
     *
     * @return  Client factory
     */
    public static ProcessManagerClientFactory factory(int port) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        ObjectMapper mapper = new ObjectMapper();

        return (ip, role) -> new HttpProcessManagerClient(httpClient, mapper, URI.create("http://" + ip + ":" + port), role);
    }

    @Override
    public Map<String, ProcessObservation> list() throws ProcessManagerException {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(role.listPath()))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProcessManagerException("Failed to list processes of " + role + " at " + baseUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessManagerException("Interrupted while listing processes of " + role + " at " + baseUri, e);
        }

        if (response.statusCode() != 200) {
            throw new ProcessManagerException("Listing processes of " + role + " at " + baseUri + " failed with status " + response.statusCode());
        }

        try {
            JsonNode body = mapper.readTree(response.body());
            if (body == null || !body.isObject()) {
                throw new ProcessManagerException("Unexpected process list from " + role + " at " + baseUri);
            }

            Map<String, ProcessObservation> processes = new HashMap<>(body.size());
            Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                processes.put(field.getKey(), role.decode(mapper, field.getValue()));
            }

            return processes;
        } catch (JsonProcessingException e) {
            throw new ProcessManagerException("Failed to decode the process list of " + role + " at " + baseUri, e);
        }
    }

    @Override
    public ProcessStream watch() throws ProcessManagerException {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(role.watchPath()))
                .timeout(watchResponseTimeout)
                .GET()
                .build();

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new ProcessManagerException("Failed to open the process watch of " + role + " at " + baseUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessManagerException("Interrupted while opening the process watch of " + role + " at " + baseUri, e);
        }

        if (response.statusCode() != 200) {
            closeQuietly(response.body());
            throw new ProcessManagerException("Opening the process watch of " + role + " at " + baseUri + " failed with status " + response.statusCode());
        }

        return new HttpProcessStream(response.body());
    }

    private static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOGGER.debug("Failed to close the response stream", e);
        }
    }

    /**
     * Stream reading newline delimited JSON records
     */
    private class HttpProcessStream implements ProcessStream {
        private final InputStream body;
        private final BufferedReader reader;

        HttpProcessStream(InputStream body) {
            this.body = body;
            this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        }

        @Override
        public ProcessObservation receive() throws ProcessManagerException {
            try {
                String line;
                do {
                    line = reader.readLine();
                    if (line == null) {
                        throw new ProcessManagerException("Process watch of " + role + " at " + baseUri + " was closed");
                    }
                } while (line.isBlank());

                return role.decode(mapper, mapper.readTree(line));
            } catch (JsonProcessingException e) {
                throw new ProcessManagerException("Failed to decode a process event of " + role + " at " + baseUri, e);
            } catch (IOException e) {
                throw new ProcessManagerException("Failed to receive a process event of " + role + " at " + baseUri, e);
            }
        }

        @Override
        public void close() {
            closeQuietly(body);
        }
    }
}
