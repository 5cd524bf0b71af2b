package io.github.metahealth.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.metahealth.config.AggregationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RegistryClient} backed by the DataCite REST API.
 *
 * <p>Listings are fetched page by page until {@code meta.totalPages} is reached. When a cache
 * directory is configured, a listing is read from {@code {endpoint}.json} if that file exists
 * and is written there after every successful fetch.</p>
 */
public class DataCiteRegistryClient implements RegistryClient {

    private static final Logger LOG = LoggerFactory.getLogger(DataCiteRegistryClient.class);

    static final String PROVIDERS = "providers";
    static final String CLIENTS = "clients";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final int pageSize;
    private final Path cacheDir;
    private final Duration readTimeout;
    private final int maxRetries;
    private final long retryDelayMs;
    private final HttpClient httpClient;

    public DataCiteRegistryClient(AggregationConfig config) {
        this.baseUrl = stripTrailingSlash(config.getRegistryBaseUrl());
        this.pageSize = config.getRegistryPageSize();
        this.cacheDir = config.getCacheDir();
        this.readTimeout = Duration.ofMillis(config.getRegistryReadTimeoutMs());
        this.maxRetries = Math.max(1, config.getRegistryMaxRetries());
        this.retryDelayMs = config.getRegistryRetryDelayMs();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getRegistryConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<RegistryEntity> listProviders() {
        List<RegistryEntity> providers = new ArrayList<>();
        for (JsonNode item : fetchAll(PROVIDERS)) {
            providers.add(toEntity(item, false));
        }
        LOG.info("Loaded {} providers", providers.size());
        return providers;
    }

    @Override
    public List<RegistryEntity> listClients() {
        List<RegistryEntity> clients = new ArrayList<>();
        for (JsonNode item : fetchAll(CLIENTS)) {
            clients.add(toEntity(item, true));
        }
        LOG.info("Loaded {} clients", clients.size());
        return clients;
    }

    /**
     * Returns every {@code data} item of an endpoint, from the cache when possible.
     */
    List<JsonNode> fetchAll(String endpoint) {
        List<JsonNode> cached = readCache(endpoint);
        if (cached != null) {
            return cached;
        }

        List<JsonNode> items = new ArrayList<>();
        int page = 1;
        int totalPages = 1;
        while (page <= totalPages) {
            JsonNode body = fetchPage(pageUrl(endpoint, page));
            JsonNode data = body.path("data");
            if (data.isArray()) {
                data.forEach(items::add);
            }
            totalPages = body.path("meta").path("totalPages").asInt(page);
            LOG.debug("Fetched {} page {}/{}", endpoint, page, totalPages);
            page++;
        }

        writeCache(endpoint, items);
        return items;
    }

    /**
     * URL of one listing page. The brackets of {@code page[size]} and {@code page[number]} are
     * percent-encoded since {@link URI} rejects them in a query.
     */
    String pageUrl(String endpoint, int page) {
        return baseUrl + "/" + endpoint + "?page%5Bsize%5D=" + pageSize + "&page%5Bnumber%5D=" + page
                + "&include=prefixes";
    }

    /**
     * Fetches and parses one page, retrying transport failures with a linearly growing delay.
     */
    protected JsonNode fetchPage(String url) {
        IOException lastException = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            if (attempt > 0) {
                long sleepTime = retryDelayMs * attempt;
                try {
                    Thread.sleep(sleepTime);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RegistryException(url, "Interrupted while waiting for retry", e);
                }
            }
            try {
                return send(url);
            } catch (IOException e) {
                lastException = e;
                LOG.warn("Request to {} failed on attempt {}: {}", url, attempt + 1, e.getMessage());
            }
        }
        throw new RegistryException(url, "Request failed after " + maxRetries + " attempts", lastException);
    }

    private JsonNode send(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(readTimeout)
                .header("Accept", "application/vnd.api+json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(url, "Interrupted during request", e);
        }

        if (response.statusCode() != 200) {
            throw new RegistryException(url, response.statusCode());
        }
        return OBJECT_MAPPER.readTree(response.body());
    }

    private List<JsonNode> readCache(String endpoint) {
        if (cacheDir == null) {
            return null;
        }
        Path cacheFile = cacheFile(endpoint);
        if (!Files.isRegularFile(cacheFile)) {
            return null;
        }
        try {
            JsonNode cached = OBJECT_MAPPER.readTree(cacheFile.toFile());
            if (!cached.isArray()) {
                LOG.warn("Ignoring cache {}: expected a JSON array", cacheFile);
                return null;
            }
            List<JsonNode> items = new ArrayList<>(cached.size());
            cached.forEach(items::add);
            LOG.info("Using cached {} from {}", endpoint, cacheFile);
            return items;
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable cache {}: {}", cacheFile, e.getMessage());
            return null;
        }
    }

    private void writeCache(String endpoint, List<JsonNode> items) {
        if (cacheDir == null) {
            return;
        }
        Path cacheFile = cacheFile(endpoint);
        ArrayNode array = OBJECT_MAPPER.createArrayNode();
        items.forEach(array::add);
        try {
            Files.createDirectories(cacheDir);
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(cacheFile.toFile(), array);
            LOG.debug("Cached {} {} to {}", items.size(), endpoint, cacheFile);
        } catch (IOException e) {
            // a failed cache write does not invalidate the fetched listing
            LOG.warn("Could not write cache {}: {}", cacheFile, e.getMessage());
        }
    }

    Path cacheFile(String endpoint) {
        return cacheDir.resolve(endpoint + ".json");
    }

    static RegistryEntity toEntity(JsonNode item, boolean client) {
        String id = item.path("id").asText(null);
        if (id == null || id.isEmpty()) {
            throw new RegistryException("Registry item without id: " + item, null);
        }
        JsonNode attributes = item.path("attributes");
        ObjectNode attributeObject = attributes.isObject()
                ? (ObjectNode) attributes
                : OBJECT_MAPPER.createObjectNode();
        String providerId = null;
        if (client) {
            String owner = item.path("relationships").path("provider").path("data").path("id").asText(null);
            providerId = owner == null || owner.isEmpty() ? null : owner;
        }
        return new RegistryEntity(id, attributeObject, providerId);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
