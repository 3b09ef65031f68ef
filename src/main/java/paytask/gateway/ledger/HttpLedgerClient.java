package paytask.gateway.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import paytask.gateway.config.GatewayConfig;
import paytask.gateway.ledger.dto.GetBlocksArgs;
import paytask.gateway.ledger.dto.QueryBlocksResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Ledger client speaking JSON over HTTP.
 * POST {ledgerUrl}/query_blocks with {"start":..,"length":..}.
 * No retries: one request per query.
 */
public class HttpLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLedgerClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpClient httpClient;
    private final URI queryBlocksUri;
    private final Duration timeout;

    public HttpLedgerClient(GatewayConfig config) {
        this(config.ledgerUrl(), config.ledgerTimeout());
    }

    public HttpLedgerClient(String ledgerUrl, Duration timeout) {
        String base = ledgerUrl.endsWith("/") ? ledgerUrl.substring(0, ledgerUrl.length() - 1) : ledgerUrl;
        this.queryBlocksUri = URI.create(base + "/query_blocks");
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CompletableFuture<QueryBlocksResponse> queryBlocks(GetBlocksArgs args) {
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(args);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new LedgerException("cannot encode ledger query", e));
        }

        HttpRequest request = HttpRequest.newBuilder(queryBlocksUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        log.debug("Querying ledger blocks [{}, {})", args.start(), args.start() + args.length());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new LedgerException("ledger query failed: " + error.getMessage(), error);
                    }
                    return parse(response);
                });
    }

    private QueryBlocksResponse parse(HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new LedgerException("ledger returned HTTP " + response.statusCode() + ": " + response.body());
        }
        try {
            return MAPPER.readValue(response.body(), QueryBlocksResponse.class);
        } catch (JsonProcessingException e) {
            throw new LedgerException("cannot decode ledger response", e);
        }
    }
}
