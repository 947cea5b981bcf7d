package io.ledgerrelay.ledger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

final class HorizonClientTest {
    private static final String PAGE = """
            {"_embedded":{"records":[
              {"id":"tx-1","paging_token":"100","hash":"h1","ledger":1,"created_at":"2024-05-01T10:00:00Z",
               "source_account":"GSRC","memo_type":"text","memo":"w-1","successful":true},
              {"id":"tx-2","paging_token":"200","hash":"h2","ledger":2,"created_at":"2024-05-01T10:00:05Z",
               "source_account":"GSRC","memo_type":"none","successful":false}
            ]}}
            """;

    private HttpServer server;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Response> responses = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void fetchReadsAscendingPageAfterCursor() throws Exception {
        responses.put("/accounts/GANCHOR/transactions", new Response(200, PAGE));
        List<LedgerTransaction> records = client("GANCHOR").fetch("50", 2);

        Assertions.assertEquals(2, records.size());
        Assertions.assertEquals("tx-1", records.get(0).id());
        Assertions.assertEquals(100L, records.get(0).position());
        Assertions.assertEquals("w-1", records.get(0).memo());
        Assertions.assertFalse(records.get(1).successful());
        Assertions.assertNull(records.get(1).memo());
        Assertions.assertEquals("/accounts/GANCHOR/transactions?order=asc&limit=2&cursor=50", requests.get(0));
    }

    @Test
    void fetchWithoutAccountOrCursorReadsGlobalFeedFromOldest() throws Exception {
        responses.put("/transactions", new Response(200, "{\"_embedded\":{\"records\":[]}}"));
        Assertions.assertTrue(client("").fetch(null, 200).isEmpty());
        Assertions.assertEquals("/transactions?order=asc&limit=200", requests.get(0));
    }

    @Test
    void rejectedCursorIsReportedAsInvalidCursor() throws Exception {
        responses.put("/transactions", new Response(400,
                "{\"title\":\"Bad Request\",\"detail\":\"cursor out of range\",\"extras\":{\"invalid_field\":\"cursor\"}}"));
        InvalidCursorException e = Assertions.assertThrows(InvalidCursorException.class, () -> client("").fetch("999", 10));
        Assertions.assertTrue(e.getMessage().contains("cursor out of range"));

        responses.put("/transactions", new Response(410, "{\"title\":\"Gone\"}"));
        Assertions.assertThrows(InvalidCursorException.class, () -> client("").fetch("1", 10));
    }

    @Test
    void serverErrorsAndRateLimitsAreTransient() throws Exception {
        responses.put("/transactions", new Response(503, "upstream unavailable"));
        Assertions.assertThrows(ConnectivityException.class, () -> client("").fetch(null, 10));

        responses.put("/transactions", new Response(429, "{\"title\":\"Rate Limit Exceeded\"}"));
        Assertions.assertThrows(ConnectivityException.class, () -> client("").fetch(null, 10));

        responses.put("/transactions", new Response(200, "{\"unexpected\":true}"));
        Assertions.assertThrows(ConnectivityException.class, () -> client("").fetch(null, 10));
    }

    @Test
    void otherClientErrorsAreNotRetried() throws Exception {
        responses.put("/transactions", new Response(400, "{\"title\":\"Bad Request\",\"detail\":\"limit too large\"}"));
        HorizonRequestException e = Assertions.assertThrows(HorizonRequestException.class, () -> client("").fetch(null, 10));
        Assertions.assertEquals(400, e.status());
    }

    @Test
    void unreachableHorizonIsAConnectivityFailure() throws Exception {
        HttpServer closed = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        HorizonClient client = new HorizonClient("http://127.0.0.1:" + port, "", Duration.ofSeconds(2));
        Assertions.assertThrows(ConnectivityException.class, () -> client.fetch(null, 10));
    }

    @Test
    void loadAccountReadsBalancesAndTreatsMissingAccountAsEmpty() throws Exception {
        responses.put("/accounts/GUSER", new Response(200, """
                {"account_id":"GUSER","balances":[
                  {"balance":"12.5","asset_type":"credit_alphanum4","asset_code":"USDC","asset_issuer":"GISSUER"},
                  {"balance":"100.0","asset_type":"native"}
                ]}
                """));
        Optional<AccountBalances> account = client("").loadAccount("GUSER");
        Assertions.assertTrue(account.isPresent());
        Assertions.assertEquals(2, account.get().balances().size());
        Assertions.assertTrue(account.get().hasTrustline("USDC"));
        Assertions.assertFalse(account.get().hasTrustline("EURT"));

        Assertions.assertTrue(client("").loadAccount("GNOBODY").isEmpty());
    }

    @Test
    void submitReportsHashAndMapsRejectionCodes() throws Exception {
        responses.put("/transactions", new Response(200, "{\"hash\":\"abc\",\"successful\":true,\"result_xdr\":\"AAAA\"}"));
        SubmitResult submitted = client("").submit("AAAA+/=");
        Assertions.assertEquals("abc", submitted.hash());
        Assertions.assertTrue(submitted.successful());
        Assertions.assertEquals("/transactions", requests.get(0));

        responses.put("/transactions", new Response(400,
                "{\"title\":\"Transaction Failed\",\"extras\":{\"result_codes\":{\"transaction\":\"tx_failed\",\"operations\":[\"op_no_trust\"]}}}"));
        TransactionRejectedException rejected = Assertions.assertThrows(TransactionRejectedException.class,
                () -> client("").submit("AAAA"));
        Assertions.assertEquals(400, rejected.status());
        Assertions.assertEquals("tx_failed", rejected.transactionCode());
        Assertions.assertTrue(rejected.hasOperationCode("op_no_trust"));

        responses.put("/transactions", new Response(504, "{\"title\":\"Timeout\"}"));
        Assertions.assertThrows(ConnectivityException.class, () -> client("").submit("AAAA"));
    }

    @Test
    void baseFeeComesFromFeeStatsWithMinimumFallback() throws Exception {
        responses.put("/fee_stats", new Response(200, "{\"last_ledger_base_fee\":\"250\"}"));
        Assertions.assertEquals(250L, client("").fetchBaseFee());
        responses.put("/fee_stats", new Response(200, "{}"));
        Assertions.assertEquals(100L, client("").fetchBaseFee());
    }

    private HorizonClient client(String account) {
        return new HorizonClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", account, Duration.ofSeconds(5));
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(query == null ? path : path + "?" + query);
        Response response = responses.getOrDefault(path, new Response(404, "{\"title\":\"Resource Missing\"}"));
        byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/hal+json");
        exchange.sendResponseHeaders(response.status(), body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private record Response(int status, String body) {
    }
}
