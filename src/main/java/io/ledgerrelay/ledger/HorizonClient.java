package io.ledgerrelay.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class HorizonClient implements TransactionFeed, AccountLookup, TransactionSubmitter {
    private static final Logger log = LoggerFactory.getLogger(HorizonClient.class);
    private static final long DEFAULT_BASE_FEE = 100L;

    private final String baseUrl;
    private final String account;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HorizonClient(String baseUrl, String account, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("horizon base url must not be blank");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.account = account == null ? "" : account.trim();
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<LedgerTransaction> fetch(String cursor, int limit) {
        String path = account.isBlank()
                ? "/transactions"
                : "/accounts/" + encode(account) + "/transactions";
        StringBuilder query = new StringBuilder("?order=asc&limit=").append(Math.max(1, limit));
        if (cursor != null && !cursor.isBlank()) {
            query.append("&cursor=").append(encode(cursor));
        }
        HttpResponse<String> response = get(path + query);
        int status = response.statusCode();
        if (status == 200) {
            return parseRecords(response.body());
        }
        JsonNode problem = parseProblem(response.body());
        String detail = problem.path("detail").asText(problem.path("title").asText("no detail"));
        if (status == 410 || (status == 400 && "cursor".equals(problem.path("extras").path("invalid_field").asText()))) {
            throw new InvalidCursorException(cursor, "Horizon rejected cursor " + cursor + ": " + detail);
        }
        throw statusFailure(status, path, detail);
    }

    @Override
    public Optional<AccountBalances> loadAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId must not be blank");
        }
        String path = "/accounts/" + encode(accountId.trim());
        HttpResponse<String> response = get(path);
        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status != 200) {
            JsonNode problem = parseProblem(response.body());
            throw statusFailure(status, path, problem.path("detail").asText("no detail"));
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(response.body());
        } catch (IOException e) {
            throw new ConnectivityException("Unreadable account response for " + accountId, e);
        }
        List<AccountBalances.Balance> balances = new ArrayList<>();
        for (JsonNode balance : root.path("balances")) {
            balances.add(new AccountBalances.Balance(
                    balance.path("asset_type").asText(""),
                    balance.hasNonNull("asset_code") ? balance.get("asset_code").asText() : null,
                    balance.hasNonNull("asset_issuer") ? balance.get("asset_issuer").asText() : null,
                    balance.path("balance").asText("0")
            ));
        }
        return Optional.of(new AccountBalances(
                root.path("account_id").asText(accountId),
                root.path("sequence").asLong(0L),
                balances
        ));
    }

    @Override
    public long fetchBaseFee() {
        HttpResponse<String> response = get("/fee_stats");
        if (response.statusCode() != 200) {
            JsonNode problem = parseProblem(response.body());
            throw statusFailure(response.statusCode(), "/fee_stats", problem.path("detail").asText("no detail"));
        }
        long fee = parseProblem(response.body()).path("last_ledger_base_fee").asLong(0L);
        return fee > 0L ? fee : DEFAULT_BASE_FEE;
    }

    @Override
    public SubmitResult submit(String envelopeXdr) {
        if (envelopeXdr == null || envelopeXdr.isBlank()) {
            throw new IllegalArgumentException("envelopeXdr must not be blank");
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/transactions"))
                .timeout(timeout)
                .header("Accept", "application/hal+json, application/json")
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("tx=" + encode(envelopeXdr), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request, "/transactions");
        int status = response.statusCode();
        JsonNode body = parseProblem(response.body());
        if (status == 200) {
            return new SubmitResult(
                    body.path("hash").asText(""),
                    body.path("successful").asBoolean(true),
                    body.path("result_xdr").asText("")
            );
        }
        String detail = body.path("detail").asText(body.path("title").asText("no detail"));
        if (status == 400) {
            JsonNode codes = body.path("extras").path("result_codes");
            List<String> operationCodes = new ArrayList<>();
            for (JsonNode code : codes.path("operations")) {
                operationCodes.add(code.asText());
            }
            String transactionCode = codes.path("transaction").asText("");
            throw new TransactionRejectedException(status,
                    "Horizon rejected transaction: " + transactionCode + " " + operationCodes,
                    transactionCode, operationCodes);
        }
        throw statusFailure(status, "/transactions", detail);
    }

    private HttpResponse<String> get(String pathAndQuery) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(timeout)
                .header("Accept", "application/hal+json, application/json")
                .GET()
                .build();
        return send(request, pathAndQuery);
    }

    private HttpResponse<String> send(HttpRequest request, String pathAndQuery) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConnectivityException("Horizon request failed: " + pathAndQuery, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while calling Horizon: " + pathAndQuery, e);
        }
    }

    private List<LedgerTransaction> parseRecords(String body) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new ConnectivityException("Unreadable transaction page from Horizon", e);
        }
        JsonNode records = root.path("_embedded").path("records");
        if (!records.isArray()) {
            throw new ConnectivityException("Transaction page from Horizon has no records array");
        }
        List<LedgerTransaction> out = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            out.add(LedgerTransaction.fromJson(record));
        }
        return out;
    }

    private JsonNode parseProblem(String body) {
        try {
            return Jsons.readTree(body);
        } catch (IllegalArgumentException e) {
            log.debug("Horizon error body is not JSON: {}", e.getMessage());
            return Jsons.mapper().createObjectNode();
        }
    }

    private LedgerException statusFailure(int status, String path, String detail) {
        if (status == 429 || status >= 500) {
            return new ConnectivityException("Horizon returned " + status + " for " + path + ": " + detail);
        }
        return new HorizonRequestException(status, "Horizon returned " + status + " for " + path + ": " + detail);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
