package com.stablecore.web3;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigInteger;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Blocking venue client run on its own small pool.
 * <pre>
 *   POST {baseUrl}/transfers                  {"asset_id", "receiver_id", "amount"}
 *   POST {baseUrl}/deposits/{receipt}/claim   {"claimant_id"} -> {"receipt_id", "sender_id", "asset_id", "amount"}
 * </pre>
 * Any non-2xx answer fails the call; 404 and 409 on a claim mean there is nothing to claim.
 */
@Component
@Slf4j
public class HttpTransferGateway implements TransferGateway, DisposableBean {

    private final RestTemplate venueRestTemplate;
    private final AppProps props;
    private final ObjectMapper mapper;

    private final ExecutorService io = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "venue-io");
        t.setDaemon(true);
        return t;
    });

    public HttpTransferGateway(@Qualifier("venueRestTemplate") RestTemplate venueRestTemplate,
                               AppProps props, ObjectMapper mapper) {
        this.venueRestTemplate = venueRestTemplate;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public CompletableFuture<Void> transfer(String assetId, String receiverId, BigInteger amount) {
        return CompletableFuture.runAsync(() -> post(assetId, receiverId, amount), io);
    }

    @Override
    public CompletableFuture<DepositReceipt> claimDeposit(String receiptId, String claimantId) {
        return CompletableFuture.supplyAsync(() -> claim(receiptId, claimantId), io);
    }

    private DepositReceipt claim(String receiptId, String claimantId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getVenue().getBaseUrl())
                .path("/deposits/{receipt}/claim")
                .buildAndExpand(receiptId).encode().toUri();

        Map<String, String> body = new LinkedHashMap<>();
        body.put("claimant_id", claimantId);

        try {
            ResponseEntity<String> resp = venueRestTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(body, headers()), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue HTTP " + resp.getStatusCode());
            }
            DepositReceipt receipt = parseReceipt(resp.getBody());
            log.info("[venue] claimed deposit {}: {} {} from {}", receipt.getReceiptId(), receipt.getAmount(),
                    receipt.getAssetId(), receipt.getSenderId());
            return receipt;
        } catch (HttpStatusCodeException httpEx) {
            int status = httpEx.getStatusCode().value();
            if (status == 404 || status == 409) {
                throw new CoreException(ErrorCode.INSUFFICIENT_BALANCE,
                        "no unclaimed deposit " + receiptId + " for " + claimantId);
            }
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED,
                    "venue HTTP error " + httpEx.getStatusCode() + ": " + httpEx.getResponseBodyAsString(), httpEx);
        } catch (RestClientException e) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue call failed: " + e.getMessage(), e);
        }
    }

    private DepositReceipt parseReceipt(String json) {
        try {
            JsonNode root = mapper.readTree(json == null ? "" : json);
            String id = text(root, "receipt_id");
            String sender = text(root, "sender_id");
            String asset = text(root, "asset_id");
            String amount = text(root, "amount");
            if (id == null || sender == null || asset == null || amount == null) {
                throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue returned an incomplete receipt: " + json);
            }
            return DepositReceipt.builder()
                    .receiptId(id)
                    .senderId(sender)
                    .assetId(asset)
                    .amount(new BigInteger(amount))
                    .build();
        } catch (JsonProcessingException | NumberFormatException e) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue returned an unreadable receipt: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root == null ? null : root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    private static HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, "stable-core/venue-client");
        return headers;
    }

    private void post(String assetId, String receiverId, BigInteger amount) {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getVenue().getBaseUrl())
                .path("/transfers")
                .build(true).toUri();

        Map<String, String> body = new LinkedHashMap<>();
        body.put("asset_id", assetId);
        body.put("receiver_id", receiverId);
        body.put("amount", amount.toString());

        try {
            ResponseEntity<String> resp = venueRestTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(body, headers()), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue HTTP " + resp.getStatusCode());
            }
            log.info("[venue] transferred {} {} to {}", amount, assetId, receiverId);
        } catch (HttpStatusCodeException httpEx) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED,
                    "venue HTTP error " + httpEx.getStatusCode() + ": " + httpEx.getResponseBodyAsString(), httpEx);
        } catch (RestClientException e) {
            throw new CoreException(ErrorCode.EXTERNAL_CALL_FAILED, "venue call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void destroy() {
        io.shutdownNow();
    }
}
