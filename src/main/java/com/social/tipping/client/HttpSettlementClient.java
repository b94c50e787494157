package com.social.tipping.client;

import com.social.tipping.exception.SettlementException;
import com.social.tipping.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class HttpSettlementClient implements SettlementClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSettlementClient.class);

    private final RestTemplate restTemplate;

    public HttpSettlementClient(@Qualifier("settlementRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String settle(String jobId, String senderId, String recipientId, long amount, String contentReference) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("idempotencyKey", jobId);
        body.put("senderId", senderId);
        body.put("recipientId", recipientId);
        body.put("amountSmallestUnit", Long.toString(amount));
        body.put("contentReference", contentReference);

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restTemplate.postForObject("/api/v1/settlements", body, Map.class);
            Object handle = response != null ? response.get("transactionHandle") : null;
            if (handle == null) {
                throw new SettlementException("Settlement response carried no transaction handle",
                        FailureKind.TRANSIENT);
            }
            log.debug("Settled job={} handle={}", jobId, handle);
            return handle.toString();
        } catch (HttpStatusCodeException e) {
            FailureKind kind = classify(e.getStatusCode().value());
            throw new SettlementException("Settlement rejected with HTTP " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), kind, e);
        } catch (ResourceAccessException e) {
            throw new SettlementException("Settlement backend unreachable: " + e.getMessage(),
                    FailureKind.TRANSIENT, e);
        }
    }

    static FailureKind classify(int status) {
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()
                || status == HttpStatus.REQUEST_TIMEOUT.value()
                || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        // 400 validation, 401/403 auth, 402 insufficient funds, 404 unknown account, 422 rejected.
        return FailureKind.PERMANENT;
    }
}
