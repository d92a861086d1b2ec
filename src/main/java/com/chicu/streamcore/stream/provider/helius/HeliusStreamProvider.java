package com.chicu.streamcore.stream.provider.helius;

import com.chicu.streamcore.stream.JsonFields;
import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;
import com.chicu.streamcore.stream.StreamCommand;
import com.chicu.streamcore.stream.StreamProvider;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Helius: JSON-RPC поверх WS, подписка на аккаунты (кошельки).
 *
 * accountSubscribe → ответ {"id":N,"result":subId} (это ACK ключа); дальше приходят
 * accountNotification с полным состоянием аккаунта: это snapshot, sequence = slot.
 * Отписка требует subId, поэтому провайдер помнит соответствия до следующего коннекта.
 */
@Slf4j
public class HeliusStreamProvider implements StreamProvider {

    public static final String ID = "helius";
    public static final String DEFAULT_WS_URL = "wss://mainnet.helius-rpc.com/";
    public static final String DEFAULT_REST_URL = "https://api.helius.xyz";

    private static final Set<String> SKIP = Set.of("data");
    private static final Map<String, String> ALIASES = Map.of();

    private final String wsUrl;
    private final String restUrl;
    private final String apiKey;

    private final AtomicLong requestIds = new AtomicLong();
    /** id запроса → ключ */
    private final Map<Long, String> pendingSubscribes = new ConcurrentHashMap<>();
    /** subId → ключ */
    private final Map<Long, String> subscriptions = new ConcurrentHashMap<>();
    /** ключ → subId */
    private final Map<String, Long> subscriptionIds = new ConcurrentHashMap<>();

    public HeliusStreamProvider(String wsUrl, String restUrl, String apiKey) {
        this.wsUrl = wsUrl == null || wsUrl.isBlank() ? DEFAULT_WS_URL : wsUrl;
        this.restUrl = restUrl == null || restUrl.isBlank() ? DEFAULT_REST_URL : restUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public URI streamUri() {
        if (apiKey == null || apiKey.isBlank()) {
            return URI.create(wsUrl);
        }
        return URI.create(wsUrl + "?api-key=" + encode(apiKey));
    }

    @Override
    public void onConnected() {
        pendingSubscribes.clear();
        subscriptions.clear();
        subscriptionIds.clear();
    }

    // =====================================================================
    // PARSE
    // =====================================================================

    @Override
    public List<ProviderMessage> parse(String raw) throws ProtocolException {
        String trimmed = raw == null ? "" : raw.trim();
        try {
            if (trimmed.startsWith("[")) {
                JSONArray batch = new JSONArray(trimmed);
                List<ProviderMessage> out = new ArrayList<>();
                for (int i = 0; i < batch.length(); i++) {
                    out.addAll(parseOne(batch.getJSONObject(i)));
                }
                return out;
            }
            return parseOne(new JSONObject(trimmed));
        } catch (JSONException e) {
            throw new ProtocolException("helius: bad JSON-RPC frame", e);
        }
    }

    private List<ProviderMessage> parseOne(JSONObject msg) throws ProtocolException {
        if (msg.has("error")) {
            JSONObject err = msg.optJSONObject("error");
            String text = err != null ? err.optString("message", err.toString()) : msg.optString("error");
            throw new ProtocolException("helius: rpc error id=" + msg.opt("id") + ": " + text);
        }

        if (msg.has("method")) {
            String method = msg.getString("method");
            if ("accountNotification".equals(method)) {
                return List.of(accountNotification(msg));
            }
            throw new ProtocolException("helius: unexpected method " + method);
        }

        if (msg.has("id") && msg.has("result")) {
            long id = msg.getLong("id");
            String key = pendingSubscribes.remove(id);
            Object result = msg.get("result");
            if (key != null && result instanceof Number n) {
                long subId = n.longValue();
                subscriptions.put(subId, key);
                subscriptionIds.put(key, subId);
                log.debug("[helius] subscribed {} → sub {}", key, subId);
                return List.of(ProviderMessage.ack(key));
            }
            return List.of();
        }

        throw new ProtocolException("helius: unrecognized frame");
    }

    private ProviderMessage accountNotification(JSONObject msg) throws ProtocolException {
        JSONObject params = msg.getJSONObject("params");
        long subId = params.getLong("subscription");
        String key = subscriptions.get(subId);
        if (key == null) {
            throw new ProtocolException("helius: notification for unknown subscription " + subId);
        }

        JSONObject result = params.getJSONObject("result");
        long slot = result.getJSONObject("context").getLong("slot");
        JSONObject value = result.optJSONObject("value");
        if (value == null) {
            throw new ProtocolException("helius: empty account value for " + key);
        }

        Map<String, Object> fields = new LinkedHashMap<>(JsonFields.extract(value, SKIP, ALIASES));
        fields.put("slot", BigDecimal.valueOf(slot));
        return ProviderMessage.snapshot(key, slot, fields);
    }

    // =====================================================================
    // COMMANDS
    // =====================================================================

    @Override
    public Optional<String> formatCommand(StreamCommand command) {
        return switch (command.type()) {
            case SUBSCRIBE -> Optional.of(subscribeBatch(command.keys()));
            case UNSUBSCRIBE -> unsubscribeBatch(command.keys());
            // ping/pong: на уровне кадров WebSocket
            case PING, PONG, DISCONNECT -> Optional.empty();
        };
    }

    private String subscribeBatch(List<String> keys) {
        JSONArray batch = new JSONArray();
        for (String key : keys) {
            long id = requestIds.incrementAndGet();
            pendingSubscribes.put(id, key);
            JSONObject opts = new JSONObject()
                    .put("encoding", "jsonParsed")
                    .put("commitment", "confirmed");
            batch.put(rpc(id, "accountSubscribe", new JSONArray().put(key).put(opts)));
        }
        return batch.toString();
    }

    private Optional<String> unsubscribeBatch(List<String> keys) {
        JSONArray batch = new JSONArray();
        for (String key : keys) {
            Long subId = subscriptionIds.remove(key);
            if (subId == null) {
                continue;
            }
            subscriptions.remove(subId);
            batch.put(rpc(requestIds.incrementAndGet(), "accountUnsubscribe", new JSONArray().put(subId)));
        }
        return batch.isEmpty() ? Optional.empty() : Optional.of(batch.toString());
    }

    private static JSONObject rpc(long id, String method, JSONArray params) {
        return new JSONObject()
                .put("jsonrpc", "2.0")
                .put("id", id)
                .put("method", method)
                .put("params", params);
    }

    // =====================================================================
    // FALLBACK (REST)
    // =====================================================================

    @Override
    public Optional<FallbackRequest> fallbackRequest(String key) {
        StringBuilder url = new StringBuilder(restUrl)
                .append("/v0/addresses/")
                .append(encode(key))
                .append("/balances");
        if (apiKey != null && !apiKey.isBlank()) {
            url.append("?api-key=").append(encode(apiKey));
        }
        return Optional.of(new FallbackRequest(URI.create(url.toString()), Map.of()));
    }

    @Override
    public ProviderMessage parseFallback(String key, String body) throws ProtocolException {
        try {
            JSONObject root = new JSONObject(body);
            if (!root.has("nativeBalance")) {
                throw new ProtocolException("helius REST: missing nativeBalance for " + key);
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("lamports", JsonFields.normalize(root.get("nativeBalance")));
            JSONArray tokens = root.optJSONArray("tokens");
            fields.put("tokenCount", BigDecimal.valueOf(tokens == null ? 0 : tokens.length()));
            return ProviderMessage.snapshot(key, 0L, fields);
        } catch (JSONException e) {
            throw new ProtocolException("helius REST: bad JSON for " + key, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
