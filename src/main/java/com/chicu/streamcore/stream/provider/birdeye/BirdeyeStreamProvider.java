package com.chicu.streamcore.stream.provider.birdeye;

import com.chicu.streamcore.stream.JsonFields;
import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;
import com.chicu.streamcore.stream.StreamCommand;
import com.chicu.streamcore.stream.StreamProvider;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Birdeye: цены токенов.
 *
 * Кадр: {"type":"snapshot|delta|price|ping|pong|subscribed","key":"SOL","sequence":42,"payload":{...}}
 * ("data" вместо "payload" и "symbol" вместо "key" тоже принимаем).
 */
@Slf4j
public class BirdeyeStreamProvider implements StreamProvider {

    public static final String ID = "birdeye";
    public static final String DEFAULT_WS_URL = "wss://public-api.birdeye.so/socket";
    public static final String DEFAULT_REST_URL = "https://public-api.birdeye.so";

    private static final Set<String> SKIP = Set.of("symbol", "address", "key", "sequence", "seq", "type");
    private static final Map<String, String> ALIASES = Map.of(
            "change_24h", "change",
            "priceChange24h", "change",
            "volume_24h", "volume",
            "v24hUSD", "volume",
            "value", "price"
    );

    private final String wsUrl;
    private final String restUrl;
    private final String apiKey;

    public BirdeyeStreamProvider(String wsUrl, String restUrl, String apiKey) {
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
        return URI.create(wsUrl + "?x-api-key=" + encode(apiKey));
    }

    // =====================================================================
    // PARSE
    // =====================================================================

    @Override
    public List<ProviderMessage> parse(String raw) throws ProtocolException {
        JSONObject root;
        try {
            root = new JSONObject(raw);
        } catch (JSONException e) {
            throw new ProtocolException("birdeye: not a JSON object", e);
        }

        String type = root.optString("type", "").toLowerCase(Locale.ROOT);
        return switch (type) {
            case "ping" -> List.of(ProviderMessage.ping());
            case "pong" -> List.of(ProviderMessage.pong());
            case "subscribed" -> subscribedAck(root);
            case "welcome", "unsubscribed" -> {
                log.debug("[birdeye] {}", type);
                yield List.of();
            }
            case "snapshot" -> List.of(priceMessage(root, true));
            // "price": старое имя дельты
            case "delta", "price" -> List.of(priceMessage(root, false));
            default -> throw new ProtocolException("birdeye: unexpected message type '" + type + "'");
        };
    }

    /**
     * {"type":"subscribed","data":{"channel":"prices","symbols":[...]}}; без symbols: подтверждена одна пачка.
     */
    private static List<ProviderMessage> subscribedAck(JSONObject root) {
        JSONObject data = root.optJSONObject("data");
        JSONArray symbols = data != null ? data.optJSONArray("symbols") : root.optJSONArray("symbols");
        if (symbols == null || symbols.isEmpty()) {
            return List.of(ProviderMessage.ack(null));
        }
        List<ProviderMessage> acks = new ArrayList<>(symbols.length());
        for (int i = 0; i < symbols.length(); i++) {
            acks.add(ProviderMessage.ack(symbols.getString(i)));
        }
        return acks;
    }

    private ProviderMessage priceMessage(JSONObject root, boolean snapshot) throws ProtocolException {
        JSONObject data = root.optJSONObject("payload");
        if (data == null) {
            data = root.optJSONObject("data");
        }
        if (data == null) {
            data = root;
        }

        String key = root.optString("key", "");
        if (key.isBlank()) {
            key = data.optString("symbol", data.optString("address", ""));
        }
        if (key.isBlank()) {
            throw new ProtocolException("birdeye: missing key");
        }

        long sequence = sequenceOf(root, data);
        if (sequence < 0) {
            throw new ProtocolException("birdeye: missing sequence for " + key);
        }

        Map<String, Object> fields = JsonFields.extract(data, SKIP, ALIASES);
        if (snapshot && !fields.containsKey("price")) {
            throw new ProtocolException("birdeye: snapshot without price for " + key);
        }

        return snapshot
                ? ProviderMessage.snapshot(key, sequence, fields)
                : ProviderMessage.delta(key, sequence, fields);
    }

    private static long sequenceOf(JSONObject root, JSONObject data) {
        if (root.has("sequence")) {
            return root.optLong("sequence", -1L);
        }
        if (root.has("seq")) {
            return root.optLong("seq", -1L);
        }
        return data.optLong("sequence", data.optLong("seq", -1L));
    }

    // =====================================================================
    // COMMANDS
    // =====================================================================

    @Override
    public Optional<String> formatCommand(StreamCommand command) {
        return switch (command.type()) {
            case SUBSCRIBE -> Optional.of(channelCommand("subscribe", command.keys()));
            case UNSUBSCRIBE -> Optional.of(channelCommand("unsubscribe", command.keys()));
            // ping: кадром WebSocket, как у всех провайдеров
            case PING -> Optional.empty();
            case PONG -> Optional.of(new JSONObject().put("type", "pong").toString());
            case DISCONNECT -> Optional.empty();
        };
    }

    private static String channelCommand(String type, List<String> keys) {
        JSONObject data = new JSONObject()
                .put("channel", "prices")
                .put("symbols", new JSONArray(keys));
        return new JSONObject()
                .put("type", type)
                .put("data", data)
                .toString();
    }

    // =====================================================================
    // FALLBACK (REST)
    // =====================================================================

    @Override
    public Optional<FallbackRequest> fallbackRequest(String key) {
        URI uri = URI.create(restUrl + "/defi/price?address=" + encode(key));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-chain", "solana");
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("X-API-KEY", apiKey);
        }
        return Optional.of(new FallbackRequest(uri, headers));
    }

    @Override
    public ProviderMessage parseFallback(String key, String body) throws ProtocolException {
        try {
            JSONObject root = new JSONObject(body);
            if (!root.optBoolean("success", true)) {
                throw new ProtocolException("birdeye REST: success=false for " + key);
            }
            JSONObject data = root.optJSONObject("data");
            if (data == null) {
                throw new ProtocolException("birdeye REST: missing data for " + key);
            }
            Map<String, Object> fields = JsonFields.extract(data, SKIP, ALIASES);
            if (!fields.containsKey("price")) {
                throw new ProtocolException("birdeye REST: missing price for " + key);
            }
            return ProviderMessage.snapshot(key, 0L, fields);
        } catch (JSONException e) {
            throw new ProtocolException("birdeye REST: bad JSON for " + key, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
