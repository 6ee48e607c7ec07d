package dev.goodone.rabbit;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.goodone.rabbit.util.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Settings of a {@link RabbitClient}: pool sizing, the consume retry protocol, timeouts and the backoff used
 * when (re)connecting.
 *
 * This object can be built programmatically by using the various {@link ClientSettings.Builder} withXX
 * methods or by supplying a JSON formatted String to {@link ClientSettings.Builder#Builder(String)}.
 * The JSON parameter names are available as String constants and correspond to the field names of this class.
 *
 * The {@link #toString()} method shows the JSON representation of this class and can be used as input to the
 * JSON builder.
 */
public class ClientSettings {

    private final static Logger log = new Logger(ClientSettings.class);
    private final static ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);

    public static final int DEFAULT_POOL_SIZE                   = 10;
    public static final int DEFAULT_MAX_RETRY                   = 3;
    public static final int DEFAULT_RETRY_DELAY_MILLIS          = 5_000;
    public static final int DEFAULT_CHANNEL_TIMEOUT_MILLIS      = 5_000;
    public static final int DEFAULT_RPC_TIMEOUT_MILLIS          = 30_000;
    public static final int DEFAULT_CONNECT_MAX_RETRIES         = 5;
    public static final int DEFAULT_INITIAL_BACKOFF_MILLIS      = 1_000;
    public static final int DEFAULT_MAX_BACKOFF_MILLIS          = 30_000;
    public static final int DEFAULT_HEARTBEAT                   = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS   = 30_000;
    public static final int DEFAULT_HANDSHAKE_TIMEOUT_MILLIS    = 10_000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_MILLIS     = 10_000;
    public static final String DEFAULT_APP_ID                   = "unknown";

    public final static String pool_size_param                  = "pool_size";
    public final static String max_retry_param                  = "max_retry";
    public final static String retry_delay_millis_param         = "retry_delay_millis";
    public final static String channel_timeout_millis_param     = "channel_timeout_millis";
    public final static String rpc_timeout_millis_param         = "rpc_timeout_millis";
    public final static String connect_max_retries_param        = "connect_max_retries";
    public final static String initial_backoff_millis_param     = "initial_backoff_millis";
    public final static String max_backoff_millis_param         = "max_backoff_millis";
    public final static String heartbeat_param                  = "heartbeat";
    public final static String connection_timeout_millis_param  = "connection_timeout_millis";
    public final static String handshake_timeout_millis_param   = "handshake_timeout_millis";
    public final static String shutdown_timeout_millis_param    = "shutdown_timeout_millis";
    public final static String app_id_param                     = "app_id";

    /** number of channels opened up front and shared by publishers and consumers */
    public final int pool_size;
    /** how many times a failing delivery is republished before it is dead-lettered */
    public final int max_retry;
    public final int retry_delay_millis;
    public final int channel_timeout_millis;
    public final int rpc_timeout_millis;
    public final int connect_max_retries;
    public final int initial_backoff_millis;
    public final int max_backoff_millis;
    public final int heartbeat; //in seconds
    public final int connection_timeout_millis;
    public final int handshake_timeout_millis;
    public final int shutdown_timeout_millis;
    public final String app_id;

    private ClientSettings(Builder b) {
        this.pool_size = b.poolSize;
        this.max_retry = b.maxRetry;
        this.retry_delay_millis = b.retryDelayMillis;
        this.channel_timeout_millis = b.channelTimeoutMillis;
        this.rpc_timeout_millis = b.rpcTimeoutMillis;
        this.connect_max_retries = b.connectMaxRetries;
        this.initial_backoff_millis = b.initialBackoffMillis;
        this.max_backoff_millis = b.maxBackoffMillis;
        this.heartbeat = b.heartbeat;
        this.connection_timeout_millis = b.connectionTimeoutMillis;
        this.handshake_timeout_millis = b.handshakeTimeoutMillis;
        this.shutdown_timeout_millis = b.shutdownTimeoutMillis;
        this.app_id = b.appId;
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private int poolSize;
        private int maxRetry;
        private int retryDelayMillis;
        private int channelTimeoutMillis;
        private int rpcTimeoutMillis;
        private int connectMaxRetries;
        private int initialBackoffMillis;
        private int maxBackoffMillis;
        private int heartbeat;
        private int connectionTimeoutMillis;
        private int handshakeTimeoutMillis;
        private int shutdownTimeoutMillis;
        private String appId;

        public Builder() {
            setDefaults(new HashMap<>());
        }

        /**
         * @param settingsJSONString relaxed JSON, field names may be unquoted and the outer braces may be left out.
         *                           For example {@code pool_size:4, max_retry:5}
         */
        public Builder(String settingsJSONString) {
            String json = settingsJSONString.trim();
            if (!json.startsWith("{")) {
                json = "{" + json + "}";
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = mapper.readValue(json, Map.class);
                setDefaults(map);
            } catch (JsonProcessingException | ClassCastException e) {
                log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
                throw new IllegalArgumentException(e);
            }
        }

        private void setDefaults(Map<String, Object> map) {
            poolSize = intValue(map, pool_size_param, DEFAULT_POOL_SIZE);
            maxRetry = intValue(map, max_retry_param, DEFAULT_MAX_RETRY);
            retryDelayMillis = intValue(map, retry_delay_millis_param, DEFAULT_RETRY_DELAY_MILLIS);
            channelTimeoutMillis = intValue(map, channel_timeout_millis_param, DEFAULT_CHANNEL_TIMEOUT_MILLIS);
            rpcTimeoutMillis = intValue(map, rpc_timeout_millis_param, DEFAULT_RPC_TIMEOUT_MILLIS);
            connectMaxRetries = intValue(map, connect_max_retries_param, DEFAULT_CONNECT_MAX_RETRIES);
            initialBackoffMillis = intValue(map, initial_backoff_millis_param, DEFAULT_INITIAL_BACKOFF_MILLIS);
            maxBackoffMillis = intValue(map, max_backoff_millis_param, DEFAULT_MAX_BACKOFF_MILLIS);
            heartbeat = intValue(map, heartbeat_param, DEFAULT_HEARTBEAT);
            connectionTimeoutMillis = intValue(map, connection_timeout_millis_param, DEFAULT_CONNECTION_TIMEOUT_MILLIS);
            handshakeTimeoutMillis = intValue(map, handshake_timeout_millis_param, DEFAULT_HANDSHAKE_TIMEOUT_MILLIS);
            shutdownTimeoutMillis = intValue(map, shutdown_timeout_millis_param, DEFAULT_SHUTDOWN_TIMEOUT_MILLIS);
            appId = (String) map.getOrDefault(app_id_param, DEFAULT_APP_ID);
        }

        private static int intValue(Map<String, Object> map, String key, int defaultValue) {
            Object value = map.get(key);
            if (value == null) {
                return defaultValue;
            }
            return ((Number) value).intValue();
        }

        public ClientSettings build() {
            checkArgument(poolSize >= 1, pool_size_param, poolSize);
            checkArgument(maxRetry >= 0, max_retry_param, maxRetry);
            checkArgument(retryDelayMillis >= 0, retry_delay_millis_param, retryDelayMillis);
            checkArgument(channelTimeoutMillis >= 0, channel_timeout_millis_param, channelTimeoutMillis);
            checkArgument(rpcTimeoutMillis > 0, rpc_timeout_millis_param, rpcTimeoutMillis);
            checkArgument(connectMaxRetries >= 0, connect_max_retries_param, connectMaxRetries);
            checkArgument(initialBackoffMillis >= 0, initial_backoff_millis_param, initialBackoffMillis);
            checkArgument(maxBackoffMillis >= initialBackoffMillis, max_backoff_millis_param, maxBackoffMillis);
            checkArgument(heartbeat >= 0, heartbeat_param, heartbeat);
            return new ClientSettings(this);
        }

        private static void checkArgument(boolean valid, String param, int value) {
            if (!valid) {
                throw new IllegalArgumentException("Invalid value for " + param + ": " + value);
            }
        }

        public Builder withPoolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder withMaxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
            return this;
        }

        public Builder withRetryDelayMillis(int retryDelayMillis) {
            this.retryDelayMillis = retryDelayMillis;
            return this;
        }

        public Builder withChannelTimeoutMillis(int channelTimeoutMillis) {
            this.channelTimeoutMillis = channelTimeoutMillis;
            return this;
        }

        public Builder withRpcTimeoutMillis(int rpcTimeoutMillis) {
            this.rpcTimeoutMillis = rpcTimeoutMillis;
            return this;
        }

        public Builder withConnectMaxRetries(int connectMaxRetries) {
            this.connectMaxRetries = connectMaxRetries;
            return this;
        }

        public Builder withInitialBackoffMillis(int initialBackoffMillis) {
            this.initialBackoffMillis = initialBackoffMillis;
            return this;
        }

        public Builder withMaxBackoffMillis(int maxBackoffMillis) {
            this.maxBackoffMillis = maxBackoffMillis;
            return this;
        }

        public Builder withHeartbeatSecs(int heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder withConnectionTimeoutMillis(int connectionTimeoutMillis) {
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder withHandshakeTimeoutMillis(int handshakeTimeoutMillis) {
            this.handshakeTimeoutMillis = handshakeTimeoutMillis;
            return this;
        }

        public Builder withShutdownTimeoutMillis(int shutdownTimeoutMillis) {
            this.shutdownTimeoutMillis = shutdownTimeoutMillis;
            return this;
        }

        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }
    }
}
