package dev.goodone.rabbit.example;

import dev.goodone.rabbit.BrokerAddress;
import dev.goodone.rabbit.ClientSettings;
import dev.goodone.rabbit.util.Logger;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Worker configuration: {@code example_app.properties} from the classpath, overlaid by system properties, overlaid
 * by {@code RABBITMQ_*} environment variables.
 */
public class WorkerConfig {

    private static final Logger log = new Logger(WorkerConfig.class);

    static final String HOST = "rabbit.host";
    static final String PORT = "rabbit.port";
    static final String USERNAME = "rabbit.username";
    static final String PASSWORD = "rabbit.password";
    static final String VHOST = "rabbit.vhost";
    static final String CLIENT_SETTINGS = "rabbit.client.settings";
    static final String POOL_SIZE = "rabbit.pool_size";
    static final String MAX_RETRY = "rabbit.max_retry";
    static final String RETRY_DELAY = "rabbit.retry_delay_millis";
    static final String APP_ID = "app.id";

    static final Map<String, String> ENVIRONMENT_OVERRIDES = ImmutableMap.<String, String>builder()
            .put("RABBITMQ_HOST", HOST)
            .put("RABBITMQ_PORT", PORT)
            .put("RABBITMQ_USERNAME", USERNAME)
            .put("RABBITMQ_PASSWORD", PASSWORD)
            .put("RABBITMQ_VHOST", VHOST)
            .put("RABBITMQ_POOL_SIZE", POOL_SIZE)
            .put("RABBITMQ_MAX_RETRY", MAX_RETRY)
            .put("RABBITMQ_RETRY_DELAY", RETRY_DELAY)
            .build();

    private final Properties properties;

    WorkerConfig(Properties properties) {
        this.properties = properties;
    }

    public static WorkerConfig load() throws IOException {
        Properties prop = new Properties();
        try (InputStream defaults = WorkerConfig.class.getResourceAsStream("/example_app.properties")) {
            if (defaults == null) {
                throw new IOException("example_app.properties not found on the classpath");
            }
            prop.load(defaults);
        }
        prop.putAll(System.getProperties());
        return new WorkerConfig(overlayEnvironment(prop, System.getenv()));
    }

    static Properties overlayEnvironment(Properties prop, Map<String, String> environment) {
        for (Map.Entry<String, String> override : ENVIRONMENT_OVERRIDES.entrySet()) {
            String value = environment.get(override.getKey());
            if (!Strings.isNullOrEmpty(value)) {
                log.infoWithParams("Configuration overridden from environment.",
                        "variable", override.getKey(),
                        "property", override.getValue());
                prop.setProperty(override.getValue(), value);
            }
        }
        return prop;
    }

    public BrokerAddress brokerAddress() {
        BrokerAddress.Builder builder = new BrokerAddress.Builder();
        if (has(HOST)) {
            builder.withHost(properties.getProperty(HOST));
        }
        if (has(PORT)) {
            builder.withPort(intProperty(PORT));
        }
        if (has(USERNAME)) {
            builder.withUsername(properties.getProperty(USERNAME));
        }
        if (has(PASSWORD)) {
            builder.withPassword(properties.getProperty(PASSWORD));
        }
        if (has(VHOST)) {
            builder.withVirtualHost(properties.getProperty(VHOST));
        }
        return builder.build();
    }

    public ClientSettings clientSettings() {
        ClientSettings.Builder builder = has(CLIENT_SETTINGS)
                ? new ClientSettings.Builder(properties.getProperty(CLIENT_SETTINGS))
                : new ClientSettings.Builder();
        if (has(POOL_SIZE)) {
            builder.withPoolSize(intProperty(POOL_SIZE));
        }
        if (has(MAX_RETRY)) {
            builder.withMaxRetry(intProperty(MAX_RETRY));
        }
        if (has(RETRY_DELAY)) {
            builder.withRetryDelayMillis(intProperty(RETRY_DELAY));
        }
        if (has(APP_ID)) {
            builder.withAppId(properties.getProperty(APP_ID));
        }
        return builder.build();
    }

    private boolean has(String key) {
        return !Strings.isNullOrEmpty(properties.getProperty(key));
    }

    private int intProperty(String key) {
        String value = properties.getProperty(key).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }
}
