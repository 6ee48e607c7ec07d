package dev.goodone.rabbit.example;

import com.google.common.collect.ImmutableMap;
import dev.goodone.rabbit.BrokerAddress;
import dev.goodone.rabbit.ClientSettings;
import org.junit.Test;

import java.util.Properties;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class WorkerConfigTest {

    @Test
    public void bundled_properties_describe_a_local_broker() throws Exception {
        WorkerConfig config = WorkerConfig.load();

        BrokerAddress address = config.brokerAddress();
        ClientSettings settings = config.clientSettings();

        assertThat(address.port, is(5672));
        assertThat(settings.pool_size, is(10));
        assertThat(settings.retry_delay_millis, is(5_000));
        assertThat(settings.app_id, equalTo("example-worker"));
    }

    @Test
    public void environment_variables_override_properties() {
        Properties prop = new Properties();
        prop.setProperty(WorkerConfig.HOST, "localhost");
        prop.setProperty(WorkerConfig.POOL_SIZE, "10");

        WorkerConfig.overlayEnvironment(prop, ImmutableMap.of(
                "RABBITMQ_HOST", "rabbit.internal",
                "RABBITMQ_POOL_SIZE", "3",
                "RABBITMQ_VHOST", "",
                "UNRELATED", "x"));
        WorkerConfig config = new WorkerConfig(prop);

        assertThat(config.brokerAddress().host, equalTo("rabbit.internal"));
        assertThat(config.brokerAddress().virtualHost, equalTo("/"));
        assertThat(config.clientSettings().pool_size, is(3));
    }

    @Test
    public void individual_keys_win_over_the_settings_json() {
        Properties prop = new Properties();
        prop.setProperty(WorkerConfig.CLIENT_SETTINGS, "{\"max_retry\": 7, \"pool_size\": 2}");
        prop.setProperty(WorkerConfig.MAX_RETRY, "1");

        ClientSettings settings = new WorkerConfig(prop).clientSettings();

        assertThat(settings.max_retry, is(1));
        assertThat(settings.pool_size, is(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void non_numeric_port_is_rejected() {
        Properties prop = new Properties();
        prop.setProperty(WorkerConfig.PORT, "amqp");

        new WorkerConfig(prop).brokerAddress();
    }
}
