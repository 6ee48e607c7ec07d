package dev.goodone.rabbit;

import com.rabbitmq.client.ConnectionFactory;

import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;

import static com.rabbitmq.client.ConnectionFactory.DEFAULT_AMQP_PORT;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_HOST;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_PASS;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_USER;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_VHOST;

/**
 * The broker the client dials: host, port, credentials and virtual host.
 *
 * @see <a href="https://www.rabbitmq.com/uri-spec.html">AMQP URI spec</a>
 */
public class BrokerAddress {

    public final String username;
    public final String password;
    public final String virtualHost;
    public final String host;
    public final int port;

    private BrokerAddress(String username, String password, String virtualHost, String host, int port) {
        this.username = username;
        this.password = password;
        this.virtualHost = virtualHost;
        this.host = host;
        this.port = port;
    }

    /**
     * Copies the address into the given factory.
     */
    public void applyTo(ConnectionFactory cf) {
        cf.setHost(host);
        cf.setPort(port);
        cf.setUsername(username);
        cf.setPassword(password);
        cf.setVirtualHost(virtualHost);
    }

    // no credentials on purpose, this ends up in log lines
    @Override
    public String toString() {
        return "amqp://" + host + ":" + port + "/" + (virtualHost.equals("/") ? "" : virtualHost);
    }

    public static class Builder {

        private String username     = DEFAULT_USER;
        private String password     = DEFAULT_PASS;
        private String virtualHost  = DEFAULT_VHOST;
        private String host         = DEFAULT_HOST;
        private int port            = DEFAULT_AMQP_PORT;

        public BrokerAddress build() {
            return new BrokerAddress(username, password, virtualHost, host, port);
        }

        public Builder withUriString(String amqpUriString) {
            ConnectionFactory tmp = new ConnectionFactory();
            try {
                tmp.setUri(amqpUriString);
            } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException e) {
                throw new IllegalArgumentException("Invalid AMQP uri " + amqpUriString, e);
            }
            username = tmp.getUsername();
            password = tmp.getPassword();
            virtualHost = tmp.getVirtualHost();
            host = tmp.getHost();
            port = tmp.getPort();
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }
    }
}
