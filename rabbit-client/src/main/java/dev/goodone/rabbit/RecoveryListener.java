package dev.goodone.rabbit;

/**
 * Notified after the client replaced a lost connection and rebuilt its channel pool.
 */
@FunctionalInterface
public interface RecoveryListener {

    void onRecovered(RabbitClient client);
}
