package dev.goodone.rabbit;

import com.rabbitmq.client.BasicProperties;

/**
 * Convenience enum to map integer tags to descriptive delivery mode names.
 * The client publishes everything as {@link #persistent}.
 *
 * @see BasicProperties#getDeliveryMode()
 */
public enum DeliveryMode {
    non_persistent(1),
    persistent(2);

    public final int code;

    DeliveryMode(int code) {
        this.code = code;
    }

    public static DeliveryMode fromCode(Integer code) {
        if (code == null) {
            return non_persistent;
        }
        for (DeliveryMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown delivery mode " + code);
    }
}
