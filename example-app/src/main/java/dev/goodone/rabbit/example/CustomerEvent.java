package dev.goodone.rabbit.example;

public class CustomerEvent {

    public String customer_id;
    public String type;
    public long occurred_at;

    public CustomerEvent() {
    }

    public CustomerEvent(String customerId, String type, long occurredAt) {
        this.customer_id = customerId;
        this.type = type;
        this.occurred_at = occurredAt;
    }
}
