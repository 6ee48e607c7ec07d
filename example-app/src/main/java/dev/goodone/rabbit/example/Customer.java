package dev.goodone.rabbit.example;

public class Customer {

    public String customer_id;
    public String name;
    public String email;
    public String city;

    public Customer() {
    }

    public Customer(String customerId, String name, String email, String city) {
        this.customer_id = customerId;
        this.name = name;
        this.email = email;
        this.city = city;
    }
}
