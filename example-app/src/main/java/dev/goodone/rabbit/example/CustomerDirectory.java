package dev.goodone.rabbit.example;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory customer store backing the lookup RPC.
 */
public class CustomerDirectory {

    private final Map<String, Customer> customers = new ConcurrentHashMap<>();

    public void put(Customer customer) {
        customers.put(customer.customer_id, customer);
    }

    /**
     * @throws IllegalArgumentException for an unknown id, reported back to the caller as an application error
     */
    public Customer get(String customerId) {
        Customer customer = customerId == null ? null : customers.get(customerId);
        if (customer == null) {
            throw new IllegalArgumentException("unknown customer " + customerId);
        }
        return customer;
    }

    public int size() {
        return customers.size();
    }

    static CustomerDirectory withSampleData() {
        CustomerDirectory directory = new CustomerDirectory();
        directory.put(new Customer("1", "Ada Lovelace", "ada@example.com", "London"));
        directory.put(new Customer("2", "Grace Hopper", "grace@example.com", "Arlington"));
        return directory;
    }
}
