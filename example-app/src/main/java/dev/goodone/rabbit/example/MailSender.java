package dev.goodone.rabbit.example;

/**
 * Delivers one mail. Throwing makes the worker retry the request and, once retries are used up, dead-letter it.
 */
public interface MailSender {

    void send(MailRequest mail) throws Exception;
}
