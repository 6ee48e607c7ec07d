package dev.goodone.rabbit.example;

public class MailRequest {

    public String to;
    public String subject;
    public String body;

    public MailRequest() {
    }

    public MailRequest(String to, String subject, String body) {
        this.to = to;
        this.subject = subject;
        this.body = body;
    }

    @Override
    public String toString() {
        return "MailRequest{to='" + to + "', subject='" + subject + "'}";
    }
}
