package dev.goodone.rabbit.example;

import dev.goodone.rabbit.util.Logger;

/**
 * Stand-in transport that only logs the mail.
 */
public class LoggingMailSender implements MailSender {

    private static final Logger log = new Logger(LoggingMailSender.class);

    @Override
    public void send(MailRequest mail) {
        log.infoWithParams("Sending mail.",
                "to", mail.to,
                "subject", mail.subject);
    }
}
