package dev.goodone.rabbit.util;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ExponentialBackoffAlgorithmTest {

    @Test
    public void doubles_from_the_initial_delay() {
        ExponentialBackoffAlgorithm backoff = new ExponentialBackoffAlgorithm(1_000, 30_000);
        assertThat(backoff.getDelayMs(1), is(1_000));
        assertThat(backoff.getDelayMs(2), is(2_000));
        assertThat(backoff.getDelayMs(3), is(4_000));
        assertThat(backoff.getDelayMs(5), is(16_000));
    }

    @Test
    public void is_capped_at_the_max_delay() {
        ExponentialBackoffAlgorithm backoff = new ExponentialBackoffAlgorithm(1_000, 30_000);
        assertThat(backoff.getDelayMs(6), is(30_000));
        assertThat(backoff.getDelayMs(40), is(30_000));
    }

    @Test
    public void constant_backoff_ignores_the_attempt() {
        ConstantBackoffAlgorithm backoff = new ConstantBackoffAlgorithm(250);
        assertThat(backoff.getDelayMs(1), is(250));
        assertThat(backoff.getDelayMs(9), is(250));
    }
}
