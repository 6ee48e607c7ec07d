package dev.goodone.rabbit.tracing;

import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class HeaderCarrierTest {

    private static final String TRACEPARENT = "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01";

    @Test
    public void setter_writes_into_the_header_table() {
        Map<String, Object> headers = new HashMap<>();
        HeaderCarrier.SETTER.set(headers, "traceparent", TRACEPARENT);
        assertThat(headers.get("traceparent"), equalTo(TRACEPARENT));
    }

    @Test
    public void setter_ignores_missing_carrier() {
        HeaderCarrier.SETTER.set(null, "traceparent", TRACEPARENT);
    }

    @Test
    public void getter_reads_long_strings_from_the_wire() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("traceparent", LongStringHelper.asLongString(TRACEPARENT));
        headers.put("x-retry-count", 2);
        assertThat(HeaderCarrier.GETTER.get(headers, "traceparent"), equalTo(TRACEPARENT));
        assertThat(HeaderCarrier.GETTER.get(headers, "x-retry-count"), equalTo("2"));
        assertThat(HeaderCarrier.GETTER.get(headers, "tracestate"), nullValue());
        assertThat(HeaderCarrier.GETTER.keys(headers), containsInAnyOrder("traceparent", "x-retry-count"));
    }

    @Test
    public void getter_tolerates_missing_carrier() {
        assertThat(HeaderCarrier.GETTER.get(null, "traceparent"), nullValue());
    }
}
