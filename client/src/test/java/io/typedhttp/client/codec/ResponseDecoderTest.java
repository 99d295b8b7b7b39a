package io.typedhttp.client.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import io.typedhttp.spec.DecodingException;
import io.typedhttp.spec.ErrorKind;
import org.junit.jupiter.api.Test;

public class ResponseDecoderTest {

    record Address(String city, int zip) {
    }

    record User(String name, Address address, Instant createdAt) {
    }

    public static class Item {
        public String id;
        public int quantity;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testDecodesJsonIgnoringUnknownProperties() throws Exception {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        Object user = decoder.decode(bytes("{\"name\":\"ann\",\"extra\":true,\"address\":{\"city\":\"Oslo\",\"zip\":150},"
                + "\"createdAt\":\"2024-01-02T03:04:05Z\"}"), User.class, "GET /me");

        assertEquals(new User("ann", new Address("Oslo", 150), Instant.parse("2024-01-02T03:04:05Z")), user);
    }

    @Test
    public void testDecodesGenericTypes() throws Exception {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        Object users = decoder.decode(bytes("[{\"city\":\"Oslo\",\"zip\":1}]"),
                new TypeReference<List<Address>>() { }.getType(), "GET /addresses");

        assertEquals(List.of(new Address("Oslo", 1)), users);
    }

    @Test
    public void testDecodesXml() throws Exception {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.xml());

        Item item = (Item) decoder.decode(bytes("<Item><id>a1</id><quantity>3</quantity></Item>"), Item.class, "GET /item");

        assertEquals("a1", item.id);
        assertEquals(3, item.quantity);
    }

    @Test
    public void testFailureReportsLocation() {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        DecodingException e = assertThrows(DecodingException.class, () -> decoder.decode(
                bytes("{\"name\":\"ann\",\"address\":{\"city\":\"Oslo\",\"zip\":\"not a number\"}}"), User.class, "GET /me"));

        assertEquals(ErrorKind.DECODING, e.kind());
        assertEquals("GET /me", e.getEndpoint());
        assertTrue(e.getLocation().contains("[\"address\"]"), e.getLocation());
        assertTrue(e.getLocation().contains("[\"zip\"]"), e.getLocation());
    }

    @Test
    public void testMalformedBodyReportsLineAndColumn() {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        DecodingException e = assertThrows(DecodingException.class,
                () -> decoder.decode(bytes("{\"name\": ]"), User.class, "GET /me"));

        assertTrue(e.getLocation().startsWith("line 1"), e.getLocation());
    }

    @Test
    public void testEmptyBodyFails() {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        DecodingException e = assertThrows(DecodingException.class,
                () -> decoder.decode(new byte[0], User.class, "GET /me"));

        assertFalse(e.getLocation().isEmpty());
    }

    @Test
    public void testMissingRecordComponentFails() {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        DecodingException e = assertThrows(DecodingException.class,
                () -> decoder.decode(bytes("{\"city\":\"Oslo\"}"), Address.class, "GET /address"));

        assertTrue(e.getCause().getMessage().contains("zip"), e.getCause().getMessage());
    }

    @Test
    public void testNullRecordComponentFails() {
        ResponseDecoder decoder = new ResponseDecoder(ObjectMappers.json());

        assertThrows(DecodingException.class, () -> decoder.decode(
                bytes("{\"city\":null,\"zip\":1}"), Address.class, "GET /address"));
    }
}
