package com.cardaccess.domain.codec;

import com.cardaccess.domain.exception.ConversionException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.model.Permissions;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

/**
 * Codificación de tarjetas en el formato de cable: un objeto JSON con
 * exactamente los campos {@code id} y {@code permissions}.
 */
public final class CardJsonCodec {

    public static final String FIELD_ID = "id";
    public static final String FIELD_PERMISSIONS = "permissions";

    private static final int MAX_PERMISSION_BITS = 0xFF;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private CardJsonCodec() {
    }

    /**
     * Serializa una tarjeta a JSON en UTF-8.
     */
    public static byte[] encode(Card card) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(FIELD_ID, card.getId());
        node.put(FIELD_PERMISSIONS, card.getPermissions().bits());
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // Un ObjectNode de dos enteros siempre es serializable
            throw new IllegalStateException("No se pudo serializar la tarjeta " + card.getId(), e);
        }
    }

    /**
     * Reconstruye una tarjeta desde su representación JSON.
     *
     * @param bytes Buffer recibido
     * @return Tarjeta decodificada
     * @throws ConversionException si el buffer no es una tarjeta válida
     */
    public static Card decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ConversionException("No se puede convertir a tarjeta: buffer vacío", bytes);
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(decodeUtf8(bytes));
        } catch (IOException e) {
            throw ConversionException.malformed(bytes, e);
        }

        if (root == null || !root.isObject()) {
            throw new ConversionException("No se puede convertir a tarjeta: se esperaba un objeto JSON", bytes);
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!FIELD_ID.equals(name) && !FIELD_PERMISSIONS.equals(name)) {
                throw ConversionException.invalidField(name, "no es un campo conocido", bytes);
            }
        }

        int id = readUnsigned(root, FIELD_ID, Card.MAX_ID, bytes);
        int bits = readUnsigned(root, FIELD_PERMISSIONS, MAX_PERMISSION_BITS, bytes);

        if ((bits & ~Permissions.KNOWN_BITS) != 0) {
            throw ConversionException.invalidField(FIELD_PERMISSIONS,
                    String.format("contiene bits no reconocidos: 0x%X", bits & ~Permissions.KNOWN_BITS), bytes);
        }

        return new Card(id, Permissions.fromBits(bits));
    }

    /**
     * Decodifica el buffer como UTF-8 estricto; Jackson detectaría UTF-16/32 por su cuenta.
     */
    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static int readUnsigned(JsonNode root, String field, int max, byte[] bytes) {
        JsonNode value = root.get(field);
        if (value == null) {
            throw ConversionException.invalidField(field, "es obligatorio", bytes);
        }
        if (!value.isIntegralNumber()) {
            throw ConversionException.invalidField(field, "debe ser un entero sin signo", bytes);
        }
        if (!value.canConvertToLong() || value.longValue() < 0 || value.longValue() > max) {
            throw ConversionException.invalidField(field, "fuera de rango (0-" + max + ")", bytes);
        }
        return value.intValue();
    }
}
