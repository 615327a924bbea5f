package com.questrail.push.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.model.Priority;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * Message
 * -----------------------------------------------------------------------------
 * One payload addressed to one or more devices.
 *
 * <p>A message expands into one {@link Notification} per device token. The
 * notifications share payload, expiration and priority, and each gets its
 * own identifier.</p>
 *
 * <h2>Payload encoding</h2>
 * The payload is JSON, serialized compactly (no insignificant whitespace) as
 * UTF-8 with non-ASCII characters left unescaped. Size limits are checked when
 * the message is sent, not here.
 *
 * <h2>Validation</h2>
 * Tokens must be hex strings; raw JSON payloads must parse; an expiration must
 * fit the unsigned 32-bit epoch-seconds range. Violations are reported as
 * {@link IllegalArgumentException} from {@link Builder#build()}.
 */
public final class Message
{
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    private final List<String> tokens;
    private final List<byte[]> encodedTokens;
    private final byte[] payload;
    private final Instant expiration;
    private final Priority priority;

    private Message(List<String> tokens, List<byte[]> encodedTokens, byte[] payload,
                    Instant expiration, Priority priority)
    {
        this.tokens = List.copyOf(tokens);
        this.encodedTokens = encodedTokens;
        this.payload = payload;
        this.expiration = expiration;
        this.priority = priority;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /** Convenience for a standard {@code aps} payload. */
    public static Message aps(Collection<String> tokens, ApsPayload aps)
    {
        return builder().tokens(tokens).payload(aps.toMap()).build();
    }

    /** Hex-encoded device tokens, as given. */
    public List<String> tokens()
    {
        return tokens;
    }

    /** Serialized payload bytes. */
    public byte[] payload()
    {
        return payload.clone();
    }

    public String payloadJson()
    {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public Optional<Instant> expiration()
    {
        return Optional.ofNullable(expiration);
    }

    public Priority priority()
    {
        return priority;
    }

    /**
     * Expand into one notification per token, in token order.
     *
     * @param identifiers source of identifiers, called once per token
     * @param enqueuedAt  diagnostic timestamp for every notification
     */
    public List<Notification> notifications(IntSupplier identifiers, Instant enqueuedAt)
    {
        Objects.requireNonNull(identifiers, "identifiers");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");

        final long wireExpiration = expiration == null ? 0L : expiration.getEpochSecond();

        List<Notification> notifications = new ArrayList<>(encodedTokens.size());
        for (byte[] token : encodedTokens) {
            notifications.add(new Notification(
                    identifiers.getAsInt(), token, payload, wireExpiration, priority, enqueuedAt));
        }
        return notifications;
    }

    @Override
    public String toString()
    {
        return "Message[tokens=" + tokens.size() + ", payload=" + payloadJson() + "]";
    }

    public static final class Builder
    {
        private final List<String> tokens = new ArrayList<>();
        private byte[] payload;
        private Instant expiration;
        private Priority priority = Priority.IMMEDIATE;

        public Builder token(String hexToken)
        {
            tokens.add(Objects.requireNonNull(hexToken, "hexToken"));
            return this;
        }

        public Builder tokens(Collection<String> hexTokens)
        {
            for (String token : Objects.requireNonNull(hexTokens, "hexTokens")) {
                token(token);
            }
            return this;
        }

        /**
         * Payload as a JSON object. Values may be any type Jackson can serialize
         * (maps, lists, strings, numbers, booleans).
         */
        public Builder payload(Map<String, ?> payload)
        {
            Objects.requireNonNull(payload, "payload");
            try {
                this.payload = JSON.writeValueAsBytes(payload);
            }
            catch (JsonProcessingException e) {
                throw new IllegalArgumentException("payload cannot be serialized as JSON", e);
            }
            return this;
        }

        /**
         * Payload as JSON text. The text must be a JSON object; it is re-emitted
         * in compact form.
         */
        public Builder payloadJson(String json)
        {
            Objects.requireNonNull(json, "json");
            try {
                JsonNode tree = JSON.readTree(json);
                if (tree == null || !tree.isObject()) {
                    throw new IllegalArgumentException("payload must be a JSON object");
                }
                this.payload = JSON.writeValueAsBytes(tree);
            }
            catch (JsonProcessingException e) {
                throw new IllegalArgumentException("payload is not valid JSON", e);
            }
            return this;
        }

        public Builder expiration(Instant expiration)
        {
            this.expiration = expiration;
            return this;
        }

        public Builder priority(Priority priority)
        {
            this.priority = Objects.requireNonNull(priority, "priority");
            return this;
        }

        public Message build()
        {
            if (tokens.isEmpty()) {
                throw new IllegalArgumentException("message has no device tokens");
            }
            if (payload == null) {
                throw new IllegalArgumentException("message has no payload");
            }
            if (expiration != null
                    && (expiration.getEpochSecond() < 0 || expiration.getEpochSecond() > Notification.MAX_EXPIRATION)) {
                throw new IllegalArgumentException("expiration out of range: " + expiration);
            }

            List<byte[]> encoded = new ArrayList<>(tokens.size());
            for (String token : tokens) {
                try {
                    encoded.add(HEX.parseHex(token));
                }
                catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("device token is not hex: " + token, e);
                }
            }
            return new Message(tokens, encoded, payload, expiration, priority);
        }
    }
}
